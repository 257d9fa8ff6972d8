/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.cabinassist.exception.CabinAssistException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.cabinassist.exception.ComponentFailureException} - External
 *       collaborator failed or timed out (transient)</li>
 *   <li>{@link com.phillippitts.cabinassist.exception.SchemaMismatchException} - Context update
 *       does not fit the context schema (validation)</li>
 *   <li>{@link com.phillippitts.cabinassist.exception.CommandExecutionException} - Malformed
 *       vehicle command payload (validation)</li>
 *   <li>{@link com.phillippitts.cabinassist.exception.IntegrityCheckException} - Startup
 *       integrity verification failed (fatal)</li>
 *   <li>{@link com.phillippitts.cabinassist.exception.RecoveryFailedException} - Components
 *       stayed failed after their restart budget (fatal)</li>
 * </ul>
 *
 * <p>Severity is assigned by
 * {@link com.phillippitts.cabinassist.service.orchestration.ErrorPolicy}, which routes
 * transient and validation errors to logging plus a spoken apology, and fatal errors to
 * emergency shutdown.
 *
 * @since 1.0
 */
package com.phillippitts.cabinassist.exception;
