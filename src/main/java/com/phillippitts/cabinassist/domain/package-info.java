/**
 * Immutable domain model shared across the orchestration engine: conversation context
 * snapshots, turns, NLU and dialogue results, and vehicle commands.
 *
 * @since 1.0
 */
package com.phillippitts.cabinassist.domain;
