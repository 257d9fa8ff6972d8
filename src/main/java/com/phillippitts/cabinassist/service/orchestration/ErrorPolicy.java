package com.phillippitts.cabinassist.service.orchestration;

import com.phillippitts.cabinassist.exception.CommandExecutionException;
import com.phillippitts.cabinassist.exception.IntegrityCheckException;
import com.phillippitts.cabinassist.exception.RecoveryFailedException;
import com.phillippitts.cabinassist.exception.SchemaMismatchException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies errors into {@link ErrorSeverity}.
 *
 * <p>Wrapper exceptions from futures are unwrapped first. Unknown exception types are treated
 * as transient; JVM {@link Error}s are fatal.
 */
public final class ErrorPolicy {

    private ErrorPolicy() {
    }

    public static ErrorSeverity classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof IntegrityCheckException || t instanceof RecoveryFailedException || t instanceof Error) {
            return ErrorSeverity.FATAL;
        }
        if (t instanceof SchemaMismatchException
                || t instanceof CommandExecutionException
                || t instanceof IllegalArgumentException) {
            return ErrorSeverity.VALIDATION;
        }
        return ErrorSeverity.TRANSIENT;
    }

    public static boolean isFatal(Throwable error) {
        return classify(error) == ErrorSeverity.FATAL;
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
