package org.javai.restretry.classify;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.javai.restretry.Failure;

/**
 * Classifies exceptions into structured failures.
 * Classification must depend only on the exception, never on attempt count or policy.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception into a Failure.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return A classified Failure
     */
    Failure classify(String operation, Throwable throwable);

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * future composition adds around the exception an operation actually raised.
     */
    static Throwable unwrap(Throwable throwable) {
        Throwable t = throwable;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
