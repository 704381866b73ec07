package org.javai.restretry.classify;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.javai.restretry.Failure;
import org.javai.restretry.FailureId;
import org.javai.restretry.client.TransportException;

/**
 * Classifies transport-level exceptions as transient and everything else as fatal.
 *
 * <p>Transient: {@link TransportException}, connection refused, socket and HTTP timeouts,
 * unknown host, {@link TimeoutException}, and any other {@link IOException} (checked or wrapped
 * in {@link UncheckedIOException}). Wrappers added by future composition are looked
 * through, see {@link FailureClassifier#unwrap(Throwable)}.
 *
 * <p>Mappings are checked in order, so specific types come before their supertypes.
 */
public class TransportFailureClassifier implements FailureClassifier {

    private record TransientMapping(Class<? extends Throwable> type, String namespace, String code, String prefix) {}

    private static final List<TransientMapping> MAPPINGS = List.of(
            new TransientMapping(TransportException.class, "http", "transport", "Transport error"),
            new TransientMapping(ConnectException.class, "network", "connection_refused", "Connection refused"),
            new TransientMapping(SocketTimeoutException.class, "network", "timeout", "Socket timeout"),
            new TransientMapping(HttpTimeoutException.class, "network", "http_timeout", "HTTP timeout"),
            new TransientMapping(UnknownHostException.class, "network", "unknown_host", "Unknown host"),
            new TransientMapping(TimeoutException.class, "operation", "timeout", "Operation timeout"),
            new TransientMapping(UncheckedIOException.class, "io", "io_error", "IO error"),
            new TransientMapping(IOException.class, "io", "io_error", "IO error")
    );

    @Override
    public Failure classify(String operation, Throwable throwable) {
        Throwable t = FailureClassifier.unwrap(throwable);
        return MAPPINGS.stream()
                .filter(m -> m.type().isInstance(t))
                .findFirst()
                .map(m -> Failure.transientFailure(
                        FailureId.of(m.namespace(), codeFor(m, t)),
                        messageFor(m.prefix(), t),
                        operation,
                        t))
                .orElseGet(() -> fatal(operation, t));
    }

    private static String codeFor(TransientMapping mapping, Throwable t) {
        if (t instanceof TransportException te && te.hasStatus()) {
            return "status_" + te.statusCode();
        }
        return mapping.code();
    }

    private static Failure fatal(String operation, Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return Failure.fatal(
                FailureId.of("fatal", typeName(t)),
                message,
                operation,
                t
        );
    }

    private static String typeName(Throwable t) {
        String simple = t.getClass().getSimpleName();
        // anonymous classes have no simple name
        return simple.isEmpty() ? t.getClass().getName() : simple;
    }

    private static String messageFor(String prefix, Throwable t) {
        return prefix + ": " + t.getMessage();
    }
}
