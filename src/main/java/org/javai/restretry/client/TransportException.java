package org.javai.restretry.client;

/**
 * Raised by a {@link RestClient} implementation when the transport fails to produce a usable
 * response: the connection broke, or the server answered with a status outside 2xx/3xx.
 *
 * <p>The default classifier treats this exception as transient.
 */
public class TransportException extends RuntimeException {

    /** Marker for failures that happened before any status line was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String url;

    public TransportException(String message, String url) {
        this(message, url, NO_STATUS, null);
    }

    public TransportException(String message, String url, Throwable cause) {
        this(message, url, NO_STATUS, cause);
    }

    public TransportException(String message, String url, int statusCode) {
        this(message, url, statusCode, null);
    }

    public TransportException(String message, String url, int statusCode, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    /**
     * Creates an exception for an HTTP response with a non-success status.
     */
    public static TransportException forStatus(String url, int statusCode) {
        return new TransportException("HTTP " + statusCode + " from " + url, url, statusCode);
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }

    public String url() {
        return url;
    }
}
