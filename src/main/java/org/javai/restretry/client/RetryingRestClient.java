package org.javai.restretry.client;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.javai.restretry.ops.FailureReporter;
import org.javai.restretry.retry.Retrier;
import org.javai.restretry.retry.RetryPolicy;

/**
 * A {@link RestClient} that retries the calls it forwards to another RestClient.
 *
 * <p>Inject it wherever the wrapped client was injected; callers need no changes.
 * Per call:
 * <ul>
 *   <li>success on any attempt completes with the value and reports nothing;</li>
 *   <li>transient failures (see {@link org.javai.restretry.classify.TransportFailureClassifier})
 *       are retried; once attempts run out the last one is reported and the call completes
 *       with {@code null};</li>
 *   <li>any other failure is reported and the call fails with the original exception,
 *       without further attempts.</li>
 * </ul>
 *
 * <p>A {@code null} result is ambiguous: it is what the wrapped client returned, or it means
 * retries were exhausted. The reporter is the only place the difference shows.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RestClient client = new RetryingRestClient(httpClient, new Log4jFailureReporter());
 * CompletableFuture<Customer> customer = client.get("/customers/42", Customer.class);
 * }</pre>
 */
public class RetryingRestClient implements RestClient {

    private final RestClient delegate;
    private final Retrier retrier;

    /**
     * Retries up to 3 attempts, 5 seconds apart.
     */
    public RetryingRestClient(RestClient delegate, FailureReporter reporter) {
        this(delegate, Retrier.of(RetryPolicy.defaults(), reporter));
    }

    public RetryingRestClient(RestClient delegate, FailureReporter reporter, int maxAttempts, Duration retryDelay) {
        this(delegate, Retrier.of(RetryPolicy.of(maxAttempts, retryDelay), reporter));
    }

    public RetryingRestClient(RestClient delegate, Retrier retrier) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
    }

    @Override
    public <T> CompletableFuture<T> get(String url, Class<T> type) {
        return retrier.execute("RestClient.get", Map.of("url", String.valueOf(url)),
                () -> delegate.get(url, type));
    }

    @Override
    public <T> CompletableFuture<T> put(String url, T model) {
        return retrier.execute("RestClient.put", Map.of("url", String.valueOf(url)),
                () -> delegate.put(url, model));
    }

    @Override
    public <T> CompletableFuture<T> post(String url, T model) {
        return retrier.execute("RestClient.post", Map.of("url", String.valueOf(url)),
                () -> delegate.post(url, model));
    }

    @Override
    public <T> CompletableFuture<T> delete(int id, Class<T> type) {
        return retrier.execute("RestClient.delete", Map.of("id", String.valueOf(id)),
                () -> delegate.delete(id, type));
    }

    public RetryPolicy policy() {
        return retrier.policy();
    }
}
