package org.javai.restretry.client;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to a remote REST resource.
 *
 * <p>Each operation returns a future that completes with the resource, or with {@code null}
 * when there is no value to return. Transport problems complete the future exceptionally,
 * typically with a {@link TransportException} or an {@link java.io.IOException}.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface RestClient {

    /**
     * Fetches the resource at {@code url}.
     */
    <T> CompletableFuture<T> get(String url, Class<T> type);

    /**
     * Replaces the resource at {@code url} with {@code model}.
     */
    <T> CompletableFuture<T> put(String url, T model);

    /**
     * Creates {@code model} under {@code url}.
     */
    <T> CompletableFuture<T> post(String url, T model);

    /**
     * Deletes the resource with the given id.
     */
    <T> CompletableFuture<T> delete(int id, Class<T> type);
}
