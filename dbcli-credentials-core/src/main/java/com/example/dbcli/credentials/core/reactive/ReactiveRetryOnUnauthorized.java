package com.example.dbcli.credentials.core.reactive;

import com.example.dbcli.credentials.core.UnauthorizedDetector;
import com.example.dbcli.credentials.core.keys.KeyProvider;
import java.util.function.Function;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * Non-blocking retry-once policy for callers that return {@link Mono}.
 *
 * <p>The secret is obtained on the bounded-elastic scheduler because providers may read files or
 * call the control plane. On an unauthorized failure the provider refreshes, again off the caller's
 * thread, and the operation is resubscribed with the refreshed secret. A second failure reaches the
 * subscriber unchanged.
 */
public final class ReactiveRetryOnUnauthorized {

  private static final System.Logger LOGGER =
      System.getLogger(ReactiveRetryOnUnauthorized.class.getName());

  private ReactiveRetryOnUnauthorized() {}

  /**
   * Runs {@code operation} with the provider's secret, using the default detector.
   *
   * @param provider secret provider
   * @param operation the call, receiving the secret
   * @param <T> result type
   * @return a Mono of the operation result
   */
  public static <T> Mono<T> run(
      final KeyProvider provider, final Function<String, Mono<T>> operation) {
    return run(provider, operation, UnauthorizedDetector.defaultDetector());
  }

  /**
   * Runs {@code operation} with the provider's secret.
   *
   * @param provider secret provider
   * @param operation the call, receiving the secret
   * @param detector decides whether a failure means the secret was rejected
   * @param <T> result type
   * @return a Mono of the operation result
   */
  public static <T> Mono<T> run(
      final KeyProvider provider,
      final Function<String, Mono<T>> operation,
      final UnauthorizedDetector detector) {
    return Mono.fromCallable(provider::getOrRefresh)
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(operation)
        .retryWhen(authRetry(provider, detector));
  }

  private static Retry authRetry(
      final KeyProvider provider, final UnauthorizedDetector detector) {
    return Retry.max(1)
        .filter(detector::isUnauthorized)
        .doBeforeRetryAsync(
            signal ->
                Mono.fromRunnable(
                        () -> {
                          LOGGER.log(
                              System.Logger.Level.WARNING,
                              "Unauthorized response, refreshing credentials");
                          provider.onInvalidCreds(asRuntime(signal.failure()));
                        })
                    .subscribeOn(Schedulers.boundedElastic())
                    .then())
        .onRetryExhaustedThrow((retry, signal) -> signal.failure());
  }

  private static RuntimeException asRuntime(final Throwable failure) {
    return failure instanceof RuntimeException
        ? (RuntimeException) failure
        : new IllegalStateException(failure);
  }
}
