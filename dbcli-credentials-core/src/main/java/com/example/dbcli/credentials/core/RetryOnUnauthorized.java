package com.example.dbcli.credentials.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dbcli.credentials.core.keys.KeyProvider;

/**
 * Runs a secret-authenticated call and, when the credential is rejected, refreshes it through the
 * owning {@link KeyProvider} and retries exactly once.
 *
 * <p>The refresh completes before the retried call is issued. Any failure the detector does not
 * classify as unauthorized, and any failure of the retried call, propagates unchanged.
 *
 * <pre>{@code
 * var rows = RetryOnUnauthorized.run(
 *     credentials.databaseKeys(),
 *     secret -> queryClient.query(secret, "Collection.all()"));
 * }</pre>
 */
public final class RetryOnUnauthorized {

  private static final System.Logger LOGGER =
      System.getLogger(RetryOnUnauthorized.class.getName());

  private RetryOnUnauthorized() {}

  /**
   * Operation authenticated with a secret.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SecretOperation<T> {
    /**
     * Executes the operation with the given secret.
     *
     * @param secret the bearer value to authenticate with
     * @return operation result
     */
    T apply(String secret);
  }

  /**
   * Resolves the provider's current secret and runs the operation with the default detector.
   *
   * @param provider owner of the secret
   * @param operation the call to run
   * @param <T> result type
   * @return operation result
   */
  public static <T> T run(final KeyProvider provider, final SecretOperation<T> operation) {
    return run(
        provider.getOrRefresh(), provider, operation, UnauthorizedDetector.defaultDetector());
  }

  /**
   * Runs the operation with {@code initialSecret}; on an unauthorized failure asks the provider to
   * handle the invalid credential, resolves a fresh secret and runs the operation once more.
   *
   * @param initialSecret secret for the first attempt
   * @param provider owner of the secret, consulted only after an unauthorized failure
   * @param operation the call to run
   * @param detector classifies unauthorized failures
   * @param <T> result type
   * @return operation result
   */
  public static <T> T run(
      final String initialSecret,
      final KeyProvider provider,
      final SecretOperation<T> operation,
      final UnauthorizedDetector detector) {
    try {
      return operation.apply(initialSecret);
    } catch (final RuntimeException e) {
      if (!detector.isUnauthorized(e)) throw e;

      LOGGER.log(WARNING, "Credential rejected, refreshing before a single retry");
      provider.onInvalidCreds(e);
      final var refreshed = provider.getOrRefresh();

      LOGGER.log(DEBUG, "Retrying with refreshed credential");
      return operation.apply(refreshed);
    }
  }
}
