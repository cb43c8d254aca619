package com.example.dbcli.credentials.core.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Settings of the credential subsystem.
 *
 * <p>{@link #fromEnvironment()} reads each value from a system property, then from an environment
 * variable, then falls back to a default:
 *
 * <ul>
 *   <li>dbcli.account.url / DBCLI_ACCOUNT_URL (default https://account.fauna.com)
 *   <li>dbcli.credentials.dir / DBCLI_CREDENTIALS_DIR (default ~/.dbcli/credentials)
 *   <li>dbcli.client.id / DBCLI_CLIENT_ID
 *   <li>dbcli.client.secret / DBCLI_CLIENT_SECRET (optional, PKCE clients are public)
 *   <li>dbcli.secret.ttl.minutes / DBCLI_SECRET_TTL_MINUTES (default 15)
 *   <li>dbcli.login.timeout.seconds / DBCLI_LOGIN_TIMEOUT_SECONDS (default 300)
 *   <li>dbcli.http.timeout.seconds / DBCLI_HTTP_TIMEOUT_SECONDS (default 30)
 *   <li>dbcli.local.secret / DBCLI_LOCAL_SECRET (default "secret")
 * </ul>
 *
 * @param accountUrl base URL of the control-plane API
 * @param credentialsDir directory holding the credential JSON documents
 * @param clientId OAuth client identifier
 * @param clientSecret OAuth client secret, empty for a public client
 * @param secretTtl lifetime of minted database secrets
 * @param loginTimeout how long the login listener waits for the browser redirect
 * @param httpTimeout request timeout for control-plane calls
 * @param localSecret secret used against a local database when none is supplied
 */
public record CredentialsConfig(
    URI accountUrl,
    Path credentialsDir,
    String clientId,
    String clientSecret,
    Duration secretTtl,
    Duration loginTimeout,
    Duration httpTimeout,
    String localSecret) {

  public static final URI DEFAULT_ACCOUNT_URL = URI.create("https://account.fauna.com");
  public static final String DEFAULT_CLIENT_ID = "-_vEB3FKRoWbJdFpMg72Mx0UVAA";
  public static final Duration DEFAULT_SECRET_TTL = Duration.ofMinutes(15);
  public static final Duration DEFAULT_LOGIN_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
  public static final String DEFAULT_LOCAL_SECRET = "secret";

  public CredentialsConfig {
    if (accountUrl == null) throw new IllegalArgumentException("accountUrl must not be null");
    if (credentialsDir == null)
      throw new IllegalArgumentException("credentialsDir must not be null");
    if (secretTtl == null || secretTtl.isNegative() || secretTtl.isZero())
      throw new IllegalArgumentException("secretTtl must be > 0");
    if (loginTimeout == null || loginTimeout.isNegative() || loginTimeout.isZero())
      throw new IllegalArgumentException("loginTimeout must be > 0");
    if (httpTimeout == null || httpTimeout.isNegative() || httpTimeout.isZero())
      throw new IllegalArgumentException("httpTimeout must be > 0");
    clientId = Optional.ofNullable(clientId).orElse(DEFAULT_CLIENT_ID);
    clientSecret = Optional.ofNullable(clientSecret).orElse("");
    localSecret = Optional.ofNullable(localSecret).orElse(DEFAULT_LOCAL_SECRET);
  }

  /**
   * Defaults for everything except the credentials directory.
   *
   * @param credentialsDir directory holding the credential JSON documents
   * @return configuration with default endpoints and timeouts
   */
  public static CredentialsConfig defaults(final Path credentialsDir) {
    return new CredentialsConfig(
        DEFAULT_ACCOUNT_URL,
        credentialsDir,
        DEFAULT_CLIENT_ID,
        "",
        DEFAULT_SECRET_TTL,
        DEFAULT_LOGIN_TIMEOUT,
        DEFAULT_HTTP_TIMEOUT,
        DEFAULT_LOCAL_SECRET);
  }

  /**
   * Resolves the configuration from system properties and environment variables.
   *
   * @return resolved configuration
   */
  public static CredentialsConfig fromEnvironment() {
    return new CredentialsConfig(
        setting("dbcli.account.url", "DBCLI_ACCOUNT_URL")
            .map(URI::create)
            .orElse(DEFAULT_ACCOUNT_URL),
        setting("dbcli.credentials.dir", "DBCLI_CREDENTIALS_DIR")
            .map(Path::of)
            .orElseGet(
                () -> Path.of(System.getProperty("user.home"), ".dbcli", "credentials")),
        setting("dbcli.client.id", "DBCLI_CLIENT_ID").orElse(DEFAULT_CLIENT_ID),
        setting("dbcli.client.secret", "DBCLI_CLIENT_SECRET").orElse(""),
        duration("dbcli.secret.ttl.minutes", "DBCLI_SECRET_TTL_MINUTES", Duration::ofMinutes)
            .orElse(DEFAULT_SECRET_TTL),
        duration("dbcli.login.timeout.seconds", "DBCLI_LOGIN_TIMEOUT_SECONDS", Duration::ofSeconds)
            .orElse(DEFAULT_LOGIN_TIMEOUT),
        duration("dbcli.http.timeout.seconds", "DBCLI_HTTP_TIMEOUT_SECONDS", Duration::ofSeconds)
            .orElse(DEFAULT_HTTP_TIMEOUT),
        setting("dbcli.local.secret", "DBCLI_LOCAL_SECRET").orElse(DEFAULT_LOCAL_SECRET));
  }

  private static Optional<String> setting(final String property, final String envVar) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(envVar)))
        .map(String::trim)
        .filter(val -> !val.isBlank());
  }

  private static Optional<Duration> duration(
      final String property, final String envVar, final Function<Long, Duration> unit) {
    return setting(property, envVar)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .filter(parsed -> parsed > 0)
        .map(unit);
  }
}
