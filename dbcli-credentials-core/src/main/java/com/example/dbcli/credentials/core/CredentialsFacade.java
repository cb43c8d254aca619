package com.example.dbcli.credentials.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.dbcli.credentials.core.RetryOnUnauthorized.SecretOperation;
import com.example.dbcli.credentials.core.api.AccountApi;
import com.example.dbcli.credentials.core.api.HttpAccountApi;
import com.example.dbcli.credentials.core.config.CredentialsConfig;
import com.example.dbcli.credentials.core.keys.AccountKeyManager;
import com.example.dbcli.credentials.core.keys.CredentialSource;
import com.example.dbcli.credentials.core.keys.DatabaseKeyManager;
import com.example.dbcli.credentials.core.store.AccountKeyEntry;
import com.example.dbcli.credentials.core.store.AccountKeyStore;
import com.example.dbcli.credentials.core.store.SecretKeyStore;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Credentials of one command invocation: the account credential of the active profile and the
 * database secret of the target database.
 *
 * <p>The caller owns the instance and passes it to every operation that needs a secret.
 *
 * <pre>{@code
 * var credentials = CredentialsFacade.construct(
 *     CredentialOptions.builder().database("us/mydb").role("admin").build());
 *
 * var result = credentials.withDatabaseSecret(secret -> queryClient.query(secret, fql));
 * }</pre>
 */
public class CredentialsFacade {

  private static final System.Logger LOGGER = System.getLogger(CredentialsFacade.class.getName());

  private final AccountKeyManager accountKeys;
  private final DatabaseKeyManager databaseKeys;
  private final AccountKeyStore accountKeyStore;
  private final SecretKeyStore secretKeyStore;
  private final AccountApi accountApi;

  CredentialsFacade(
      final AccountKeyManager accountKeys,
      final DatabaseKeyManager databaseKeys,
      final AccountKeyStore accountKeyStore,
      final SecretKeyStore secretKeyStore,
      final AccountApi accountApi) {
    this.accountKeys = accountKeys;
    this.databaseKeys = databaseKeys;
    this.accountKeyStore = accountKeyStore;
    this.secretKeyStore = secretKeyStore;
    this.accountApi = accountApi;
  }

  /**
   * Builds the credentials with configuration from system properties and environment variables.
   *
   * @param options credential inputs of the invocation
   * @return the credentials of this invocation
   */
  public static CredentialsFacade construct(final CredentialOptions options) {
    final var config = CredentialsConfig.fromEnvironment();
    return construct(options, config, new HttpAccountApi(config), Clock.systemUTC());
  }

  /**
   * Validates the inputs, resolves both credentials and purges orphaned database secrets.
   *
   * @param options credential inputs of the invocation
   * @param config subsystem configuration
   * @param accountApi control-plane client
   * @param clock time source for secret expiry
   * @return the credentials of this invocation
   * @throws ValidationException if the inputs combine illegally
   */
  public static CredentialsFacade construct(
      final CredentialOptions options,
      final CredentialsConfig config,
      final AccountApi accountApi,
      final Clock clock) {
    validate(options);

    final var accountKeyStore = new AccountKeyStore(config.credentialsDir());
    final var accountKeys =
        new AccountKeyManager(options.profile(), options.accountKey(), accountKeyStore, accountApi);

    final var secretKeyStore = new SecretKeyStore(config.credentialsDir(), accountKeys.key());
    final var explicitSecret =
        options.local()
            ? Optional.ofNullable(options.secret())
                .filter(secret -> !secret.isBlank())
                .orElse(config.localSecret())
            : options.secret();
    final var databaseKeys =
        new DatabaseKeyManager(
            options.database(),
            options.role(),
            explicitSecret,
            secretKeyStore,
            accountKeys,
            accountApi,
            config.secretTtl(),
            clock);
    accountKeys.onRotation(databaseKeys::updateAccountKeyNamespace);

    final var facade =
        new CredentialsFacade(
            accountKeys, databaseKeys, accountKeyStore, secretKeyStore, accountApi);
    facade.cleanupOrphans();
    return facade;
  }

  /**
   * Rejects input combinations that cannot be honored together. Local mode permits all of them.
   *
   * @param options credential inputs of the invocation
   * @throws ValidationException on the first illegal combination
   */
  public static void validate(final CredentialOptions options) {
    if (!options.local()) {
      rejectTogether("accountKey", options.accountKey(), "secret", options.secret());
      rejectTogether("secret", options.secret(), "database", options.database());
      rejectTogether("secret", options.secret(), "role", options.role());
    }

    if (isSet(options.user()) && isSet(options.accountKey())) {
      LOGGER.log(
          DEBUG,
          "Both 'user' and 'accountKey' were specified. 'accountKey' will be used to mint"
              + " database secrets. 'user' will be ignored.");
    }
  }

  private static void rejectTogether(
      final String first, final String firstValue, final String second, final String secondValue) {
    if (isSet(firstValue) && isSet(secondValue)) {
      throw new ValidationException(
          "Cannot use both the '--"
              + first
              + "' and '--"
              + second
              + "' options together. Please specify only one.");
    }
  }

  private static boolean isSet(final String value) {
    return value != null && !value.isBlank();
  }

  /**
   * Deletes every secret namespace whose account credential is no longer stored for any profile.
   *
   * @return number of namespaces removed
   */
  public int cleanupOrphans() {
    final var knownAccountKeys =
        accountKeyStore.getFile().values().stream()
            .filter(Objects::nonNull)
            .map(AccountKeyEntry::accountKey)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());

    var removed = 0;
    for (final var namespace : secretKeyStore.namespaces()) {
      if (!knownAccountKeys.contains(namespace) && secretKeyStore.delete(namespace)) removed++;
    }
    if (removed > 0) LOGGER.log(DEBUG, "Removed {0} orphaned secret namespace(s)", removed);
    return removed;
  }

  /**
   * Exchanges an OAuth access token for a control-plane session and installs it as the profile's
   * account credential.
   *
   * @param accessToken OAuth access token
   */
  public void login(final String accessToken) {
    final var session = accountApi.getSession(accessToken);
    accountKeys.install(session);
    LOGGER.log(INFO, "Signed in profile {0}", accountKeys.profile());
  }

  /**
   * Removes the profile's stored session and the secrets it minted.
   *
   * @return true if a stored session existed
   */
  public boolean logout() {
    final var existed = accountKeys.logout();
    cleanupOrphans();
    return existed;
  }

  /**
   * Runs a data-plane call with the database secret, minting a new secret and retrying once if the
   * secret is rejected. A stored secret that is still rejected after that ends in the login prompt.
   *
   * @param operation the call, receiving the database secret
   * @param <T> result type
   * @return operation result
   */
  public <T> T withDatabaseSecret(final SecretOperation<T> operation) {
    try {
      return RetryOnUnauthorized.run(databaseKeys, operation);
    } catch (final RuntimeException e) {
      if (databaseKeys.source() == CredentialSource.STORED
          && UnauthorizedDetector.defaultDetector().isUnauthorized(e)) {
        throw accountKeys.promptLogin(e);
      }
      throw e;
    }
  }

  /**
   * Runs a control-plane call with the account credential, refreshing it and retrying once if it
   * is rejected.
   *
   * @param operation the call, receiving the account credential
   * @param <T> result type
   * @return operation result
   */
  public <T> T withAccountKey(final SecretOperation<T> operation) {
    return accountKeys.callWithRefresh(operation);
  }

  public AccountKeyManager accountKeys() {
    return accountKeys;
  }

  public DatabaseKeyManager databaseKeys() {
    return databaseKeys;
  }
}
