package com.example.dbcli.credentials.core.keys;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.dbcli.credentials.core.AuthenticationException;
import com.example.dbcli.credentials.core.InvalidCredentialException;
import com.example.dbcli.credentials.core.LoginRequiredException;
import com.example.dbcli.credentials.core.RetryOnUnauthorized;
import com.example.dbcli.credentials.core.RetryOnUnauthorized.SecretOperation;
import com.example.dbcli.credentials.core.UnauthorizedDetector;
import com.example.dbcli.credentials.core.api.AccountApi;
import com.example.dbcli.credentials.core.api.Session;
import com.example.dbcli.credentials.core.store.AccountKeyEntry;
import com.example.dbcli.credentials.core.store.AccountKeyStore;
import java.util.function.Consumer;

/**
 * Account credential of one local profile.
 *
 * <p>The credential comes from user input when given, otherwise from the {@link AccountKeyStore}.
 * A stored credential is refreshed with its refresh token when it is missing or rejected; a
 * user-provided one never is. After every refresh the rotation listener receives the new value so
 * that database secrets are filed under the current account credential.
 */
public class AccountKeyManager implements KeyProvider {

  private static final System.Logger LOGGER = System.getLogger(AccountKeyManager.class.getName());

  private final String profile;
  private final AccountKeyStore store;
  private final AccountApi accountApi;
  private final CredentialSource source;
  private volatile String key;
  private Consumer<String> rotationListener = newKey -> {};

  /**
   * Resolves the account credential for {@code profile}.
   *
   * @param profile local user alias the stored credential is filed under
   * @param explicitAccountKey account credential from a flag or environment variable, may be null
   * @param store account credential store
   * @param accountApi control-plane client used for refreshes
   */
  public AccountKeyManager(
      final String profile,
      final String explicitAccountKey,
      final AccountKeyStore store,
      final AccountApi accountApi) {
    this.profile = profile;
    this.store = store;
    this.accountApi = accountApi;

    final var stored = store.get(profile).map(AccountKeyEntry::accountKey).orElse(null);
    final var resolved = resolve(explicitAccountKey, stored);
    this.key = resolved.value();
    this.source = resolved.source();
  }

  /**
   * Applies the precedence rule. A stored but missing value is allowed and triggers a refresh
   * later.
   *
   * @param explicitAccountKey user input, may be null
   * @param storedAccountKey value from the credentials file, may be null
   * @return resolved value and source
   */
  public static ResolvedKey resolve(
      final String explicitAccountKey, final String storedAccountKey) {
    return ResolvedKey.resolve(explicitAccountKey, storedAccountKey);
  }

  /** Registers the callback that receives every new account credential. */
  public void onRotation(final Consumer<String> listener) {
    this.rotationListener = listener;
  }

  @Override
  public String key() {
    return key;
  }

  public CredentialSource source() {
    return source;
  }

  public String profile() {
    return profile;
  }

  /**
   * Returns the account credential, refreshing a stored one that is not available in memory or in
   * the credentials file.
   *
   * @return account credential
   * @throws LoginRequiredException if a refresh is needed but impossible
   */
  @Override
  public String getOrRefresh() {
    if (source == CredentialSource.STORED && key == null) {
      final var stored = store.get(profile).map(AccountKeyEntry::accountKey).orElse(null);
      if (stored == null || stored.isBlank()) {
        LOGGER.log(DEBUG, "No account key stored for profile {0}, refreshing", profile);
        refresh();
      } else {
        key = stored;
      }
    }
    return key;
  }

  /**
   * Exchanges the stored refresh token for a new session, persists it and publishes the new
   * account credential.
   *
   * @throws LoginRequiredException if no refresh token is stored or the refresh is rejected
   */
  public void refresh() {
    final var existing = store.get(profile);
    final var refreshToken = existing.map(AccountKeyEntry::refreshToken).orElse(null);
    if (refreshToken == null || refreshToken.isBlank()) {
      throw promptLogin(null);
    }

    final Session session;
    try {
      session = accountApi.refreshSession(refreshToken);
    } catch (final AuthenticationException e) {
      throw promptLogin(e);
    }
    LOGGER.log(INFO, "Refreshed account session for profile {0}", profile);
    install(session);
  }

  /**
   * Stores a fresh session as this profile's account credential.
   *
   * @param session session returned by the control plane
   */
  public void install(final Session session) {
    store.save(profile, new AccountKeyEntry(session.accountKey(), session.refreshToken()));
    key = session.accountKey();
    rotationListener.accept(session.accountKey());
  }

  /**
   * Fails for a user-provided credential, refreshes a stored one.
   *
   * @param cause the failure that reported the credential as invalid
   */
  @Override
  public void onInvalidCreds(final RuntimeException cause) {
    if (source != CredentialSource.STORED) {
      throw new InvalidCredentialException(
          "Account key provided by "
              + source
              + " is invalid. Please provide an updated account key.",
          source,
          cause);
    }
    refresh();
  }

  /**
   * Runs a control-plane call authenticated with the account credential. A rejected credential is
   * refreshed once; a second rejection ends in the login prompt.
   *
   * @param operation the call, receiving the account credential
   * @param <T> result type
   * @return operation result
   */
  public <T> T callWithRefresh(final SecretOperation<T> operation) {
    try {
      return RetryOnUnauthorized.run(this, operation);
    } catch (final RuntimeException e) {
      if (UnauthorizedDetector.defaultDetector().isUnauthorized(e)) {
        LOGGER.log(DEBUG, "Failed to refresh session, expired or missing refresh token");
        throw promptLogin(e);
      }
      throw e;
    }
  }

  /** Removes this profile's stored session. */
  public boolean logout() {
    key = null;
    return store.delete(profile);
  }

  /**
   * Builds the fatal "please log in" error for this profile. Callers throw the result, which ends
   * the invocation with exit code 1.
   *
   * @param cause failure that made the login necessary, may be null
   * @return the exception to throw
   */
  public LoginRequiredException promptLogin(final Throwable cause) {
    return new LoginRequiredException(profile, cause);
  }
}
