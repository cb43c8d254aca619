package com.example.dbcli.credentials.core.keys;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.dbcli.credentials.core.api.AccountApi;
import com.example.dbcli.credentials.core.api.CreateKeyRequest;
import com.example.dbcli.credentials.core.store.SecretEntry;
import com.example.dbcli.credentials.core.store.SecretKeyStore;
import java.time.Clock;
import java.time.Duration;

/**
 * Database secret scoped to one {@code (path, role)} pair.
 *
 * <p>A user-provided secret is used as-is and already carries its role. Otherwise the secret is
 * read from the {@link SecretKeyStore} under the current account credential and minted through the
 * control plane when it is absent or expired. Expiry is checked before every use.
 */
public class DatabaseKeyManager implements KeyProvider {

  private static final System.Logger LOGGER = System.getLogger(DatabaseKeyManager.class.getName());

  /** Role used when none is given. */
  public static final String DEFAULT_ROLE = "admin";

  /** Name given to every minted key. */
  public static final String GENERATED_KEY_NAME = "generated";

  private final String path;
  private final String role;
  private final SecretKeyStore store;
  private final AccountKeyManager accountKeys;
  private final AccountApi accountApi;
  private final Duration ttl;
  private final Clock clock;
  private final CredentialSource source;
  private volatile String key;

  /**
   * Resolves the database secret.
   *
   * @param path database path the secret is scoped to, may be null for a user-provided secret
   * @param role database role, {@link #DEFAULT_ROLE} when null; ignored for a user-provided secret
   * @param explicitSecret secret from a flag or environment variable, may be null
   * @param store secret store, already pointing at the current account credential namespace
   * @param accountKeys account credential used for minting
   * @param accountApi control-plane client
   * @param ttl lifetime of minted secrets
   * @param clock time source for expiry checks
   */
  public DatabaseKeyManager(
      final String path,
      final String role,
      final String explicitSecret,
      final SecretKeyStore store,
      final AccountKeyManager accountKeys,
      final AccountApi accountApi,
      final Duration ttl,
      final Clock clock) {
    this.path = path;
    this.store = store;
    this.accountKeys = accountKeys;
    this.accountApi = accountApi;
    this.ttl = ttl;
    this.clock = clock;

    final var candidateRole = role == null || role.isBlank() ? DEFAULT_ROLE : role;
    final var stored =
        store.getSecret(SecretKeyStore.keyName(path, candidateRole))
            .map(SecretEntry::secret)
            .orElse(null);
    final var resolved = resolve(explicitSecret, stored);
    this.key = resolved.value();
    this.source = resolved.source();
    // A provided secret already encodes its role.
    this.role = resolved.isStored() ? candidateRole : null;
  }

  /**
   * Applies the precedence rule for database secrets.
   *
   * @param explicitSecret user input, may be null
   * @param storedSecret value from the credentials file, may be null
   * @return resolved value and source
   */
  public static ResolvedKey resolve(final String explicitSecret, final String storedSecret) {
    return ResolvedKey.resolve(explicitSecret, storedSecret);
  }

  @Override
  public String key() {
    return key;
  }

  public CredentialSource source() {
    return source;
  }

  public String path() {
    return path;
  }

  /** Role the secret is minted for, null for a user-provided secret. */
  public String role() {
    return role;
  }

  /** Store key of this secret: {@code path:role}. */
  public String keyName() {
    return SecretKeyStore.keyName(path, role);
  }

  /**
   * Returns a live secret. A stored secret that is absent or whose expiry is at or before now is
   * replaced by a freshly minted one.
   *
   * @return database secret
   */
  @Override
  public String getOrRefresh() {
    if (source == CredentialSource.STORED) {
      final var entry = store.getSecret(keyName());
      if (entry.isEmpty() || entry.get().isExpired(clock.instant())) {
        LOGGER.log(DEBUG, "No live database key for {0}, minting a new one", keyName());
        return mint();
      }
      key = entry.get().secret();
    }
    return key;
  }

  /**
   * Mints a secret through the control plane and files it under the current account credential,
   * replacing any previous secret for the same {@code path:role}.
   *
   * @return the new secret
   */
  public String mint() {
    final var expiresAt = clock.instant().plus(ttl);
    final var request =
        new CreateKeyRequest(role, path, expiresAt.toString(), GENERATED_KEY_NAME);

    LOGGER.log(INFO, "Creating new database key for {0}", keyName());
    final var created =
        accountKeys.callWithRefresh(accountKey -> accountApi.createKey(accountKey, request));

    // The account credential may have rotated during the call.
    store.updateAccountKey(accountKeys.key());
    store.saveSecret(keyName(), new SecretEntry(created.secret(), expiresAt.toEpochMilli()));
    key = created.secret();
    return key;
  }

  /**
   * Rethrows the failure for a user-provided secret, mints a new secret otherwise.
   *
   * @param cause the failure that reported the secret as invalid
   */
  @Override
  public void onInvalidCreds(final RuntimeException cause) {
    if (source != CredentialSource.STORED) throw cause;
    mint();
  }

  /**
   * Re-points the store at a new account credential. Cached secret values are left alone until
   * they are next read.
   *
   * @param accountKey the new account credential
   */
  public void updateAccountKeyNamespace(final String accountKey) {
    store.updateAccountKey(accountKey);
  }
}
