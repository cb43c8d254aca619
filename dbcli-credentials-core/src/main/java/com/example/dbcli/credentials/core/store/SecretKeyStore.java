package com.example.dbcli.credentials.core.store;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Database secrets, namespaced by the account credential that minted them.
 *
 * <p>Within a namespace, secrets are keyed by {@code path:role}. The store tracks the current
 * account credential so that, after a refresh, new secrets are filed under the new value and the
 * old namespace becomes an orphan for {@link
 * com.example.dbcli.credentials.core.CredentialsFacade#cleanupOrphans()}.
 */
public class SecretKeyStore extends CredentialStore<Map<String, SecretEntry>> {

  /** File name inside the credentials directory. */
  public static final String FILE_NAME = "secret_keys";

  private String accountKey;

  public SecretKeyStore(final Path credentialsDir, final String accountKey) {
    super(
        credentialsDir.resolve(FILE_NAME),
        MAPPER
            .getTypeFactory()
            .constructMapType(LinkedHashMap.class, String.class, SecretEntry.class));
    this.accountKey = accountKey;
  }

  /**
   * Builds the key a secret is indexed by inside its namespace.
   *
   * @param path database path
   * @param role database role
   * @return {@code path:role}
   */
  public static String keyName(final String path, final String role) {
    return path + ":" + role;
  }

  /** Re-points the store at a new account credential namespace. */
  public void updateAccountKey(final String accountKey) {
    this.accountKey = accountKey;
  }

  /** The current namespace, or null when no account credential is known yet. */
  public String accountKey() {
    return accountKey;
  }

  /**
   * Returns the secret stored under {@code keyName} in the current namespace.
   *
   * @param keyName {@code path:role}
   * @return the entry, or empty if absent
   */
  public Optional<SecretEntry> getSecret(final String keyName) {
    return get(accountKey).map(secrets -> secrets.get(keyName));
  }

  /**
   * Stores a secret in the current namespace, replacing any previous secret for the same key.
   *
   * @param keyName {@code path:role}
   * @param entry the secret to store
   * @throws IllegalStateException if no account credential namespace is set
   */
  public void saveSecret(final String keyName, final SecretEntry entry) {
    if (accountKey == null) {
      throw new IllegalStateException("Cannot store a database secret without an account key");
    }
    final var secrets = new LinkedHashMap<String, SecretEntry>(get(accountKey).orElseGet(Map::of));
    secrets.put(keyName, entry);
    save(accountKey, secrets);
  }

  /**
   * Removes one secret from the current namespace.
   *
   * @param keyName {@code path:role}
   * @return true if a secret was removed
   */
  public boolean deleteSecret(final String keyName) {
    final var existing = get(accountKey);
    if (existing.isEmpty() || !existing.get().containsKey(keyName)) return false;
    final var secrets = new LinkedHashMap<>(existing.get());
    secrets.remove(keyName);
    save(accountKey, secrets);
    return true;
  }

  /** Deletes every secret minted by the current account credential. */
  public boolean deleteAllForAccount() {
    return delete(accountKey);
  }
}
