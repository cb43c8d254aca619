package com.example.dbcli.credentials.core.keys;

/**
 * Owner of a refreshable bearer credential, consulted by {@link
 * com.example.dbcli.credentials.core.RetryOnUnauthorized} after the credential was rejected.
 */
public interface KeyProvider {

  /**
   * The credential currently held in memory.
   *
   * @return current value, may be null before the first {@link #getOrRefresh()}
   */
  String key();

  /**
   * Returns a usable credential, refreshing it first when the stored one is missing or expired.
   *
   * @return a credential value
   */
  String getOrRefresh();

  /**
   * Reacts to a rejected credential: refreshes a stored credential, or fails when the credential
   * was supplied by the user.
   *
   * @param cause the failure that reported the credential as invalid
   */
  void onInvalidCreds(RuntimeException cause);
}
