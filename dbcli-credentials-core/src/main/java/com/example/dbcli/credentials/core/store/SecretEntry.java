package com.example.dbcli.credentials.core.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Persisted database secret.
 *
 * @param secret the database secret value
 * @param expiresAt expiry as epoch milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretEntry(String secret, long expiresAt) {

  /**
   * A secret whose expiry is at or before {@code now} is treated as absent.
   *
   * @param now the current instant
   * @return true if the secret must not be used anymore
   */
  @JsonIgnore
  public boolean isExpired(final Instant now) {
    return expiresAt <= now.toEpochMilli();
  }
}
