package com.example.dbcli.credentials.core;

import com.example.dbcli.credentials.core.keys.CredentialSource;

/**
 * A credential supplied by the user (flag or environment variable) is missing or was rejected.
 *
 * <p>Nothing in this subsystem can repair a value it did not mint, so the user is asked for a new
 * one.
 */
public class InvalidCredentialException extends CommandException {

  private final CredentialSource source;

  public InvalidCredentialException(final String message, final CredentialSource source) {
    this(message, source, null);
  }

  public InvalidCredentialException(
      final String message, final CredentialSource source, final Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public CredentialSource source() {
    return source;
  }
}
