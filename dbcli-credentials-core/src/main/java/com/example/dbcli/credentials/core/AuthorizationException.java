package com.example.dbcli.credentials.core;

/** The credential is valid but lacks the privilege for the request. Never retried. */
public class AuthorizationException extends CommandException {

  public AuthorizationException(final String message) {
    super(message);
  }

  public AuthorizationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
