package com.example.dbcli.credentials.core.oauth;

import com.example.dbcli.credentials.core.CommandException;

/** Failure of the browser login: provider error, tampered redirect, timeout or interruption. */
public class OAuthException extends CommandException {

  public OAuthException(final String message) {
    super(message);
  }

  public OAuthException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
