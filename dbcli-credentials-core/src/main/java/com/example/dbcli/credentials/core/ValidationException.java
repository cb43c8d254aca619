package com.example.dbcli.credentials.core;

/** Illegal combination of credential inputs, detected before any credential is resolved. */
public class ValidationException extends CommandException {

  public ValidationException(final String message) {
    super(message);
  }
}
