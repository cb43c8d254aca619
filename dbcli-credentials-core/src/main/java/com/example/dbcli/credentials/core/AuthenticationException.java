package com.example.dbcli.credentials.core;

/**
 * A credential was rejected outright (HTTP 401 or an equivalent "unauthorized" error code).
 *
 * <p>API clients translate their transport-specific failures into this type exactly once, at the
 * client boundary. {@link UnauthorizedDetector#defaultDetector()} and therefore {@link
 * RetryOnUnauthorized} only ever look for this type.
 */
public class AuthenticationException extends CommandException {

  public AuthenticationException(final String message) {
    super(message);
  }

  public AuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
