package com.example.dbcli.credentials.core.api;

/**
 * Non-2xx answer from the control-plane API, or a failure to reach it.
 *
 * <p>Carried as-is to the caller, or as the cause of a more specific {@link
 * com.example.dbcli.credentials.core.CommandException}.
 */
public class AccountApiException extends RuntimeException {

  private final int status;
  private final String code;
  private final String body;

  public AccountApiException(
      final int status, final String code, final String message, final String body) {
    super(message);
    this.status = status;
    this.code = code;
    this.body = body;
  }

  public AccountApiException(final String message, final Throwable cause) {
    super(message, cause);
    this.status = -1;
    this.code = "network_error";
    this.body = null;
  }

  /** HTTP status, or -1 when no response was received. */
  public int status() {
    return status;
  }

  public String code() {
    return code;
  }

  public String body() {
    return body;
  }
}
