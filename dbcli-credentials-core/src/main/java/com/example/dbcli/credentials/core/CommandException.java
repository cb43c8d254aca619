package com.example.dbcli.credentials.core;

/**
 * User-facing, non-retryable failure raised by the credential subsystem.
 *
 * <p>Every exception thrown on purpose by this module extends this type. The surrounding command
 * layer prints {@link #getMessage()} and terminates with {@link #exitCode()}.
 */
public class CommandException extends RuntimeException {

  private final int exitCode;

  public CommandException(final String message) {
    this(message, null);
  }

  public CommandException(final String message, final Throwable cause) {
    this(message, cause, 1);
  }

  protected CommandException(final String message, final Throwable cause, final int exitCode) {
    super(message, cause);
    this.exitCode = exitCode;
  }

  /**
   * Process exit code the command layer should use when this error terminates the invocation.
   *
   * @return non-zero exit code
   */
  public int exitCode() {
    return exitCode;
  }
}
