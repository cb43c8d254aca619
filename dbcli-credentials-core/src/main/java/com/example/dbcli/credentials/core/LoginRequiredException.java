package com.example.dbcli.credentials.core;

/**
 * Terminal authentication failure: the stored session cannot be refreshed and the user has to run
 * the login command again.
 */
public class LoginRequiredException extends CommandException {

  static final String LOGIN_INSTRUCTIONS = "To sign in, run:\n\n  dbcli login\n";

  private final String profile;

  public LoginRequiredException(final String profile, final Throwable cause) {
    super(
        "The requested profile "
            + profile
            + " is not signed in or has expired.\nPlease re-authenticate.\n"
            + LOGIN_INSTRUCTIONS,
        cause,
        1);
    this.profile = profile;
  }

  public String profile() {
    return profile;
  }
}
