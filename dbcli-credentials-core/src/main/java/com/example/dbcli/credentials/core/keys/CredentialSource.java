package com.example.dbcli.credentials.core.keys;

/** Where the active credential came from. User input always wins over the stored value. */
public enum CredentialSource {
  /** Supplied by a flag or environment variable; never persisted, never refreshed. */
  USER_PROVIDED("user"),
  /** Read from the local credentials files; may be silently refreshed. */
  STORED("credentials-file");

  private final String description;

  CredentialSource(final String description) {
    this.description = description;
  }

  /** Name of the source as shown to users. */
  public String description() {
    return description;
  }

  @Override
  public String toString() {
    return description;
  }
}
