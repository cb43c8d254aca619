package com.example.dbcli.credentials.core;

/**
 * Credential-related inputs of one command invocation, already parsed by the command layer.
 *
 * @param accountKey account credential override (flag or environment variable), may be null
 * @param secret database secret override (flag or environment variable), may be null
 * @param user local user alias (profile); {@link #DEFAULT_USER} when null
 * @param database target database path, may be null
 * @param role target role, may be null
 * @param local whether the command targets a local database; allows otherwise illegal combinations
 */
public record CredentialOptions(
    String accountKey, String secret, String user, String database, String role, boolean local) {

  public static final String DEFAULT_USER = "default";

  /** The profile credentials are stored under. */
  public String profile() {
    return user == null || user.isBlank() ? DEFAULT_USER : user;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Fluent builder, mostly for callers that set only a few options. */
  public static final class Builder {
    private String accountKey;
    private String secret;
    private String user;
    private String database;
    private String role;
    private boolean local;

    private Builder() {}

    public Builder accountKey(final String accountKey) {
      this.accountKey = accountKey;
      return this;
    }

    public Builder secret(final String secret) {
      this.secret = secret;
      return this;
    }

    public Builder user(final String user) {
      this.user = user;
      return this;
    }

    public Builder database(final String database) {
      this.database = database;
      return this;
    }

    public Builder role(final String role) {
      this.role = role;
      return this;
    }

    public Builder local(final boolean local) {
      this.local = local;
      return this;
    }

    public CredentialOptions build() {
      return new CredentialOptions(accountKey, secret, user, database, role, local);
    }
  }
}
