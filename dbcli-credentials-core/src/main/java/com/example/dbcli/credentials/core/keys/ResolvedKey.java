package com.example.dbcli.credentials.core.keys;

/**
 * Outcome of credential precedence resolution.
 *
 * @param value resolved value, null when the stored value is missing
 * @param source where the value came from
 */
public record ResolvedKey(String value, CredentialSource source) {

  /**
   * Applies the precedence rule shared by both credential kinds: an explicit, non-blank input wins;
   * otherwise the stored value is used, even when it is absent.
   *
   * @param explicitInput value from a flag or environment variable, may be null
   * @param storedValue value from the credentials file, may be null
   * @return the resolved value and its source
   */
  public static ResolvedKey resolve(final String explicitInput, final String storedValue) {
    if (explicitInput != null && !explicitInput.isBlank()) {
      return new ResolvedKey(explicitInput, CredentialSource.USER_PROVIDED);
    }
    return new ResolvedKey(storedValue, CredentialSource.STORED);
  }

  public boolean isStored() {
    return source == CredentialSource.STORED;
  }

  public boolean hasValue() {
    return value != null && !value.isBlank();
  }
}
