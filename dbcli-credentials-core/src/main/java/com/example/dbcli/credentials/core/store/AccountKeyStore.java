package com.example.dbcli.credentials.core.store;

import java.nio.file.Path;

/** Account credentials and refresh tokens, namespaced by local profile name. */
public class AccountKeyStore extends CredentialStore<AccountKeyEntry> {

  /** File name inside the credentials directory. */
  public static final String FILE_NAME = "access_keys";

  public AccountKeyStore(final Path credentialsDir) {
    super(
        credentialsDir.resolve(FILE_NAME),
        MAPPER.getTypeFactory().constructType(AccountKeyEntry.class));
  }
}
