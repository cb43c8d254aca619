package com.example.dbcli.credentials.core.config;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.*;

public class CredentialsConfigTest {

  private static final List<String> PROPERTIES =
      List.of(
          "dbcli.account.url",
          "dbcli.credentials.dir",
          "dbcli.client.id",
          "dbcli.client.secret",
          "dbcli.secret.ttl.minutes",
          "dbcli.login.timeout.seconds",
          "dbcli.http.timeout.seconds",
          "dbcli.local.secret");

  @AfterEach
  void clearProperties() {
    PROPERTIES.forEach(System::clearProperty);
  }

  @Nested
  @DisplayName("Defaults")
  class Defaults {

    @Test
    @DisplayName("Should use default endpoints and timeouts")
    void shouldUseDefaults() {
      final var config = CredentialsConfig.defaults(Path.of("creds"));

      assertEquals(URI.create("https://account.fauna.com"), config.accountUrl());
      assertEquals(Path.of("creds"), config.credentialsDir());
      assertEquals(CredentialsConfig.DEFAULT_CLIENT_ID, config.clientId());
      assertEquals("", config.clientSecret());
      assertEquals(Duration.ofMinutes(15), config.secretTtl());
      assertEquals(Duration.ofMinutes(5), config.loginTimeout());
      assertEquals(Duration.ofSeconds(30), config.httpTimeout());
      assertEquals("secret", config.localSecret());
    }

    @Test
    @DisplayName("Should fill in null optional values")
    void shouldFillInNullOptionalValues() {
      final var config =
          new CredentialsConfig(
              URI.create("http://localhost:8000"),
              Path.of("creds"),
              null,
              null,
              Duration.ofMinutes(1),
              Duration.ofMinutes(1),
              Duration.ofSeconds(1),
              null);

      assertEquals(CredentialsConfig.DEFAULT_CLIENT_ID, config.clientId());
      assertEquals("", config.clientSecret());
      assertEquals(CredentialsConfig.DEFAULT_LOCAL_SECRET, config.localSecret());
    }
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("Should reject a non-positive secret TTL")
    void shouldRejectNonPositiveTtl() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new CredentialsConfig(
                  URI.create("http://localhost"),
                  Path.of("creds"),
                  null,
                  null,
                  Duration.ZERO,
                  Duration.ofMinutes(1),
                  Duration.ofSeconds(1),
                  null));
    }

    @Test
    @DisplayName("Should reject a missing credentials directory")
    void shouldRejectMissingDirectory() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new CredentialsConfig(
                  URI.create("http://localhost"),
                  null,
                  null,
                  null,
                  Duration.ofMinutes(1),
                  Duration.ofMinutes(1),
                  Duration.ofSeconds(1),
                  null));
    }
  }

  @Nested
  @DisplayName("System properties")
  class SystemProperties {

    @Test
    @DisplayName("Should read overrides from system properties")
    void shouldReadOverrides() {
      System.setProperty("dbcli.account.url", "http://localhost:8080");
      System.setProperty("dbcli.credentials.dir", "/tmp/dbcli-test");
      System.setProperty("dbcli.client.id", "client-1");
      System.setProperty("dbcli.secret.ttl.minutes", "30");
      System.setProperty("dbcli.login.timeout.seconds", "60");
      System.setProperty("dbcli.local.secret", "local-secret");

      final var config = CredentialsConfig.fromEnvironment();

      assertEquals(URI.create("http://localhost:8080"), config.accountUrl());
      assertEquals(Path.of("/tmp/dbcli-test"), config.credentialsDir());
      assertEquals("client-1", config.clientId());
      assertEquals(Duration.ofMinutes(30), config.secretTtl());
      assertEquals(Duration.ofSeconds(60), config.loginTimeout());
      assertEquals("local-secret", config.localSecret());
    }

    @Test
    @DisplayName("Should ignore unparseable and non-positive durations")
    void shouldIgnoreInvalidDurations() {
      System.setProperty("dbcli.secret.ttl.minutes", "soon");
      System.setProperty("dbcli.login.timeout.seconds", "-5");

      final var config = CredentialsConfig.fromEnvironment();

      assertEquals(CredentialsConfig.DEFAULT_SECRET_TTL, config.secretTtl());
      assertEquals(CredentialsConfig.DEFAULT_LOGIN_TIMEOUT, config.loginTimeout());
    }

    @Test
    @DisplayName("Should ignore blank values")
    void shouldIgnoreBlankValues() {
      System.setProperty("dbcli.account.url", "   ");

      assertEquals(
          CredentialsConfig.DEFAULT_ACCOUNT_URL, CredentialsConfig.fromEnvironment().accountUrl());
    }
  }
}
