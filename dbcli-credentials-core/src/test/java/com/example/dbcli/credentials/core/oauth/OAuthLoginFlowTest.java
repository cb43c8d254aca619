package com.example.dbcli.credentials.core.oauth;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.dbcli.credentials.core.AuthenticationException;
import com.example.dbcli.credentials.core.CredentialOptions;
import com.example.dbcli.credentials.core.CredentialsFacade;
import com.example.dbcli.credentials.core.api.AccountApi;
import com.example.dbcli.credentials.core.api.Session;
import com.example.dbcli.credentials.core.api.TokenRequest;
import com.example.dbcli.credentials.core.config.CredentialsConfig;
import com.example.dbcli.credentials.core.store.AccountKeyEntry;
import com.example.dbcli.credentials.core.store.AccountKeyStore;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

public class OAuthLoginFlowTest {

  private static final String STATE = "state-1";
  private static final String VERIFIER = "verifier-1";
  private static final Duration WAIT = Duration.ofSeconds(5);

  @TempDir Path dir;

  private AccountApi api;
  private CredentialsConfig config;
  private HttpClient client;
  private OAuthLoginFlow flow;

  @BeforeEach
  void setUp() {
    api = mock(AccountApi.class);
    config =
        new CredentialsConfig(
            URI.create("http://localhost:9999"),
            dir,
            "client-1",
            "",
            Duration.ofMinutes(15),
            WAIT,
            WAIT,
            null);
    client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    flow = new OAuthLoginFlow(config, api, new Pkce(VERIFIER, STATE));
  }

  @AfterEach
  void tearDown() {
    flow.close();
  }

  private HttpResponse<String> get(final String pathAndQuery) throws Exception {
    return client.send(
        HttpRequest.newBuilder(URI.create(flow.redirectUri() + pathAndQuery))
            .timeout(WAIT)
            .GET()
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }

  private void assertListenerClosed(final URI redirectUri) {
    final var freshClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    assertThrows(
        IOException.class,
        () ->
            freshClient.send(
                HttpRequest.newBuilder(redirectUri).timeout(WAIT).GET().build(),
                HttpResponse.BodyHandlers.ofString()));
  }

  @Nested
  @DisplayName("Authorization request")
  class AuthorizationRequest {

    @Test
    @DisplayName("Carries the PKCE challenge, loopback redirect and state")
    void carriesPkceParameters() {
      final var redirectUri = flow.start();

      final var params = flow.authorizationParams();

      assertEquals("client-1", params.get("client_id"));
      assertEquals(redirectUri.toString(), params.get("redirect_uri"));
      assertTrue(redirectUri.toString().startsWith("http://127.0.0.1:"));
      assertEquals(Pkce.challengeOf(VERIFIER), params.get("code_challenge"));
      assertEquals("S256", params.get("code_challenge_method"));
      assertEquals("code", params.get("response_type"));
      assertEquals("create_session", params.get("scope"));
      assertEquals(STATE, params.get("state"));
      assertEquals(OAuthLoginFlow.State.SERVER_STARTED, flow.currentState());
    }

    @Test
    @DisplayName("Requires a started listener")
    void requiresStartedListener() {
      assertThrows(IllegalStateException.class, () -> flow.authorizationParams());
      assertEquals(OAuthLoginFlow.State.NOT_STARTED, flow.currentState());
    }

    @Test
    @DisplayName("Cannot be started twice")
    void cannotStartTwice() {
      flow.start();

      assertThrows(IllegalStateException.class, () -> flow.start());
    }
  }

  @Nested
  @DisplayName("Redirect handling")
  class RedirectHandling {

    @Test
    @DisplayName("A valid redirect delivers the code and closes the listener")
    void validRedirectDeliversCode() throws Exception {
      final var redirectUri = flow.start();

      final var response = get("/?code=abc&state=" + STATE);

      assertEquals(200, response.statusCode());
      assertTrue(response.body().contains("Login successful"));
      assertEquals("abc", flow.awaitCode(WAIT));
      assertEquals(OAuthLoginFlow.State.CODE_RECEIVED, flow.currentState());
      assertListenerClosed(redirectUri);
    }

    @Test
    @DisplayName("A state mismatch fails the login and closes the listener")
    void stateMismatchFails() throws Exception {
      final var redirectUri = flow.start();

      final var response = get("/?code=abc&state=forged");

      assertEquals(400, response.statusCode());
      final var ex = assertThrows(OAuthException.class, () -> flow.awaitCode(WAIT));
      assertTrue(ex.getMessage().contains("Invalid state"));
      assertEquals(OAuthLoginFlow.State.FAILED, flow.currentState());
      assertListenerClosed(redirectUri);
    }

    @Test
    @DisplayName("A provider error fails the login with its description")
    void providerErrorFails() throws Exception {
      flow.start();

      get("/?error=access_denied&error_description=User%20cancelled&state=" + STATE);

      final var ex = assertThrows(OAuthException.class, () -> flow.awaitCode(WAIT));
      assertEquals("Error during login: access_denied - User cancelled", ex.getMessage());
      assertEquals(OAuthLoginFlow.State.FAILED, flow.currentState());
    }

    @Test
    @DisplayName("A redirect without code fails the login")
    void missingCodeFails() throws Exception {
      flow.start();

      assertEquals(400, get("/?state=" + STATE).statusCode());

      assertThrows(OAuthException.class, () -> flow.awaitCode(WAIT));
      assertEquals(OAuthLoginFlow.State.FAILED, flow.currentState());
    }

    @Test
    @DisplayName("An empty code counts as missing")
    void emptyCodeFails() throws Exception {
      flow.start();

      final var response = get("/?code=&state=" + STATE);

      assertEquals(400, response.statusCode());
      assertFalse(response.body().contains("Login successful"));
      assertThrows(OAuthException.class, () -> flow.awaitCode(WAIT));
      assertEquals(OAuthLoginFlow.State.FAILED, flow.currentState());
    }

    @Test
    @DisplayName("Stray requests do not end the login")
    void strayRequestsDoNotEndLogin() throws Exception {
      flow.start();

      assertEquals(404, get("/favicon.ico").statusCode());
      final var post =
          client.send(
              HttpRequest.newBuilder(flow.redirectUri())
                  .timeout(WAIT)
                  .POST(HttpRequest.BodyPublishers.ofString("x"))
                  .build(),
              HttpResponse.BodyHandlers.ofString());
      assertEquals(405, post.statusCode());

      assertEquals(OAuthLoginFlow.State.SERVER_STARTED, flow.currentState());
      assertEquals(200, get("/?code=abc&state=" + STATE).statusCode());
      assertEquals("abc", flow.awaitCode(WAIT));
    }

    @Test
    @DisplayName("A missing redirect times out and fails the login")
    void missingRedirectTimesOut() {
      final var redirectUri = flow.start();

      final var ex =
          assertThrows(OAuthException.class, () -> flow.awaitCode(Duration.ofMillis(50)));
      assertTrue(ex.getMessage().contains("Timed out"));
      assertEquals(OAuthLoginFlow.State.FAILED, flow.currentState());
      assertListenerClosed(redirectUri);
    }
  }

  @Nested
  @DisplayName("CORS")
  class Cors {

    private HttpResponse<String> preflight(final String origin) throws Exception {
      return client.send(
          HttpRequest.newBuilder(flow.redirectUri())
              .timeout(WAIT)
              .header("Origin", origin)
              .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
              .build(),
          HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Allows the dashboard origins")
    void allowsDashboardOrigins() throws Exception {
      flow.start();

      final var response = preflight("http://dashboard.fauna.com");

      assertEquals(204, response.statusCode());
      assertEquals(
          "http://dashboard.fauna.com",
          response.headers().firstValue("Access-Control-Allow-Origin").orElseThrow());
      assertTrue(response.headers().firstValue("Access-Control-Allow-Methods").isPresent());
    }

    @Test
    @DisplayName("Sends no CORS headers to other origins")
    void ignoresOtherOrigins() throws Exception {
      flow.start();

      final var response = preflight("http://evil.example.com");

      assertEquals(204, response.statusCode());
      assertTrue(response.headers().firstValue("Access-Control-Allow-Origin").isEmpty());
    }
  }

  @Nested
  @DisplayName("Full login")
  class FullLogin {

    private final BrowserLauncher browser =
        url -> {
          try {
            get("/?code=abc&state=" + STATE);
          } catch (final Exception e) {
            throw new IllegalStateException(e);
          }
        };

    @Test
    @DisplayName("Exchanges the received code with the verifier")
    void exchangesCodeWithVerifier() {
      when(api.startOAuthRequest(any())).thenReturn(URI.create("https://dashboard.example.com"));
      when(api.getToken(any())).thenReturn("access-token");

      final var token = flow.authenticate(browser);

      assertEquals("access-token", token);
      final var request = ArgumentCaptor.forClass(TokenRequest.class);
      verify(api).getToken(request.capture());
      assertEquals("abc", request.getValue().authCode());
      assertEquals(VERIFIER, request.getValue().codeVerifier());
      assertEquals("client-1", request.getValue().clientId());
      assertTrue(request.getValue().redirectUri().startsWith("http://127.0.0.1:"));
      assertEquals(OAuthLoginFlow.State.CODE_RECEIVED, flow.currentState());
    }

    @Test
    @DisplayName("Installs the session of the exchanged token")
    void installsSession() {
      when(api.startOAuthRequest(any())).thenReturn(URI.create("https://dashboard.example.com"));
      when(api.getToken(any())).thenReturn("access-token");
      when(api.getSession("access-token")).thenReturn(new Session("ak", "rt"));
      final var credentials =
          CredentialsFacade.construct(
              CredentialOptions.builder().build(), config, api, Clock.systemUTC());

      flow.login(credentials, browser);

      assertEquals(
          new AccountKeyEntry("ak", "rt"), new AccountKeyStore(dir).get("default").orElseThrow());
      assertEquals(OAuthLoginFlow.State.EXCHANGED, flow.currentState());
    }

    @Test
    @DisplayName("A rejected session exchange fails the login")
    void rejectedSessionFails() {
      when(api.startOAuthRequest(any())).thenReturn(URI.create("https://dashboard.example.com"));
      when(api.getToken(any())).thenReturn("access-token");
      when(api.getSession("access-token")).thenThrow(new AuthenticationException("401"));
      final var credentials =
          CredentialsFacade.construct(
              CredentialOptions.builder().build(), config, api, Clock.systemUTC());

      assertThrows(AuthenticationException.class, () -> flow.login(credentials, browser));
      assertEquals(OAuthLoginFlow.State.FAILED, flow.currentState());
      assertTrue(new AccountKeyStore(dir).get("default").isEmpty());
    }

    @Test
    @DisplayName("A failed authorization request closes the listener")
    void failedAuthorizationClosesListener() {
      when(api.startOAuthRequest(any()))
          .thenThrow(new OAuthException("Error during login: server_error"));

      assertThrows(OAuthException.class, () -> flow.authenticate(browser));
      assertEquals(OAuthLoginFlow.State.FAILED, flow.currentState());
      verify(api, never()).getToken(any());
    }
  }
}
