package com.example.dbcli.credentials.core.oauth;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.dbcli.credentials.core.CredentialsFacade;
import com.example.dbcli.credentials.core.api.AccountApi;
import com.example.dbcli.credentials.core.api.HttpAccountApi;
import com.example.dbcli.credentials.core.api.TokenRequest;
import com.example.dbcli.credentials.core.config.CredentialsConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Browser login with the authorization-code grant and PKCE.
 *
 * <p>A loopback listener on an ephemeral port receives the single redirect carrying the
 * authorization code. The code is handed to the waiting thread through a one-shot future,
 * exchanged for an access token and finally for a control-plane session. The listener is closed
 * once the code arrives, on any failure, on timeout and on interruption.
 *
 * <pre>{@code
 * try (var flow = new OAuthLoginFlow(config, accountApi)) {
 *   flow.login(credentials, BrowserLauncher.desktop(System.out));
 * }
 * }</pre>
 */
public class OAuthLoginFlow implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(OAuthLoginFlow.class.getName());

  /** Lifecycle of one login. {@link #FAILED} is reachable from every other state. */
  public enum State {
    NOT_STARTED,
    SERVER_STARTED,
    AWAITING_REDIRECT,
    CODE_RECEIVED,
    EXCHANGED,
    FAILED
  }

  static final String LOOPBACK_HOST = "127.0.0.1";

  static final Set<String> ALLOWED_ORIGINS =
      Set.of(
          "http://localhost:3005",
          "http://127.0.0.1:3005",
          "http://dashboard.fauna.com",
          "http://dashboard.fauna-dev.com",
          "http://dashboard.fauna-preview.com");

  static final String SUCCESS_PAGE =
      "<html><body><h1>Login successful</h1>"
          + "<p>You can close this window and return to the terminal.</p></body></html>";

  private final CredentialsConfig config;
  private final AccountApi accountApi;
  private final Pkce pkce;
  private final CompletableFuture<String> authCode = new CompletableFuture<>();
  private final AtomicReference<State> state = new AtomicReference<>(State.NOT_STARTED);

  private HttpServer server;
  private ExecutorService executor;
  private volatile int port;

  public OAuthLoginFlow(final CredentialsConfig config) {
    this(config, new HttpAccountApi(config));
  }

  public OAuthLoginFlow(final CredentialsConfig config, final AccountApi accountApi) {
    this(config, accountApi, Pkce.generate());
  }

  OAuthLoginFlow(final CredentialsConfig config, final AccountApi accountApi, final Pkce pkce) {
    this.config = config;
    this.accountApi = accountApi;
    this.pkce = pkce;
  }

  /**
   * Binds the loopback listener to an ephemeral port.
   *
   * @return redirect URI the provider sends the browser back to
   * @throws OAuthException if the listener cannot be bound
   * @throws IllegalStateException if the flow was already started
   */
  public synchronized URI start() {
    if (!state.compareAndSet(State.NOT_STARTED, State.SERVER_STARTED)) {
      throw new IllegalStateException("Login flow already started: " + state.get());
    }
    try {
      server = HttpServer.create(new InetSocketAddress(LOOPBACK_HOST, 0), 0);
    } catch (final IOException e) {
      state.set(State.FAILED);
      throw new OAuthException("Failed to start the login listener", e);
    }
    executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              final var thread = new Thread(runnable, "dbcli-login-listener");
              thread.setDaemon(true);
              return thread;
            });
    server.createContext("/", this::handle);
    server.setExecutor(executor);
    server.start();
    port = server.getAddress().getPort();

    LOGGER.log(DEBUG, "Login listener started on port {0}", port);
    return redirectUri();
  }

  /**
   * Logs in through the browser and installs the resulting session in {@code credentials}. The
   * flow reaches {@link State#EXCHANGED} once the session is installed.
   *
   * @param credentials credentials of the active profile
   * @param browser shows the dashboard login page
   */
  public void login(final CredentialsFacade credentials, final BrowserLauncher browser) {
    final var accessToken = authenticate(browser);
    try {
      credentials.login(accessToken);
    } catch (final RuntimeException e) {
      state.set(State.FAILED);
      throw e;
    }
    state.set(State.EXCHANGED);
  }

  /**
   * Runs the browser part of the login and exchanges the received code for an access token. The
   * flow stays in {@link State#CODE_RECEIVED} until {@link #login} installs the session.
   *
   * @param browser shows the dashboard login page
   * @return OAuth access token
   * @throws OAuthException on provider error, tampered redirect, timeout or interruption
   */
  public String authenticate(final BrowserLauncher browser) {
    try {
      if (state.get() == State.NOT_STARTED) start();

      final var dashboardUrl = accountApi.startOAuthRequest(authorizationParams());
      state.compareAndSet(State.SERVER_STARTED, State.AWAITING_REDIRECT);
      browser.open(dashboardUrl);

      final var code = awaitCode(config.loginTimeout());
      final var accessToken =
          accountApi.getToken(
              new TokenRequest(
                  config.clientId(),
                  config.clientSecret(),
                  code,
                  redirectUri().toString(),
                  pkce.verifier()));
      LOGGER.log(INFO, "Authorization code exchanged for an access token");
      return accessToken;
    } catch (final RuntimeException e) {
      state.set(State.FAILED);
      throw e;
    } finally {
      close();
    }
  }

  /**
   * Parameters of the authorization request.
   *
   * @return ordered query parameters for {@code GET /oauth/authorize}
   * @throws IllegalStateException if the listener is not started
   */
  public Map<String, String> authorizationParams() {
    final var params = new LinkedHashMap<String, String>();
    params.put("client_id", config.clientId());
    params.put("redirect_uri", redirectUri().toString());
    params.put("code_challenge", pkce.challenge());
    params.put("code_challenge_method", Pkce.METHOD);
    params.put("response_type", "code");
    params.put("scope", "create_session");
    params.put("state", pkce.state());
    return params;
  }

  /**
   * Loopback URI of the running listener.
   *
   * @return redirect URI
   * @throws IllegalStateException if the listener is not started
   */
  public URI redirectUri() {
    if (port == 0) throw new IllegalStateException("Login listener is not started");
    return URI.create("http://" + LOOPBACK_HOST + ":" + port);
  }

  public State currentState() {
    return state.get();
  }

  /**
   * Blocks until the redirect delivers an authorization code. The listener is closed afterwards
   * whatever the outcome.
   *
   * @param timeout maximum time to wait for the redirect
   * @return authorization code
   * @throws OAuthException if the redirect reports a failure, does not arrive in time, or the
   *     waiting thread is interrupted
   */
  public String awaitCode(final Duration timeout) {
    state.compareAndSet(State.SERVER_STARTED, State.AWAITING_REDIRECT);
    try {
      return authCode.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      throw fail(
          new OAuthException("Timed out waiting for the login redirect after " + timeout, e));
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw fail(new OAuthException("Login interrupted", e));
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof OAuthException) throw (OAuthException) e.getCause();
      throw fail(new OAuthException("Login failed", e.getCause()));
    } finally {
      close();
    }
  }

  /** Stops the listener. Safe to call more than once. */
  @Override
  public synchronized void close() {
    if (server == null) return;
    server.stop(0);
    executor.shutdownNow();
    server = null;
    executor = null;
    LOGGER.log(DEBUG, "Login listener stopped");
  }

  private void handle(final HttpExchange exchange) throws IOException {
    Runnable settle = () -> {};
    try {
      addCorsHeaders(exchange);
      final var method = exchange.getRequestMethod();

      if ("OPTIONS".equals(method)) {
        exchange.sendResponseHeaders(204, -1);
      } else if (!"GET".equals(method)) {
        exchange.sendResponseHeaders(405, -1);
      } else if (!"/".equals(exchange.getRequestURI().getPath())) {
        exchange.sendResponseHeaders(404, -1);
      } else {
        settle = handleRedirect(exchange);
      }
    } finally {
      exchange.close();
    }
    settle.run();
  }

  private Runnable handleRedirect(final HttpExchange exchange) throws IOException {
    final var uri = exchange.getRequestURI();
    final var error = HttpAccountApi.queryParameter(uri, "error");
    final var receivedState = HttpAccountApi.queryParameter(uri, "state");
    final var code =
        HttpAccountApi.queryParameter(uri, "code").filter(value -> !value.isBlank());

    if (error.isPresent()) {
      final var description = HttpAccountApi.queryParameter(uri, "error_description").orElse("");
      respond(exchange, 400, "Login failed: " + error.get());
      return () ->
          fail(new OAuthException("Error during login: " + error.get() + " - " + description));
    }
    if (receivedState.isEmpty() || !receivedState.get().equals(pkce.state())) {
      LOGGER.log(WARNING, "Login redirect carried an unexpected state parameter");
      respond(exchange, 400, "Login failed: invalid state");
      return () ->
          fail(
              new OAuthException(
                  "Invalid state received during login. The redirect may have been tampered"
                      + " with, please try again."));
    }
    if (code.isEmpty()) {
      respond(exchange, 400, "Login failed: missing authorization code");
      return () -> fail(new OAuthException("No authorization code received during login"));
    }

    respond(exchange, 200, SUCCESS_PAGE);
    return () -> {
      if (state.compareAndSet(State.AWAITING_REDIRECT, State.CODE_RECEIVED)
          || state.compareAndSet(State.SERVER_STARTED, State.CODE_RECEIVED)) {
        authCode.complete(code.get());
      }
    };
  }

  private OAuthException fail(final OAuthException e) {
    if (!authCode.isDone()) {
      state.set(State.FAILED);
      authCode.completeExceptionally(e);
    }
    return e;
  }

  private static void addCorsHeaders(final HttpExchange exchange) {
    final var origin = exchange.getRequestHeaders().getFirst("Origin");
    if (origin == null || !ALLOWED_ORIGINS.contains(origin)) return;

    final var headers = exchange.getResponseHeaders();
    headers.set("Access-Control-Allow-Origin", origin);
    headers.set("Access-Control-Allow-Methods", "GET, OPTIONS");
    headers.set("Access-Control-Allow-Headers", "Content-Type");
  }

  private static void respond(final HttpExchange exchange, final int status, final String body)
      throws IOException {
    final var bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
    exchange.sendResponseHeaders(status, bytes.length);
    try (var out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
