package com.example.dbcli.credentials.core.api;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.dbcli.credentials.core.AuthenticationException;
import com.example.dbcli.credentials.core.AuthorizationException;
import com.example.dbcli.credentials.core.CommandException;
import com.example.dbcli.credentials.core.config.CredentialsConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link AccountApi} over {@link HttpClient}, talking to {@code <accountUrl>/api/v1}.
 *
 * <p>Redirects are never followed: the authorization endpoint answers with a 302 whose location is
 * the dashboard login page.
 */
public class HttpAccountApi implements AccountApi {

  private static final System.Logger LOGGER = System.getLogger(HttpAccountApi.class.getName());
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final String API_VERSION = "/api/v1";

  private final URI accountUrl;
  private final HttpClient httpClient;
  private final Duration timeout;

  public HttpAccountApi(final CredentialsConfig config) {
    this(
        config.accountUrl(),
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(config.httpTimeout())
            .build(),
        config.httpTimeout());
  }

  public HttpAccountApi(final URI accountUrl, final HttpClient httpClient, final Duration timeout) {
    this.accountUrl = accountUrl;
    this.httpClient = httpClient;
    this.timeout = timeout;
  }

  @Override
  public URI startOAuthRequest(final Map<String, String> authorizationParams) {
    final var request =
        HttpRequest.newBuilder(toResource("/oauth/authorize", authorizationParams))
            .timeout(timeout)
            .header("Content-Type", "text/html")
            .GET()
            .build();
    final var response = send(request);

    if (response.statusCode() != 302) {
      throw new CommandException(
          "Failed to start OAuth request: HTTP " + response.statusCode());
    }

    final var location =
        response
            .headers()
            .firstValue("location")
            .orElseThrow(() -> new CommandException("No location header found in response"));
    final var dashboardUrl = URI.create(location);

    queryParameter(dashboardUrl, "error")
        .ifPresent(
            error -> {
              throw new CommandException("Error during login: " + error);
            });
    return dashboardUrl;
  }

  @Override
  public String getToken(final TokenRequest tokenRequest) {
    final var request =
        HttpRequest.newBuilder(toResource("/oauth/token", Map.of()))
            .timeout(timeout)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(tokenRequest.toFormFields())))
            .build();
    final var response = send(request);

    if (response.statusCode() / 100 != 2) {
      throw new AuthorizationException(
          "Unable to get token while authorizing with the account API",
          toApiException(response));
    }

    final var accessToken = readBody(response).path("access_token");
    if (!accessToken.isTextual()) {
      throw new AuthorizationException("Token response did not contain an access token");
    }
    return accessToken.asText();
  }

  @Override
  public Session getSession(final String accessToken) {
    return bearerPost("/session", accessToken, null, Session.class);
  }

  @Override
  public Session refreshSession(final String refreshToken) {
    return bearerPost("/session/refresh", refreshToken, null, Session.class);
  }

  @Override
  public CreatedKey createKey(final String accountKey, final CreateKeyRequest createKeyRequest) {
    final var body =
        new CreateKeyRequest(
            createKeyRequest.role(),
            DatabasePaths.standardizeRegion(createKeyRequest.path()),
            createKeyRequest.ttl(),
            createKeyRequest.name());
    return bearerPost("/databases/keys", accountKey, body, CreatedKey.class);
  }

  private <T> T bearerPost(
      final String endpoint, final String bearer, final Object body, final Class<T> responseType) {
    final String json;
    try {
      json = body == null ? "" : OBJECT_MAPPER.writeValueAsString(body);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize request body", e);
    }

    final var request =
        HttpRequest.newBuilder(toResource(endpoint, Map.of()))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + bearer)
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
    final var response = send(request);
    if (response.statusCode() / 100 != 2) throw toCommandError(response);

    return OBJECT_MAPPER.convertValue(readBody(response), responseType);
  }

  private HttpResponse<String> send(final HttpRequest request) {
    LOGGER.log(DEBUG, "{0} {1}", request.method(), request.uri().getPath());
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new AccountApiException("Failed to communicate with the account API", e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AccountApiException("Account API request interrupted", e);
    }
  }

  /**
   * Maps an error response to the exception kind callers act on.
   *
   * @param response non-2xx response
   * @return the exception to throw
   */
  static RuntimeException toCommandError(final HttpResponse<String> response) {
    final var cause = toApiException(response);
    return switch (response.statusCode()) {
      case 401 -> new AuthenticationException(cause.getMessage(), cause);
      case 403 -> new AuthorizationException(cause.getMessage(), cause);
      case 400, 404 -> new CommandException(cause.getMessage(), cause);
      default -> cause;
    };
  }

  /**
   * Parses an error body. v1 endpoints return {@code code} and {@code reason} at the top level, v2
   * endpoints an {@code error} object with {@code code} and {@code message}.
   */
  static AccountApiException toApiException(final HttpResponse<String> response) {
    var code = "unknown_error";
    var message = "The account API responded with an error, but no error details were provided.";
    final var body = response.body();

    try {
      if (body != null && !body.isBlank()) {
        final var json = OBJECT_MAPPER.readTree(body);
        final var details =
            json.has("error") && json.get("error").isObject() ? json.get("error") : json;
        final var messageField = details.has("message") ? "message" : "reason";
        code = Optional.ofNullable(details.get("code")).map(JsonNode::asText).orElse(code);
        message =
            Optional.ofNullable(details.get(messageField)).map(JsonNode::asText).orElse(message);
      }
    } catch (final JsonProcessingException e) {
      message = "An unknown error occurred while making a request to the account API.";
    }
    return new AccountApiException(response.statusCode(), code, message, body);
  }

  private static JsonNode readBody(final HttpResponse<String> response) {
    try {
      return OBJECT_MAPPER.readTree(Optional.ofNullable(response.body()).orElse("{}"));
    } catch (final JsonProcessingException e) {
      throw new AccountApiException(
          response.statusCode(), "invalid_response", "Failed to parse account API response", null);
    }
  }

  private URI toResource(final String endpoint, final Map<String, String> params) {
    final var base = accountUrl.toString().replaceAll("/+$", "");
    final var query = params.isEmpty() ? "" : "?" + formEncode(params);
    return URI.create(base + API_VERSION + endpoint + query);
  }

  private static String formEncode(final Map<String, String> fields) {
    return fields.entrySet().stream()
        .map(
            e ->
                URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }

  /**
   * First value of a query parameter, URL-decoded.
   *
   * @param uri URI to read
   * @param name parameter name
   * @return decoded value, empty when absent
   */
  public static Optional<String> queryParameter(final URI uri, final String name) {
    return Optional.ofNullable(uri.getRawQuery()).stream()
        .flatMap(query -> Arrays.stream(query.split("&")))
        .map(pair -> pair.split("=", 2))
        .filter(pair -> pair[0].equals(name) && pair.length == 2)
        .map(pair -> URLDecoder.decode(pair[1], StandardCharsets.UTF_8))
        .findFirst();
  }
}
