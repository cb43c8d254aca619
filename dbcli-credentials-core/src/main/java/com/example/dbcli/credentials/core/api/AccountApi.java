package com.example.dbcli.credentials.core.api;

import java.net.URI;
import java.util.Map;

/**
 * Control-plane operations the credential subsystem depends on.
 *
 * <p>Implementations classify failures once: HTTP 401 becomes {@link
 * com.example.dbcli.credentials.core.AuthenticationException}, HTTP 403 {@link
 * com.example.dbcli.credentials.core.AuthorizationException}, 400 and 404 {@link
 * com.example.dbcli.credentials.core.CommandException}, anything else {@link AccountApiException}.
 */
public interface AccountApi {

  /**
   * Starts the authorization-code flow ({@code GET /oauth/authorize}).
   *
   * @param authorizationParams OAuth authorization request parameters
   * @return dashboard URL the user has to open in a browser
   */
  URI startOAuthRequest(Map<String, String> authorizationParams);

  /**
   * Exchanges an authorization code for an access token ({@code POST /oauth/token}).
   *
   * @param request code exchange parameters
   * @return OAuth access token
   */
  String getToken(TokenRequest request);

  /**
   * Exchanges an access token for a control-plane session ({@code POST /session}).
   *
   * @param accessToken OAuth access token
   * @return new session
   */
  Session getSession(String accessToken);

  /**
   * Exchanges a refresh token for a new session ({@code POST /session/refresh}).
   *
   * @param refreshToken stored refresh token
   * @return new session
   */
  Session refreshSession(String refreshToken);

  /**
   * Mints a database key ({@code POST /databases/keys}).
   *
   * @param accountKey account credential authorizing the call
   * @param request key parameters
   * @return minted key
   */
  CreatedKey createKey(String accountKey, CreateKeyRequest request);
}
