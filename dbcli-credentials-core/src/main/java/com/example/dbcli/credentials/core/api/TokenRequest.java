package com.example.dbcli.credentials.core.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authorization-code exchange parameters for {@code POST /oauth/token}.
 *
 * @param clientId OAuth client identifier
 * @param clientSecret OAuth client secret, blank for a public client
 * @param authCode code received on the loopback redirect
 * @param redirectUri redirect URI used for the authorization request
 * @param codeVerifier PKCE verifier matching the challenge sent earlier
 */
public record TokenRequest(
    String clientId,
    String clientSecret,
    String authCode,
    String redirectUri,
    String codeVerifier) {

  /** Form fields as the token endpoint expects them. */
  public Map<String, String> toFormFields() {
    final var fields = new LinkedHashMap<String, String>();
    fields.put("clientId", clientId);
    if (clientSecret != null && !clientSecret.isBlank()) fields.put("clientSecret", clientSecret);
    fields.put("authCode", authCode);
    fields.put("redirectURI", redirectUri);
    fields.put("codeVerifier", codeVerifier);
    fields.put("grant_type", "authorization_code");
    return fields;
  }
}
