package com.example.dbcli.credentials.core.oauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Proof-key material of one login: a code verifier, its S256 challenge and the CSRF state sent
 * with the authorization request.
 */
public final class Pkce {

  /** Challenge method sent with the authorization request. */
  public static final String METHOD = "S256";

  private static final int RANDOM_BYTES = 20;
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final String verifier;
  private final String challenge;
  private final String state;

  Pkce(final String verifier, final String state) {
    this.verifier = verifier;
    this.challenge = challengeOf(verifier);
    this.state = state;
  }

  public static Pkce generate() {
    return generate(new SecureRandom());
  }

  static Pkce generate(final SecureRandom random) {
    return new Pkce(randomToken(random), randomToken(random));
  }

  /**
   * Base64url (unpadded) SHA-256 digest of the verifier.
   *
   * @param verifier PKCE code verifier
   * @return S256 code challenge
   */
  public static String challengeOf(final String verifier) {
    try {
      final var digest = MessageDigest.getInstance("SHA-256");
      return ENCODER.encodeToString(digest.digest(verifier.getBytes(StandardCharsets.US_ASCII)));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  private static String randomToken(final SecureRandom random) {
    final var bytes = new byte[RANDOM_BYTES];
    random.nextBytes(bytes);
    return ENCODER.encodeToString(bytes);
  }

  public String verifier() {
    return verifier;
  }

  public String challenge() {
    return challenge;
  }

  public String state() {
    return state;
  }
}
