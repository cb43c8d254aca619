package com.example.dbcli.credentials.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Control-plane session returned by {@code POST /session} and {@code POST /session/refresh}.
 *
 * @param accountKey account credential
 * @param refreshToken token for the next refresh
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Session(
    @JsonProperty("account_key") String accountKey,
    @JsonProperty("refresh_token") String refreshToken) {}
