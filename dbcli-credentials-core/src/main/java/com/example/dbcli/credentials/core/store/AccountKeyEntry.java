package com.example.dbcli.credentials.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Persisted control-plane session of one local profile.
 *
 * @param accountKey account credential used against the control-plane API
 * @param refreshToken token exchanged for a new account credential
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountKeyEntry(String accountKey, String refreshToken) {}
