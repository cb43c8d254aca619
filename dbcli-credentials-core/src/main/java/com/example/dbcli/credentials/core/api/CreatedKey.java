package com.example.dbcli.credentials.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Key minted by the control plane. Only the secret is used here.
 *
 * @param secret the database secret
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreatedKey(String secret) {}
