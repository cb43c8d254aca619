package com.example.dbcli.credentials.core.api;

/**
 * Body of {@code POST /databases/keys}.
 *
 * @param role builtin role of the key
 * @param path database path including region group
 * @param ttl ISO-8601 expiry instant
 * @param name key name
 */
public record CreateKeyRequest(String role, String path, String ttl, String name) {}
