/**
 * Root package of the dbcli credential subsystem.
 *
 * <p>This package resolves, stores, refreshes and mints the two credentials a database command
 * needs: the account credential of a local profile and a short-lived database secret scoped to a
 * database path and role.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.dbcli.credentials.core.CredentialsFacade} – per-invocation entry
 *       point; validates inputs, wires both key managers and purges orphaned secrets.
 *   <li>{@link com.example.dbcli.credentials.core.RetryOnUnauthorized} – runs a call and retries
 *       it once after refreshing a rejected credential.
 *   <li>{@link com.example.dbcli.credentials.core.UnauthorizedDetector} – classifies failures as
 *       authentication-class.
 *   <li>{@link com.example.dbcli.credentials.core.store.CredentialStore} – JSON-file backed
 *       namespaced stores for account credentials and database secrets.
 *   <li>{@link com.example.dbcli.credentials.core.api.HttpAccountApi} – control-plane client for
 *       sessions, key minting and the OAuth endpoints.
 *   <li>{@link com.example.dbcli.credentials.core.keys.AccountKeyManager} – account credential
 *       resolution and refresh.
 *   <li>{@link com.example.dbcli.credentials.core.keys.DatabaseKeyManager} – database secret
 *       resolution, expiry and minting.
 *   <li>{@link com.example.dbcli.credentials.core.oauth.OAuthLoginFlow} – browser login with PKCE
 *       and a loopback redirect listener.
 *   <li>{@link com.example.dbcli.credentials.core.reactive.ReactiveRetryOnUnauthorized} – the
 *       retry-once policy for {@code Mono}-returning calls.
 * </ul>
 */
package com.example.dbcli.credentials.core;
