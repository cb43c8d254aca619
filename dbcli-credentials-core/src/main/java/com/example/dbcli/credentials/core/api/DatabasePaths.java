package com.example.dbcli.credentials.core.api;

import java.util.Locale;
import java.util.Map;

/** Normalization of database paths before they are sent to the control plane. */
public final class DatabasePaths {

  private static final Map<String, String> REGION_GROUPS =
      Map.of("us", "us-std", "eu", "eu-std", "classic", "global");

  private DatabasePaths() {}

  /**
   * Trims surrounding slashes and expands region-group aliases in the first path segment, so
   * {@code /us/mydb/} becomes {@code us-std/mydb}.
   *
   * @param databasePath database path, may be null
   * @return normalized path, or the input when null or empty
   */
  public static String standardizeRegion(final String databasePath) {
    if (databasePath == null || databasePath.isEmpty()) return databasePath;

    var trimmed = databasePath;
    if (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
    if (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);

    final var slash = trimmed.indexOf('/');
    final var region = (slash < 0 ? trimmed : trimmed.substring(0, slash)).toLowerCase(Locale.ROOT);
    final var rest = slash < 0 ? "" : trimmed.substring(slash + 1);

    final var standardRegion = REGION_GROUPS.getOrDefault(region, region);
    return rest.isEmpty() ? standardRegion : standardRegion + "/" + rest;
  }
}
