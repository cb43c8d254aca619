package com.example.dbcli.credentials.core;

import java.util.function.Predicate;

/**
 * Decides whether a failure is authentication-class and therefore worth one refresh-and-retry.
 *
 * <h3>Combining Detectors</h3>
 *
 * <pre>{@code
 * var detector = UnauthorizedDetector.defaultDetector()
 *     .or(UnauthorizedDetector.custom(t -> t instanceof QueryFailure qf && qf.status() == 401));
 * }</pre>
 */
@FunctionalInterface
public interface UnauthorizedDetector {

  /**
   * Determines if the failure represents a rejected credential.
   *
   * @param error the failure to inspect
   * @return true if the credential should be refreshed
   */
  boolean isUnauthorized(Throwable error);

  /**
   * Returns the default detector: an {@link AuthenticationException} in the cause chain that is not
   * wrapped by another {@link CommandException}.
   *
   * @return default detector
   */
  static UnauthorizedDetector defaultDetector() {
    return error -> findAuthenticationFailure(error) != null;
  }

  /**
   * Creates a custom detector from a predicate.
   *
   * @param predicate the predicate to use for detection
   * @return custom detector
   */
  static UnauthorizedDetector custom(final Predicate<Throwable> predicate) {
    return predicate::test;
  }

  /**
   * Combines this detector with another using OR logic.
   *
   * @param other the other detector to combine with
   * @return combined detector
   */
  default UnauthorizedDetector or(final UnauthorizedDetector other) {
    return e -> this.isUnauthorized(e) || other.isUnauthorized(e);
  }

  /**
   * Finds the first {@link AuthenticationException} in a throwable cause chain. The search stops at
   * any other {@link CommandException}: those are terminal, user-facing outcomes such as a login
   * prompt, even when a rejected credential caused them.
   *
   * @param t the throwable to search
   * @return the authentication failure, or null if none found
   */
  static AuthenticationException findAuthenticationFailure(final Throwable t) {
    Throwable cur = t;
    while (cur != null) {
      if (cur instanceof AuthenticationException auth) return auth;
      if (cur instanceof CommandException) return null;
      if (cur.getCause() == cur) return null;
      cur = cur.getCause();
    }
    return null;
  }
}
