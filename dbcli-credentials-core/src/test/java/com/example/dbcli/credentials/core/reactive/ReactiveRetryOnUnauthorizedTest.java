package com.example.dbcli.credentials.core.reactive;

import static org.junit.jupiter.api.Assertions.*;

import com.example.dbcli.credentials.core.AuthenticationException;
import com.example.dbcli.credentials.core.CommandException;
import com.example.dbcli.credentials.core.LoginRequiredException;
import com.example.dbcli.credentials.core.UnauthorizedDetector;
import com.example.dbcli.credentials.core.keys.KeyProvider;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class ReactiveRetryOnUnauthorizedTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  /** Hands out "secret-1", then "secret-2" after an invalidation. */
  private static final class SwitchingProvider implements KeyProvider {
    private final AtomicInteger invalidations = new AtomicInteger();
    private final RuntimeException refreshFailure;

    SwitchingProvider(final RuntimeException refreshFailure) {
      this.refreshFailure = refreshFailure;
    }

    @Override
    public String key() {
      return "secret-" + (invalidations.get() + 1);
    }

    @Override
    public String getOrRefresh() {
      return key();
    }

    @Override
    public void onInvalidCreds(final RuntimeException cause) {
      if (refreshFailure != null) throw refreshFailure;
      invalidations.incrementAndGet();
    }
  }

  @Test
  @DisplayName("Resubscribes once with the refreshed secret after a rejection")
  void shouldRetryOnceWithRefreshedSecret() {
    final var provider = new SwitchingProvider(null);
    final var seen = new CopyOnWriteArrayList<String>();

    final var result =
        ReactiveRetryOnUnauthorized.run(
                provider,
                secret -> {
                  seen.add(secret);
                  return seen.size() == 1
                      ? Mono.<String>error(new AuthenticationException("401"))
                      : Mono.just("ok:" + secret);
                })
            .block(TIMEOUT);

    assertEquals("ok:secret-2", result);
    assertEquals(List.of("secret-1", "secret-2"), seen);
  }

  @Test
  @DisplayName("Propagates a second rejection unchanged")
  void shouldPropagateSecondRejection() {
    final var provider = new SwitchingProvider(null);
    final var attempts = new AtomicInteger();
    final var second = new AuthenticationException("401 again");

    final var mono =
        ReactiveRetryOnUnauthorized.run(
            provider,
            secret ->
                attempts.incrementAndGet() == 1
                    ? Mono.<String>error(new AuthenticationException("401"))
                    : Mono.<String>error(second));

    final var ex = assertThrows(AuthenticationException.class, () -> mono.block(TIMEOUT));
    assertSame(second, ex);
    assertEquals(2, attempts.get());
  }

  @Test
  @DisplayName("Does not retry other failures")
  void shouldNotRetryOtherFailures() {
    final var provider = new SwitchingProvider(null);
    final var attempts = new AtomicInteger();

    final var mono =
        ReactiveRetryOnUnauthorized.run(
            provider,
            secret -> {
              attempts.incrementAndGet();
              return Mono.<String>error(new CommandException("bad query"));
            });

    assertThrows(CommandException.class, () -> mono.block(TIMEOUT));
    assertEquals(1, attempts.get());
  }

  @Test
  @DisplayName("Surfaces a failed refresh instead of retrying")
  void shouldSurfaceRefreshFailure() {
    final var provider = new SwitchingProvider(new LoginRequiredException("default", null));
    final var attempts = new AtomicInteger();

    final var mono =
        ReactiveRetryOnUnauthorized.run(
            provider,
            secret -> {
              attempts.incrementAndGet();
              return Mono.<String>error(new AuthenticationException("401"));
            });

    assertThrows(LoginRequiredException.class, () -> mono.block(TIMEOUT));
    assertEquals(1, attempts.get());
  }

  @Test
  @DisplayName("Honors a custom detector")
  void shouldHonorCustomDetector() {
    final var provider = new SwitchingProvider(null);
    final var detector = UnauthorizedDetector.custom(e -> e instanceof IllegalStateException);

    final var result =
        ReactiveRetryOnUnauthorized.run(
                provider,
                secret ->
                    "secret-1".equals(secret)
                        ? Mono.<String>error(new IllegalStateException("expired"))
                        : Mono.just(secret),
                detector)
            .block(TIMEOUT);

    assertEquals("secret-2", result);
  }
}
