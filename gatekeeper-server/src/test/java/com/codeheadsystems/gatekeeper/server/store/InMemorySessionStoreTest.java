package com.codeheadsystems.gatekeeper.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.codeheadsystems.gatekeeper.server.model.SessionToken;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory session store test.
 */
class InMemorySessionStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore();
  }

  private static SessionToken session(String tokenId, String username) {
    return new SessionToken(tokenId, username, NOW, NOW.plusSeconds(3600));
  }

  @Test
  void putAndGet_roundTrip() {
    SessionToken token = session("token-1", "alice");
    store.put(token);

    assertThat(store.get("token-1")).contains(token);
  }

  @Test
  void get_notFound_returnsEmpty() {
    assertThat(store.get("nonexistent")).isEmpty();
  }

  /**
   * Expiry belongs to the caller's clock, so the store hands back expired sessions unchanged.
   */
  @Test
  void get_expired_isStillReturned() {
    SessionToken expired = new SessionToken("token-old", "alice",
        NOW.minusSeconds(7200), NOW.minusSeconds(3600));
    store.put(expired);

    assertThat(store.get("token-old")).contains(expired);
  }

  @Test
  void delete_removesSession_andIsIdempotent() {
    store.put(session("token-del", "alice"));

    store.delete("token-del");
    assertThat(store.get("token-del")).isEmpty();
    assertThatCode(() -> store.delete("token-del")).doesNotThrowAnyException();
    assertThat(store.size()).isZero();
  }

  @Test
  void deleteByUsername_removesAllSessionsForUser_leavesOthersIntact() {
    store.put(session("token-a1", "alice"));
    store.put(session("token-a2", "alice"));
    store.put(session("token-b1", "bob"));

    store.deleteByUsername("alice");

    assertThat(store.get("token-a1")).isEmpty();
    assertThat(store.get("token-a2")).isEmpty();
    assertThat(store.get("token-b1")).isPresent();
  }

  @Test
  void deleteByUsername_afterSingleDelete_skipsRemovedToken() {
    store.put(session("token-a1", "alice"));
    store.put(session("token-a2", "alice"));
    store.delete("token-a1");

    store.deleteByUsername("alice");

    assertThat(store.size()).isZero();
  }

  @Test
  void deleteByUsername_unknownUser_doesNotThrow() {
    assertThatCode(() -> store.deleteByUsername("nobody"))
        .doesNotThrowAnyException();
  }

  @Test
  void delete_everySession_leavesIndexEmpty() {
    for (int i = 0; i < 1000; i++) {
      store.put(session("token-" + i, "user-" + i));
      store.delete("token-" + i);
    }

    assertThat(store.size()).isZero();
    assertThat(store.indexedUsernames()).isZero();
  }

  @Test
  void delete_lastOfSeveralSessions_dropsUsernameFromIndex() {
    store.put(session("token-a1", "alice"));
    store.put(session("token-a2", "alice"));

    store.delete("token-a1");
    assertThat(store.indexedUsernames()).isEqualTo(1);

    store.delete("token-a2");
    assertThat(store.indexedUsernames()).isZero();
  }

  @Test
  void purgeExpired_removesExpiredSessionsAndTheirIndexEntries() {
    store.put(new SessionToken("token-old", "alice", NOW.minusSeconds(7200), NOW.minusSeconds(3600)));
    store.put(new SessionToken("token-edge", "bob", NOW.minusSeconds(3600), NOW));
    store.put(session("token-live", "carol"));

    assertThat(store.purgeExpired(NOW)).isEqualTo(2);

    assertThat(store.get("token-old")).isEmpty();
    assertThat(store.get("token-edge")).isEmpty();
    assertThat(store.get("token-live")).isPresent();
    assertThat(store.indexedUsernames()).isEqualTo(1);
    assertThat(store.purgeExpired(NOW)).isZero();
  }

  /**
   * Every session stored for a user is either revoked by a concurrent deleteByUsername or stays
   * reachable through the index, so a later deleteByUsername always clears the store.
   */
  @Test
  void putConcurrentWithDeleteByUsername_neverOrphansSession() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < 200; round++) {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        int r = round;
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < 20; i++) {
            store.put(session("token-" + r + "-" + i, "alice"));
          }
          return null;
        }));
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < 20; i++) {
            store.deleteByUsername("alice");
          }
          return null;
        }));
        start.countDown();
        for (Future<?> future : futures) {
          future.get(10, TimeUnit.SECONDS);
        }

        store.deleteByUsername("alice");
        assertThat(store.size()).isZero();
        assertThat(store.indexedUsernames()).isZero();
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
