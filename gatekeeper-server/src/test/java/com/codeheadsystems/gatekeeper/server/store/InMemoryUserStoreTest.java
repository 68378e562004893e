package com.codeheadsystems.gatekeeper.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.server.exception.DuplicateUsernameException;
import com.codeheadsystems.gatekeeper.server.model.Credential;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryUserStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private InMemoryUserStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryUserStore();
  }

  @Test
  void insertAndFind_roundTrip() {
    Credential credential = new Credential("alice", "$argon2id$digest", NOW);
    store.insert(credential);

    assertThat(store.findByUsername("alice")).contains(credential);
    assertThat(store.findByUsername("bob")).isEmpty();
  }

  @Test
  void insert_duplicate_throws() {
    store.insert(new Credential("alice", "$argon2id$first", NOW));

    assertThatThrownBy(() -> store.insert(new Credential("alice", "$argon2id$second", NOW)))
        .isInstanceOf(DuplicateUsernameException.class)
        .hasMessageContaining("alice");
    assertThat(store.findByUsername("alice")).get()
        .extracting(Credential::passwordDigest).isEqualTo("$argon2id$first");
  }

  @Test
  void updateDigest_replacesOnlyTheDigest() {
    store.insert(new Credential("alice", "$argon2id$old", NOW));

    assertThat(store.updateDigest("alice", "$argon2id$new")).isTrue();
    assertThat(store.findByUsername("alice")).contains(new Credential("alice", "$argon2id$new", NOW));
    assertThat(store.updateDigest("bob", "$argon2id$new")).isFalse();
  }

  @Test
  void insert_concurrentSameUsername_exactlyOneWins() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger duplicates = new AtomicInteger();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        String digest = "$argon2id$" + i;
        futures.add(executor.submit(() -> {
          start.await();
          try {
            store.insert(new Credential("alice", digest, NOW));
          } catch (DuplicateUsernameException e) {
            duplicates.incrementAndGet();
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(duplicates.get()).isEqualTo(threads - 1);
  }
}
