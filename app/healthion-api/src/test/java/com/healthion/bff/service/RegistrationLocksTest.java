package com.healthion.bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthion.bff.config.RegistrationLockProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RegistrationLocksTest {

  private final RegistrationLocks locks =
      new RegistrationLocks(new RegistrationLockProperties(100, Duration.ofMinutes(1)));

  @Test
  void serializesCallsForSameEmailIgnoringCase() throws Exception {
    final AtomicInteger inside = new AtomicInteger();
    final AtomicInteger maxInside = new AtomicInteger();
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      final List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        final String email = i % 2 == 0 ? "a@example.com" : "A@Example.com";
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return locks.withLock(
                      email,
                      () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleepQuietly(5);
                        inside.decrementAndGet();
                        return 1;
                      });
                }));
      }
      start.countDown();
      for (Future<Integer> future : futures) {
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(1);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(maxInside.get()).isEqualTo(1);
  }

  @Test
  void differentEmailsDoNotBlockEachOther() throws Exception {
    final CountDownLatch bothInside = new CountDownLatch(2);
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final Future<Boolean> first =
          executor.submit(
              () ->
                  locks.withLock(
                      "a@example.com",
                      () -> {
                        bothInside.countDown();
                        return awaitQuietly(bothInside);
                      }));
      final Future<Boolean> second =
          executor.submit(
              () ->
                  locks.withLock(
                      "b@example.com",
                      () -> {
                        bothInside.countDown();
                        return awaitQuietly(bothInside);
                      }));

      assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
      assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void releasesLockWhenActionThrows() {
    assertThatThrownBy(
            () ->
                locks.withLock(
                    "a@example.com",
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(locks.withLock("a@example.com", () -> "ok")).isEqualTo("ok");
  }

  @Test
  void boundsNumberOfRetainedLocks() {
    final RegistrationLocks small =
        new RegistrationLocks(new RegistrationLockProperties(2, Duration.ofMinutes(1)));

    for (int i = 0; i < 50; i++) {
      small.withLock("user" + i + "@example.com", () -> null);
    }

    assertThat(small.estimatedSize()).isLessThanOrEqualTo(2);
  }

  @Test
  void rejectsBlankEmail() {
    assertThatThrownBy(() -> locks.withLock(" ", () -> null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static boolean awaitQuietly(CountDownLatch latch) {
    try {
      return latch.await(2, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
