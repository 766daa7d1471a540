package com.flamingo.ai.linkextractor.service.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HostRateLimiterTest {

  private static final long ONE_SECOND = Duration.ofSeconds(1).toNanos();

  @Test
  @DisplayName("should let the first request to a host start immediately")
  void shouldNotWait_whenFirstRequest() {
    HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1));

    long before = System.nanoTime();
    long slot = limiter.reserve("example.com");

    assertThat(slot).isBetween(before, System.nanoTime());
  }

  @Test
  @DisplayName("should space consecutive requests to the same host")
  void shouldSpaceRequests_whenSameHost() {
    HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1));

    long first = limiter.reserve("example.com");
    long second = limiter.reserve("example.com");
    long third = limiter.reserve("EXAMPLE.com");

    assertThat(second - first).isEqualTo(ONE_SECOND);
    assertThat(third - second).isEqualTo(ONE_SECOND);
  }

  @Test
  @DisplayName("should give concurrent callers for one host slots an interval apart")
  void shouldReserveDistinctSlots_whenCalledConcurrently() throws Exception {
    HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1));
    int callers = 16;
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Long>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return limiter.reserve("example.com");
                }));
      }
      start.countDown();

      List<Long> slots = new ArrayList<>();
      for (Future<Long> future : futures) {
        slots.add(future.get(5, TimeUnit.SECONDS));
      }
      slots.sort(null);

      for (int i = 1; i < slots.size(); i++) {
        assertThat(slots.get(i) - slots.get(i - 1)).isGreaterThanOrEqualTo(ONE_SECOND);
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("should track hosts independently")
  void shouldNotWait_whenDifferentHosts() {
    HostRateLimiter limiter = new HostRateLimiter(Duration.ofSeconds(1));

    limiter.reserve("a.example.com");
    long slot = limiter.reserve("b.example.com");

    assertThat(slot).isLessThanOrEqualTo(System.nanoTime());
  }

  @Test
  @DisplayName("should never wait with a zero interval")
  void shouldNotWait_whenIntervalZero() {
    HostRateLimiter limiter = new HostRateLimiter(Duration.ZERO);

    limiter.reserve("example.com");
    long slot = limiter.reserve("example.com");

    assertThat(slot).isLessThanOrEqualTo(System.nanoTime());
  }

  @Test
  @DisplayName("should block until the reserved slot")
  void shouldWaitForSlot_whenAcquiringTwice() throws InterruptedException {
    HostRateLimiter limiter = new HostRateLimiter(Duration.ofMillis(200));

    limiter.acquire("example.com");
    long before = System.nanoTime();
    limiter.acquire("example.com");

    assertThat(System.nanoTime() - before).isGreaterThanOrEqualTo(Duration.ofMillis(150).toNanos());
  }

  @Test
  @DisplayName("should derive the interval from requests per second")
  void shouldDeriveInterval_fromConfig() {
    LinkExtractorConfig config = new LinkExtractorConfig();
    config.getFetch().setRequestsPerSecond(2.0);

    assertThat(new HostRateLimiter(config).getMinInterval()).isEqualTo(Duration.ofMillis(500));

    config.getFetch().setRequestsPerSecond(0);
    assertThat(new HostRateLimiter(config).getMinInterval()).isZero();
  }
}
