package com.flamingo.ai.linkextractor.service.fetch;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Spaces out requests to the same host by a minimum interval.
 *
 * <p>A caller reserves the next free start slot for its host and then waits for it. The slot is
 * computed and recorded in one atomic map update, so concurrent callers for the same host always
 * receive distinct slots at least one interval apart.
 */
@Component
@Slf4j
public class HostRateLimiter {

  private final ConcurrentMap<String, Long> lastStartNanos = new ConcurrentHashMap<>();
  private final long minIntervalNanos;

  @Autowired
  public HostRateLimiter(LinkExtractorConfig config) {
    this(intervalFor(config.getFetch().getRequestsPerSecond()));
  }

  public HostRateLimiter(Duration minInterval) {
    this.minIntervalNanos = Math.max(0, minInterval.toNanos());
  }

  /**
   * Blocks until a request to the host may start.
   *
   * @param host the URL host; {@code null} is treated as its own bucket
   * @throws InterruptedException if interrupted while waiting
   */
  public void acquire(String host) throws InterruptedException {
    long waitNanos = reserve(host) - System.nanoTime();
    if (waitNanos > 0) {
      log.debug("Rate limiting {}: waiting {} ms", host, TimeUnit.NANOSECONDS.toMillis(waitNanos));
      TimeUnit.NANOSECONDS.sleep(waitNanos);
    }
  }

  /**
   * Reserves the next start slot for the host without waiting for it.
   *
   * @param host the URL host; {@code null} is treated as its own bucket
   * @return the reserved start, on the {@link System#nanoTime()} scale
   */
  public long reserve(String host) {
    String key = host == null ? "" : host.toLowerCase(Locale.ROOT);
    return lastStartNanos.merge(
        key,
        System.nanoTime(),
        (previous, now) -> Math.max(now, previous + minIntervalNanos));
  }

  public Duration getMinInterval() {
    return Duration.ofNanos(minIntervalNanos);
  }

  private static Duration intervalFor(double requestsPerSecond) {
    if (requestsPerSecond <= 0) {
      return Duration.ZERO;
    }
    return Duration.ofNanos((long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond));
  }
}
