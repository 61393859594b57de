package mailqueue.admission;

import mailqueue.admission.AdmissionDecision.Window;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-client sliding-window admission gate with a per-second and a per-minute ceiling.
 *
 * <p>Each client's record is updated inside {@link ConcurrentHashMap#compute}, so evaluating
 * the ceilings and recording an admitted request happen as one step per client: concurrent
 * requests from one client can never all pass the check before any of them is counted.
 * Different clients do not contend.
 *
 * <p>A record holds only timestamps within the last minute and is removed from the map as
 * soon as it is empty, so memory is bounded by the clients active during the last minute.
 * Records of clients that stop sending are swept at most once per minute on the request path,
 * or explicitly via {@link #evictIdle()}.
 *
 * <p>This class is thread-safe and never blocks beyond the per-key critical section.
 */
public final class SlidingWindowRateLimiter {
  public static final int DEFAULT_PER_SECOND = 10;
  public static final int DEFAULT_PER_MINUTE = 60;

  private static final long SECOND_MS = Window.PER_SECOND.length().toMillis();
  private static final long MINUTE_MS = Window.PER_MINUTE.length().toMillis();

  private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();
  private final int perSecond;
  private final int perMinute;
  private final Clock clock;
  private final AtomicLong lastSweepMs;

  public SlidingWindowRateLimiter() {
    this(DEFAULT_PER_SECOND, DEFAULT_PER_MINUTE);
  }

  public SlidingWindowRateLimiter(int perSecond, int perMinute) {
    this(perSecond, perMinute, Clock.systemUTC());
  }

  /**
   * @param perSecond ceiling for any trailing one-second window (must be &gt; 0)
   * @param perMinute ceiling for any trailing one-minute window (must be &gt; 0)
   * @param clock     time source
   */
  public SlidingWindowRateLimiter(int perSecond, int perMinute, Clock clock) {
    if (perSecond <= 0) {
      throw new IllegalArgumentException("perSecond must be > 0, got: " + perSecond);
    }
    if (perMinute <= 0) {
      throw new IllegalArgumentException("perMinute must be > 0, got: " + perMinute);
    }
    this.perSecond = perSecond;
    this.perMinute = perMinute;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.lastSweepMs = new AtomicLong(clock.millis());
  }

  /**
   * Evaluates and, if admitted, records one request from {@code clientKey}.
   *
   * @param clientKey stable client identifier (see {@link ClientKeys})
   * @return {@link AdmissionDecision.Allowed} or a {@link AdmissionDecision.RateLimited} with a
   *     retry hint
   */
  public AdmissionDecision tryAcquire(String clientKey) {
    Objects.requireNonNull(clientKey, "clientKey");
    long now = clock.millis();
    maybeSweep(now);

    AdmissionDecision[] decision = new AdmissionDecision[1];
    windows.compute(clientKey, (key, existing) -> {
      RateWindow window = existing != null ? existing : new RateWindow();
      window.prune(now);
      decision[0] = window.admit(now, perSecond, perMinute);
      return window.isEmpty() ? null : window;
    });
    return decision[0];
  }

  /**
   * Convenience form of {@link #tryAcquire(String)}.
   *
   * @return {@code true} if the request is admitted (and recorded)
   */
  public boolean allow(String clientKey) {
    return tryAcquire(clientKey).isAllowed();
  }

  /**
   * Prunes every record and removes those left empty.
   *
   * @return number of client records removed
   */
  public int evictIdle() {
    long now = clock.millis();
    lastSweepMs.set(now);
    return sweep(now);
  }

  /** Number of clients currently holding a record. */
  public int trackedClients() {
    return windows.size();
  }

  /** Whether a record exists for {@code clientKey}. */
  public boolean isTracked(String clientKey) {
    return windows.containsKey(clientKey);
  }

  /** Drops all state. */
  public void clear() {
    windows.clear();
  }

  public int perSecond() {
    return perSecond;
  }

  public int perMinute() {
    return perMinute;
  }

  private void maybeSweep(long now) {
    long last = lastSweepMs.get();
    if (now - last < MINUTE_MS) return;
    if (!lastSweepMs.compareAndSet(last, now)) return;
    sweep(now);
  }

  private int sweep(long now) {
    int removed = 0;
    for (Map.Entry<String, RateWindow> entry : windows.entrySet()) {
      boolean[] emptied = new boolean[1];
      windows.computeIfPresent(entry.getKey(), (key, window) -> {
        window.prune(now);
        emptied[0] = window.isEmpty();
        return emptied[0] ? null : window;
      });
      if (emptied[0]) {
        removed++;
      }
    }
    return removed;
  }

  /**
   * Ordered request timestamps of one client. Only accessed inside a map compute call for
   * its key.
   */
  private static final class RateWindow {
    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

    void prune(long now) {
      while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= MINUTE_MS) {
        timestamps.pollFirst();
      }
    }

    AdmissionDecision admit(long now, int perSecond, int perMinute) {
      long oldestInSecond = -1;
      int inSecond = 0;
      Iterator<Long> newestFirst = timestamps.descendingIterator();
      while (newestFirst.hasNext()) {
        long ts = newestFirst.next();
        if (now - ts >= SECOND_MS) break;
        oldestInSecond = ts;
        inSecond++;
      }
      boolean secondFull = inSecond >= perSecond;
      boolean minuteFull = timestamps.size() >= perMinute;
      if (!secondFull && !minuteFull) {
        timestamps.addLast(now);
        return AdmissionDecision.allowed();
      }
      // Both ceilings must clear before the next request passes, so report the later expiry.
      long secondWait = secondFull ? oldestInSecond + SECOND_MS - now : 0L;
      long minuteWait = minuteFull ? timestamps.peekFirst() + MINUTE_MS - now : 0L;
      Window violated = minuteWait >= secondWait ? Window.PER_MINUTE : Window.PER_SECOND;
      long waitMs = Math.max(1L, Math.max(secondWait, minuteWait));
      return AdmissionDecision.rateLimited(Duration.ofMillis(waitMs), violated);
    }

    boolean isEmpty() {
      return timestamps.isEmpty();
    }
  }
}
