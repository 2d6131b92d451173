package io.caresync.watch;

import io.caresync.model.AlertEvent;
import io.caresync.model.SlotReport;
import io.caresync.model.WatchSubscription;
import io.caresync.spi.AlertDedupStore;
import io.caresync.spi.AlertSink;
import io.caresync.spi.ConnectionProvider;
import io.caresync.spi.MetricsExporter;
import io.caresync.spi.SlotSource;
import io.caresync.spi.WatchSubscriptionStore;
import io.caresync.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns candidate slot reports for one subscription into deduplicated, rate-limited alerts.
 *
 * <p>Each report is filtered against the subscription, checked against the durable
 * dedup window and the rolling rate limit, then recorded (dedup key plus alert count)
 * in one transaction before the alert is handed to the {@link AlertSink}. A crash
 * between the commit and the hand-off loses that alert rather than repeating it.
 * The rate limiter belongs to the subscription, not the watcher, so restarting a
 * watcher keeps the alerts already counted in the window.
 *
 * <p>Not thread-safe: the {@link WatcherSupervisor} confines each watcher to its own
 * single-threaded lane, which also keeps alerts in discovery order.
 */
public final class CancellationWatcher {
  private static final Logger logger = Logger.getLogger(CancellationWatcher.class.getName());

  /** What happened to one report. */
  public enum Outcome {
    FILTERED,
    DUPLICATE,
    RATE_LIMITED,
    ALERTED
  }

  private final ConnectionProvider connectionProvider;
  private final WatchSubscriptionStore subscriptionStore;
  private final AlertDedupStore dedupStore;
  private final SlotSource source;
  private final AlertSink alertSink;
  private final SlotMatcher matcher;
  private final SlidingWindowRateLimiter rateLimiter;
  private final Duration dedupWindow;
  private final MetricsExporter metrics;
  private final Clock clock;
  private volatile WatchSubscription subscription;

  CancellationWatcher(WatchSubscription subscription, SlotSource source,
                      SlidingWindowRateLimiter rateLimiter, WatcherSupervisor.Settings settings) {
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.source = Objects.requireNonNull(source, "source");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.connectionProvider = settings.connectionProvider();
    this.subscriptionStore = settings.subscriptionStore();
    this.dedupStore = settings.dedupStore();
    this.alertSink = settings.alertSink();
    this.matcher = settings.matcher();
    this.dedupWindow = settings.dedupWindow();
    this.metrics = settings.metrics();
    this.clock = settings.clock();
  }

  public WatchSubscription subscription() {
    return subscription;
  }

  void subscription(WatchSubscription updated) {
    this.subscription = updated;
  }

  SlotSource source() {
    return source;
  }

  /**
   * Queries the source once and processes every returned report in order.
   *
   * @return number of alerts emitted
   */
  public int pollOnce() throws WatcherSourceException, InterruptedException {
    List<SlotReport> reports = source.queryAvailability(subscription);
    int alerted = 0;
    for (SlotReport report : reports) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("watcher stopped");
      }
      if (process(report) == Outcome.ALERTED) {
        alerted++;
      }
    }
    return alerted;
  }

  /**
   * Runs one report through filter, dedup, rate limit, record and delivery.
   */
  public Outcome process(SlotReport report) {
    WatchSubscription sub = subscription;
    Instant now = clock.instant();
    if (!matcher.matches(sub, report, now)) {
      return Outcome.FILTERED;
    }
    String dedupKey = AlertEvent.dedupKey(sub.subscriptionId(), report);
    Instant windowStart = now.minus(dedupWindow);
    boolean seen = Transactions.withConnection(connectionProvider,
        conn -> dedupStore.seenSince(conn, dedupKey, windowStart));
    if (seen) {
      metrics.incrementAlertsDeduplicated();
      return Outcome.DUPLICATE;
    }
    if (!rateLimiter.permits(now)) {
      metrics.incrementAlertsRateLimited();
      logger.log(Level.FINE, "Rate limit reached for subscription {0}, dropping slot {1}",
          new Object[]{sub.subscriptionId(), report.slotStart()});
      return Outcome.RATE_LIMITED;
    }
    boolean recorded = Transactions.inTransaction(connectionProvider, conn -> {
      if (!dedupStore.tryRecord(conn, dedupKey, now, windowStart)) {
        return false;
      }
      subscriptionStore.recordAlert(conn, sub.subscriptionId(), now);
      return true;
    });
    if (!recorded) {
      metrics.incrementAlertsDeduplicated();
      return Outcome.DUPLICATE;
    }
    rateLimiter.record(now);

    AlertEvent alert = AlertEvent.of(sub, report, now);
    try {
      alertSink.deliver(alert);
      metrics.incrementAlertsDelivered();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Alert sink failed for alert " + alert.alertId()
          + " of subscription " + sub.subscriptionId(), e);
    }
    return Outcome.ALERTED;
  }
}
