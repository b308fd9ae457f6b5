package changefeed.micrometer;

import changefeed.model.ItemKind;
import changefeed.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code changefeed.polls} - successful feed polls</li>
 *   <li>{@code changefeed.polls.failed} - polls that failed, were cancelled or timed out</li>
 *   <li>{@code changefeed.token.jobs} tagged {@code kind=app|package} - token jobs submitted</li>
 *   <li>{@code changefeed.throttle.pauses} - pauses taken while the backpressure gate was busy</li>
 *   <li>{@code changefeed.announcements} tagged {@code form=detailed|compact}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code changefeed.change.number} - last change number the tracker advanced to</li>
 *   <li>{@code changefeed.workload.tasks}, {@code .jobs}, {@code .processing}, {@code .locks}</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter polls;
  private final Counter pollFailures;
  private final Counter appTokenJobs;
  private final Counter packageTokenJobs;
  private final Counter throttlePauses;
  private final Counter detailedAnnouncements;
  private final Counter compactAnnouncements;
  private final List<Gauge> gauges;

  private final AtomicLong changeNumber = new AtomicLong();
  private final AtomicInteger tasks = new AtomicInteger();
  private final AtomicInteger jobs = new AtomicInteger();
  private final AtomicInteger processing = new AtomicInteger();
  private final AtomicInteger locks = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "changefeed"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "changefeed");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "steam.changefeed"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.polls = Counter.builder(namePrefix + ".polls")
        .description("Successful feed polls")
        .register(registry);
    this.pollFailures = Counter.builder(namePrefix + ".polls.failed")
        .description("Feed polls that failed, were cancelled or timed out")
        .register(registry);
    this.appTokenJobs = tokenJobs(namePrefix, "app");
    this.packageTokenJobs = tokenJobs(namePrefix, "package");
    this.throttlePauses = Counter.builder(namePrefix + ".throttle.pauses")
        .description("Pauses taken while the backpressure gate was busy")
        .register(registry);
    this.detailedAnnouncements = announcements(namePrefix, "detailed");
    this.compactAnnouncements = announcements(namePrefix, "compact");

    this.gauges = List.of(
        Gauge.builder(namePrefix + ".change.number", changeNumber, AtomicLong::get)
            .description("Last change number the tracker advanced to")
            .register(registry),
        Gauge.builder(namePrefix + ".workload.tasks", tasks, AtomicInteger::get).register(registry),
        Gauge.builder(namePrefix + ".workload.jobs", jobs, AtomicInteger::get).register(registry),
        Gauge.builder(namePrefix + ".workload.processing", processing, AtomicInteger::get).register(registry),
        Gauge.builder(namePrefix + ".workload.locks", locks, AtomicInteger::get).register(registry));
  }

  private Counter tokenJobs(String namePrefix, String kind) {
    return Counter.builder(namePrefix + ".token.jobs")
        .description("Token-acquisition jobs submitted")
        .tag("kind", kind)
        .register(registry);
  }

  private Counter announcements(String namePrefix, String form) {
    return Counter.builder(namePrefix + ".announcements")
        .description("Changelists announced")
        .tag("form", form)
        .register(registry);
  }

  @Override
  public void incrementPolls() {
    if (closed) return;
    polls.increment();
  }

  @Override
  public void incrementPollFailures() {
    if (closed) return;
    pollFailures.increment();
  }

  @Override
  public void recordChangeNumber(long changeNumber) {
    if (closed) return;
    this.changeNumber.set(changeNumber);
  }

  @Override
  public void incrementTokenJobs(ItemKind kind) {
    if (closed) return;
    (kind == ItemKind.APP ? appTokenJobs : packageTokenJobs).increment();
  }

  @Override
  public void incrementThrottlePauses() {
    if (closed) return;
    throttlePauses.increment();
  }

  @Override
  public void incrementAnnouncements(boolean compact) {
    if (closed) return;
    (compact ? compactAnnouncements : detailedAnnouncements).increment();
  }

  @Override
  public void recordWorkload(int tasks, int jobs, int processing, int locks) {
    if (closed) return;
    this.tasks.set(tasks);
    this.jobs.set(jobs);
    this.processing.set(processing);
    this.locks.set(locks);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    List<Meter> meters = new ArrayList<>(List.of(polls, pollFailures, appTokenJobs,
        packageTokenJobs, throttlePauses, detailedAnnouncements, compactAnnouncements));
    meters.addAll(gauges);
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
