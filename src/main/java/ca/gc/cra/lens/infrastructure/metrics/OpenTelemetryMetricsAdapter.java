package ca.gc.cra.lens.infrastructure.metrics;

import ca.gc.cra.lens.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Why:</strong> Keeps the analyze pipeline vendor-neutral while still exporting run statistics.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps; safe for worker threads.</p>
 * <p><strong>Observability:</strong> Every instrument carries the original key under {@code lens.metric.key}.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("lens.metric.key");
  private static final String FALLBACK_METRIC_NAME = "lens.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the named exporter.
   *
   * @param exporter {@code none} or {@code logging}
   * @return metrics adapter; records nothing when the exporter is {@code none}
   */
  public static OpenTelemetryMetricsAdapter create(String exporter) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    CounterInstrument instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    HistogramInstrument instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /** Returns {@code true} when no exporter is attached. */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("LENS counter for " + key)
        .build();
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("LENS observation for " + key)
        .build();
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key.trim();
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = trimmed.toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
