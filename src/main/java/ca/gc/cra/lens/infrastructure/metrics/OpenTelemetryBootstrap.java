package ca.gc.cra.lens.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.logging.LoggingMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires an {@link SdkMeterProvider} for one analyze run.
 *
 * <p>An analyze run is short, so the periodic reader is configured with a long interval and measurements are
 * pushed by the flush in {@link BootstrapResult#close()}. A bad exporter name never fails the run; it falls back
 * to a noop meter with an ERROR log.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.lens";
  static final AttributeKey<String> PIPELINE = AttributeKey.stringKey("lens.pipeline");
  private static final Duration EXPORT_INTERVAL = Duration.ofMinutes(5);
  private static final long CLOSE_TIMEOUT_SECONDS = 5;
  private static final String FALLBACK_VERSION = "0.0.0-dev";

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize(String exporter) {
    ExporterMode mode;
    try {
      mode = ExporterMode.from(exporter);
    } catch (IllegalArgumentException ex) {
      log.error("Metrics disabled: {}", ex.getMessage());
      return BootstrapResult.noop();
    }
    MetricReader reader = mode.newReader();
    if (reader == null) {
      log.debug("Metrics exporter is none; measurements are dropped");
      return BootstrapResult.noop();
    }
    BootstrapResult result = build(reader);
    log.info("Metrics will be exported via {} when the run ends", mode.name().toLowerCase(Locale.ROOT));
    return result;
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "lens")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(PIPELINE, "analyze")
        .build()));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build(), provider);
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? FALLBACK_VERSION : version;
  }

  /** Exporters selectable through {@code metricsExporter}. */
  enum ExporterMode {
    NONE {
      @Override
      MetricReader newReader() {
        return null;
      }
    },
    LOGGING {
      @Override
      MetricReader newReader() {
        return PeriodicMetricReader.builder(LoggingMetricExporter.create())
            .setInterval(EXPORT_INTERVAL)
            .build();
      }
    };

    /** Returns the reader to register, or {@code null} when nothing is exported. */
    abstract MetricReader newReader();

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      String normalized = raw.trim().toUpperCase(Locale.ROOT);
      for (ExporterMode mode : values()) {
        if (mode.name().equals(normalized)) {
          return mode;
        }
      }
      throw new IllegalArgumentException("unknown metrics exporter '" + raw.trim() + "'");
    }
  }

  /** Meter plus the provider that owns it; the provider is {@code null} for noop results. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    /** Flushes pending measurements, then shuts the provider down. */
    @Override
    public void close() {
      if (provider != null) {
        forceFlush();
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("Metrics {} did not complete within {} s", action, CLOSE_TIMEOUT_SECONDS);
      }
    }
  }
}
