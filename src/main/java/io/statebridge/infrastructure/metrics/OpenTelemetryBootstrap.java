package io.statebridge.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the bridge's OpenTelemetry meter provider from system properties or environment variables.
 *
 * <p>Lookup order for each setting: system property ({@code otel.metrics.exporter},
 * {@code otel.exporter.otlp.endpoint}, {@code otel.resource.attributes}), then the matching
 * {@code OTEL_*} environment variable, then the default.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.statebridge";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      ExporterMode exporter = ExporterMode.from(
          setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp"));
      if (exporter == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      Attributes extras = parseResourceAttributes(
          setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      BootstrapResult result = build(reader, extras);
      log.info("OpenTelemetry metrics exporting over OTLP to {}", endpoint);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extras) {
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version, extras))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static Resource buildResource(String version, Attributes additional) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "statebridge")
        .put(SERVICE_VERSION, version);
    String instanceId = detectInstanceId();
    if (!instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    Resource extra = additional.isEmpty() ? Resource.empty() : Resource.create(additional);
    return Resource.getDefault().merge(Resource.create(builder.build())).merge(extra);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      String key = idx > 0 ? trimmed.substring(0, idx).trim() : "";
      String value = idx > 0 ? trimmed.substring(idx + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String detectInstanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Unable to resolve local host name for service.instance.id", ex);
      return "";
    }
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? "0.0.0-dev" : impl;
  }

  private static String setting(String property, String envVar, String defaultValue) {
    String fromProperty = System.getProperty(property);
    if (fromProperty != null && !fromProperty.isBlank()) {
      return fromProperty.trim();
    }
    String fromEnv = System.getenv(envVar);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return fromEnv.trim();
    }
    return defaultValue;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to otlp", raw);
          yield OTLP;
        }
      };
    }
  }

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

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, Objects.requireNonNull(provider, "provider"));
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
