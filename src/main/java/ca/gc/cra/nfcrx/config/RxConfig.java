package ca.gc.cra.nfcrx.config;

import ca.gc.cra.nfcrx.domain.config.ConfigTree;
import ca.gc.cra.nfcrx.validation.Numbers;
import ca.gc.cra.nfcrx.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed runtime configuration for the receiver, loaded from the optional YAML file.
 * <p><strong>Role:</strong> Feeds the composition root: loop cadence, executor sizing, receiver driver,
 * device catalog and metrics exporter. CLI flags are applied separately on top.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param tickInterval control-loop interval
 * @param executorCoreSize workers started eagerly
 * @param executorMaxSize maximum concurrent workers
 * @param joinWarnInterval interval between warnings while joining workers on shutdown
 * @param receiverDriver capture task implementation
 * @param receiverName identity announced by the simulated receiver
 * @param frameInterval cadence of synthetic exchanges from the simulated decoder
 * @param catalog device catalog
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint, or {@code null} for the exporter default
 * @since 0.1.0
 */
public record RxConfig(
    Duration tickInterval,
    int executorCoreSize,
    int executorMaxSize,
    Duration joinWarnInterval,
    ReceiverDriver receiverDriver,
    String receiverName,
    Duration frameInterval,
    DeviceCatalog catalog,
    String metricsExporter,
    String otelEndpoint) {

  private static final int MAX_WORKERS = 64;
  private static final int MAX_NAME_LENGTH = 128;

  public RxConfig {
    Objects.requireNonNull(tickInterval, "tickInterval");
    Objects.requireNonNull(joinWarnInterval, "joinWarnInterval");
    Objects.requireNonNull(receiverDriver, "receiverDriver");
    Objects.requireNonNull(receiverName, "receiverName");
    Objects.requireNonNull(frameInterval, "frameInterval");
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    if (executorMaxSize < executorCoreSize) {
      throw new IllegalArgumentException("executor.maxSize must be >= executor.coreSize");
    }
  }

  /**
   * Returns defaults: 500 ms ticks, 1..4 workers, simulated AirSpy receiver, metrics disabled.
   *
   * @return default configuration
   */
  public static RxConfig defaults() {
    return new RxConfig(
        Duration.ofMillis(500),
        1,
        4,
        Duration.ofSeconds(5),
        ReceiverDriver.SIMULATED,
        "airspy:SIM-0001",
        Duration.ofSeconds(1),
        DeviceCatalog.defaults(),
        "none",
        null);
  }

  /**
   * Builds configuration from a flattened key/value map, falling back to {@link #defaults()}.
   *
   * @param kv flattened keys such as {@code executor.maxSize}; {@code null} yields defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static RxConfig fromMap(Map<String, String> kv) {
    return from(new ConfigDocument(kv == null ? Map.of() : kv, ConfigTree.empty()));
  }

  /**
   * Builds configuration from a loaded document: flattened settings plus typed catalog overrides.
   *
   * @param document settings and catalog overrides
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range, or a catalog override
   *     arrives as a flattened {@code catalog.*} setting
   */
  public static RxConfig from(ConfigDocument document) {
    RxConfig defaults = defaults();
    Map<String, String> kv = document.settings();
    for (String key : kv.keySet()) {
      if (key.startsWith(YamlConfigLoader.CATALOG_KEY + ".")) {
        throw new IllegalArgumentException(key + ": catalog overrides must be nested under 'catalog'");
      }
    }
    if (kv.isEmpty() && document.catalog().isEmpty()) {
      return defaults;
    }
    long tick = millis(kv, "tickMillis", defaults.tickInterval(), 10, 60_000);
    int core = (int) number(kv, "executor.coreSize", defaults.executorCoreSize(), 1, MAX_WORKERS);
    int max = (int) number(kv, "executor.maxSize", Math.max(core, defaults.executorMaxSize()), core, MAX_WORKERS);
    long join = millis(kv, "executor.joinTimeoutMillis", defaults.joinWarnInterval(), 100, 600_000);
    ReceiverDriver driver = ReceiverDriver.fromString(kv.get("receiver.driver"), defaults.receiverDriver());
    String name = defaults.receiverName();
    String rawName = kv.get("receiver.name");
    if (rawName != null && !rawName.isBlank()) {
      name = Strings.requirePrintableAscii("receiver.name", rawName, MAX_NAME_LENGTH);
    }
    long frames = millis(kv, "decoder.frameIntervalMillis", defaults.frameInterval(), 10, 60_000);
    String exporter = parseExporter(kv.get("metricsExporter"), defaults.metricsExporter());
    String endpoint = kv.get("otelEndpoint");
    if (endpoint != null && endpoint.isBlank()) {
      endpoint = null;
    }
    return new RxConfig(
        Duration.ofMillis(tick),
        core,
        max,
        Duration.ofMillis(join),
        driver,
        name,
        Duration.ofMillis(frames),
        defaults.catalog().withOverrides(document.catalog()),
        exporter,
        endpoint);
  }

  private static long millis(Map<String, String> kv, String key, Duration fallback, long min, long max) {
    return number(kv, key, fallback.toMillis(), min, max);
  }

  private static long number(Map<String, String> kv, String key, long fallback, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireRange(key, fallback, min, max);
    }
    return Numbers.parseInRange(key, raw, min, max);
  }

  private static String parseExporter(String raw, String fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }
}
