package ca.gc.cra.nfcrx.api;

import ca.gc.cra.nfcrx.application.pipeline.CaptureControlLoop;
import ca.gc.cra.nfcrx.application.pipeline.ShutdownReason;
import ca.gc.cra.nfcrx.config.CompositionRoot;
import ca.gc.cra.nfcrx.config.ConfigDocument;
import ca.gc.cra.nfcrx.config.RxConfig;
import ca.gc.cra.nfcrx.config.YamlConfigLoader;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import ca.gc.cra.nfcrx.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.nfcrx.infrastructure.sink.ConsoleFrameSink;
import ca.gc.cra.nfcrx.logging.LoggingConfigurator;
import ca.gc.cra.nfcrx.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless NFC receiver: brings the radio and decoder tasks up, prints decoded frames and stops on
 * time limit, signal or fatal receiver condition.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String CONFIG_SECTION = "rx";
  private static final Duration METRICS_CLOSE_GRACE = Duration.ofSeconds(5);
  private static final String HELP_TEXT = """
      NFC receiver

      Usage:
        nfc-rx [-v] [-d] [-p nfca,nfcb,nfcf,nfcv] [-t nsecs] [-c config.yaml]

      Options:
        -v          Raise log verbosity (repeat: -v INFO, -vv DEBUG, -vvv TRACE)
        -d          Enable decoder debug output
        -p LIST     Comma-separated protocols to decode (default: all)
        -t SECONDS  Stop after SECONDS; 0 disables the limit (default)
        -c PATH     YAML configuration file (sections: common, rx)
        -h          Show this message
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the receiver and returns its exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    RxOptions options;
    try {
      options = RxOptions.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", Logs.truncate(ex.getMessage(), 256));
      CliPrinter.println(RxOptions.USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (options.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    LoggingConfigurator.applyVerbosity(options.verbosity());

    RxConfig config;
    try {
      config = loadConfig(options.configPath());
    } catch (IOException ex) {
      log.error("Unable to read configuration {}: {}", options.configPath(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", Logs.truncate(ex.getMessage(), 512));
      return ExitCode.CONFIG_ERROR;
    }

    log.info("NFC receiver starting: protocols={}, debug={}, timeLimit={}, receiver={}",
        options.protocols().stream().map(TechType::protocolKey).collect(Collectors.joining(",")),
        options.debugEnabled(),
        options.timeLimit() == null ? "none" : options.timeLimit().toSeconds() + "s",
        config.receiverDriver());

    AtomicReference<ExitCode> outcome = new AtomicReference<>(ExitCode.RUNTIME_FAILURE);
    CountDownLatch completed = new CountDownLatch(1);
    Thread hook = null;
    try (OpenTelemetryMetricsAdapter metrics =
        new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint())) {
      CompositionRoot root = new CompositionRoot(
          config, options.timeLimit(), options.protocols(), options.debugEnabled(), metrics);
      CaptureControlLoop loop = root.controlLoop(new ConsoleFrameSink(CliPrinter.writer()));
      hook = signalHook(loop, completed, outcome,
          config.joinWarnInterval().plus(config.tickInterval()).plus(METRICS_CLOSE_GRACE));
      Runtime.getRuntime().addShutdownHook(hook);
      ShutdownReason reason = loop.run();
      log.info("NFC receiver finished: {}", reason);
      outcome.set(reason != null && reason.fatal() ? ExitCode.RUNTIME_FAILURE : ExitCode.SUCCESS);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure", ex);
      outcome.set(ExitCode.RUNTIME_FAILURE);
    } finally {
      completed.countDown();
      removeHook(hook);
    }
    return outcome.get();
  }

  private static RxConfig loadConfig(Path path) throws IOException {
    if (path == null) {
      return RxConfig.defaults();
    }
    Optional<ConfigDocument> document = YamlConfigLoader.load(path, CONFIG_SECTION);
    if (document.isEmpty()) {
      throw new IOException("file not found");
    }
    log.debug("Loaded {} setting(s) and {} catalog device type(s) from {}",
        document.get().settings().size(), document.get().catalog().size(), path);
    return RxConfig.from(document.get());
  }

  /**
   * Builds the hook run on SIGTERM or SIGINT. It stops the loop, waits until {@link #run} has
   * released its resources and halts with the resulting exit code.
   */
  private static Thread signalHook(CaptureControlLoop loop, CountDownLatch completed,
                                   AtomicReference<ExitCode> outcome, Duration wait) {
    return new Thread(() -> {
      log.warn("Termination signal received; stopping receiver");
      loop.requestShutdown(ShutdownReason.SIGNAL);
      try {
        if (!completed.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Receiver did not stop within {} ms", wait.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      Runtime.getRuntime().halt(outcome.get().code());
    }, "rx-shutdown");
  }

  private static void removeHook(Thread hook) {
    if (hook == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook left in place");
    }
  }
}
