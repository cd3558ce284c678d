package ca.gc.cra.docrelay.api;

import ca.gc.cra.docrelay.adapter.kafka.KafkaMessageSource;
import ca.gc.cra.docrelay.application.consume.Continuations;
import ca.gc.cra.docrelay.application.consume.DocumentConsumer;
import ca.gc.cra.docrelay.application.consume.DocumentHandler;
import ca.gc.cra.docrelay.application.port.DecodeException;
import ca.gc.cra.docrelay.application.port.MessageSource;
import ca.gc.cra.docrelay.config.KafkaClientConfig;
import ca.gc.cra.docrelay.domain.doc.Document;
import ca.gc.cra.docrelay.infrastructure.codec.DocumentCodec;
import ca.gc.cra.docrelay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.docrelay.logging.LoggingConfigurator;
import ca.gc.cra.docrelay.validation.Numbers;
import ca.gc.cra.docrelay.validation.Strings;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes documents from Kafka topics and prints each as a JSON line {@code ["name", {...}]}.
 *
 * <p>SIGINT requests a cooperative stop; the loop exits within one poll timeout and the consumer is closed
 * before the JVM exits.</p>
 *
 * @since 0.1.0
 */
public final class ConsumeCli {
  private static final Logger log = LoggerFactory.getLogger(ConsumeCli.class);
  private static final int MAX_POLL_TIMEOUT_MS = 600_000;
  private static final String SUMMARY_USAGE =
      "usage: consume topics=TOPIC[,TOPIC] [bootstrap=HOST:PORT[,HOST:PORT]] [groupId=GROUP] "
          + "[offsetReset=earliest|latest] [format=msgpack|json] [until=forever|stop|COUNT] "
          + "[pollTimeoutMs=MS] [config=YAML] [kafka.PROPERTY=VALUE]";
  private static final String HELP_TEXT = """
      docrelay consume

      Usage:
        consume topics=TOPIC[,TOPIC] [options]

      Options:
        topics=TOPIC,...          Topics to subscribe to
        bootstrap=HOST:PORT,...   Bootstrap servers; combined with bootstrap.servers from config
        groupId=GROUP             Consumer group (default: a random docrelay-<uuid> group)
        offsetReset=earliest|latest
                                  Where a new group starts reading (default latest)
        format=msgpack|json       Wire format of consumed records (default msgpack)
        until=forever|stop|COUNT  Stop after the first stop document or COUNT documents (default forever)
        pollTimeoutMs=MS          Upper bound on each broker poll (default 1000)
        config=YAML               YAML file with common/consumer client sections
        kafka.PROPERTY=VALUE      Any Kafka consumer property
        metricsExporter=otlp|none OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL          OTLP endpoint (default http://localhost:4317)
        otelResourceAttributes=K=V,...
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ConsumeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, KafkaMessageSource::new);
  }

  static ExitCode run(String[] args, Function<KafkaClientConfig, MessageSource> sources) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printUsage(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for consume CLI");
    }

    List<String> topics;
    String bootstrap;
    String groupId;
    String offsetReset;
    DocumentCodec codec;
    Until until;
    Duration pollTimeout;
    Map<String, Object> overrides;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArray());
      topics = Strings.splitCsv("topics", CliArgsParser.require(kv, "topics")).stream()
          .map(topic -> Strings.sanitizeTopic("topics", topic))
          .toList();
      bootstrap = CliArgsParser.optional(kv, "bootstrap", null);
      groupId = CliArgsParser.optional(kv, "groupId", null);
      offsetReset = CliArgsParser.optional(kv, "offsetReset", null);
      codec = DocumentCodec.forFormat(CliArgsParser.optional(kv, "format", "msgpack"));
      until = Until.parse(CliArgsParser.optional(kv, "until", "forever"));
      pollTimeout = Duration.ofMillis(
          Numbers.parseInt("pollTimeoutMs", CliArgsParser.optional(kv, "pollTimeoutMs", "1000"), 1, MAX_POLL_TIMEOUT_MS));
      TelemetryConfigurator.configureMetrics(kv);
      overrides = ConfigCliUtils.clientOverrides(kv, KafkaClientConfig.Role.CONSUMER);
      ConfigCliUtils.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.printUsage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read client configuration", ex);
      return ExitCode.IO_ERROR;
    }

    KafkaClientConfig config;
    try {
      config = KafkaClientConfig.consumer(bootstrap, groupId, offsetReset, overrides);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid consumer configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    List<Document> received = new ArrayList<>();
    DocumentHandler printer = (consumer, topic, name, document) -> {
      CliPrinter.printDocument(name, document);
      if (until.collects()) {
        received.add(new Document(name, document));
      }
    };

    AtomicBoolean interrupted = new AtomicBoolean();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      DocumentConsumer consumer =
          new DocumentConsumer(sources.apply(config), topics, codec, printer, pollTimeout, metrics);
      runUntilDone(consumer, until.predicate(received), pollTimeout, interrupted);
    } catch (DecodeException ex) {
      log.error("Undecodable {} record: {}", codec, ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Consuming topic(s) {} failed", topics, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    return interrupted.get() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
  }

  private static void runUntilDone(
      DocumentConsumer consumer, BooleanSupplier predicate, Duration pollTimeout, AtomicBoolean interrupted) {
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      interrupted.set(true);
      consumer.requestStop();
      awaitFinish(finished, pollTimeout.plusSeconds(5));
    }, "docrelay-consume-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      consumer.start(predicate);
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void awaitFinish(CountDownLatch finished, Duration timeout) {
    try {
      if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Consumer did not stop within {}", timeout);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for consumer to stop");
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; leaving shutdown hook registered");
    }
  }

  /** Parsed {@code until=} option. */
  record Until(String mode, int count) {
    static Until parse(String raw) {
      String normalized = Strings.requireNonBlank("until", raw).toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "forever" -> new Until("forever", 0);
        case "stop" -> new Until("stop", 0);
        default -> new Until("count", Numbers.parseInt("until", normalized, 1, Integer.MAX_VALUE));
      };
    }

    boolean collects() {
      return !mode.equals("forever");
    }

    BooleanSupplier predicate(List<Document> received) {
      return switch (mode) {
        case "stop" -> Continuations.untilFirstStop(received);
        case "count" -> Continuations.untilCount(received, count);
        default -> Continuations.forever();
      };
    }
  }
}
