package ca.gc.cra.docrelay.api;

import ca.gc.cra.docrelay.adapter.kafka.KafkaMessageSink;
import ca.gc.cra.docrelay.application.port.DecodeException;
import ca.gc.cra.docrelay.application.port.MessageSink;
import ca.gc.cra.docrelay.application.publish.DeliveryReporters;
import ca.gc.cra.docrelay.application.publish.DeliveryTally;
import ca.gc.cra.docrelay.application.publish.DocumentPublisher;
import ca.gc.cra.docrelay.config.KafkaClientConfig;
import ca.gc.cra.docrelay.domain.doc.Document;
import ca.gc.cra.docrelay.infrastructure.codec.DocumentCodec;
import ca.gc.cra.docrelay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.docrelay.logging.LoggingConfigurator;
import ca.gc.cra.docrelay.validation.Strings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes documents read as JSON lines ({@code ["name", {...}]}) to a Kafka topic.
 *
 * @since 0.1.0
 */
public final class PublishCli {
  private static final Logger log = LoggerFactory.getLogger(PublishCli.class);
  private static final String SUMMARY_USAGE =
      "usage: publish topic=TOPIC [bootstrap=HOST:PORT[,HOST:PORT]] [key=KEY] [in=PATH|-] "
          + "[format=msgpack|json] [config=YAML] [kafka.PROPERTY=VALUE] [--flush-on-stop]";
  private static final String HELP_TEXT = """
      docrelay publish

      Usage:
        publish topic=TOPIC [options]

      Options:
        topic=TOPIC               Destination topic ([A-Za-z0-9._-])
        bootstrap=HOST:PORT,...   Bootstrap servers; combined with bootstrap.servers from config
        key=KEY                   Record key applied to every document (default none)
        in=PATH|-                 JSON lines input, one ["name", {...}] pair per line (default stdin)
        format=msgpack|json       Wire format of published records (default msgpack)
        config=YAML               YAML file with common/producer client sections
        kafka.PROPERTY=VALUE      Any Kafka producer property, e.g. kafka.acks=all
        --flush-on-stop           Flush after every stop document
        metricsExporter=otlp|none OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL          OTLP endpoint (default http://localhost:4317)
        otelResourceAttributes=K=V,...
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit status is 5 when any record failed delivery.
      """;

  private PublishCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, KafkaMessageSink::new, System.in);
  }

  static ExitCode run(String[] args, Function<KafkaClientConfig, MessageSink> sinks, InputStream stdin) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printUsage(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for publish CLI");
    }

    String topic;
    String bootstrap;
    String key;
    String in;
    DocumentCodec codec;
    Map<String, Object> overrides;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArray());
      topic = Strings.sanitizeTopic(CliArgsParser.require(kv, "topic"));
      bootstrap = CliArgsParser.optional(kv, "bootstrap", null);
      key = CliArgsParser.optional(kv, "key", null);
      in = CliArgsParser.optional(kv, "in", "-");
      codec = DocumentCodec.forFormat(CliArgsParser.optional(kv, "format", "msgpack"));
      TelemetryConfigurator.configureMetrics(kv);
      overrides = ConfigCliUtils.clientOverrides(kv, KafkaClientConfig.Role.PRODUCER);
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
      config = KafkaClientConfig.producer(bootstrap, overrides);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid producer configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    DeliveryTally tally = new DeliveryTally();
    long published = 0;
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        BufferedReader reader = openInput(in, stdin);
        DocumentPublisher publisher = new DocumentPublisher(sinks.apply(config), topic, key, codec,
            DeliveryReporters.logging().andThen(tally), input.hasFlag("--flush-on-stop"), metrics)) {
      log.info("Publishing {} documents from {} via {}", codec, "-".equals(in) ? "stdin" : in, publisher);
      published = publishLines(reader, publisher);
      publisher.flush();
    } catch (DecodeException ex) {
      log.error("Malformed input: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read documents from {}", in, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Publishing to topic {} failed", topic, ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    CliPrinter.printTotals(published, tally);
    if (tally.failed() > 0) {
      log.error("{} of {} documents failed delivery; last failure: {}",
          tally.failed(), published, tally.lastFailure().map(Exception::toString).orElse("unknown"));
      return ExitCode.RUNTIME_FAILURE;
    }
    return ExitCode.SUCCESS;
  }

  private static long publishLines(BufferedReader reader, DocumentPublisher publisher) throws IOException {
    DocumentCodec lines = DocumentCodec.json();
    long count = 0;
    int lineNumber = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      Document document;
      try {
        document = lines.decode(line.getBytes(StandardCharsets.UTF_8));
      } catch (DecodeException ex) {
        throw new DecodeException("line " + lineNumber + ": " + ex.getMessage(), ex);
      }
      publisher.publish(document);
      count++;
    }
    return count;
  }

  private static BufferedReader openInput(String in, InputStream stdin) throws IOException {
    if ("-".equals(in)) {
      return new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    }
    return Files.newBufferedReader(Path.of(in), StandardCharsets.UTF_8);
  }
}
