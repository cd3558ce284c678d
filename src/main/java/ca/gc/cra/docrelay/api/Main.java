package ca.gc.cra.docrelay.api;

import ca.gc.cra.docrelay.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * docrelay CLI dispatcher that routes to the {@code publish} and {@code consume} subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: docrelay <publish|consume> [options]";
  private static final String HELP_TEXT = """
      docrelay: relays experiment documents through Kafka

      Usage:
        docrelay <command> [options]

      Commands:
        publish     Publish JSON-line documents to a topic (publish --help for details)
        consume     Print documents consumed from topics (consume --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the subcommand
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < tokens.length; i++) {
      if (tokens[i] != null && !tokens[i].isBlank() && !tokens[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.printUsage(HELP_TEXT);
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.printUsage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (CliInput.parse(Arrays.copyOfRange(tokens, 0, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, commandIndex + 1, tokens.length);
    return switch (command) {
      case "publish" -> PublishCli.run(delegateArgs);
      case "consume" -> ConsumeCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.printUsage(HELP_TEXT);
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.printUsage(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
