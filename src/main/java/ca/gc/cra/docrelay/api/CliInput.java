package ca.gc.cra.docrelay.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Raw CLI arguments split into {@code --flags} and {@code key=value} tokens.
 *
 * @param keyValueArgs tokens that are neither flags nor blank, in order
 * @param flags normalized lower-case flags
 */
record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Help and verbose aliases normalize to {@code --help} and {@code --verbose}.
   *
   * @param args raw CLI arguments; {@code null} is treated as empty
   * @return parsed arguments
   */
  static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args == null) {
      return new CliInput(kv, flags);
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=") && !arg.equals("-")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags);
  }

  boolean help() {
    return flags.contains("--help");
  }

  boolean verbose() {
    return flags.contains("--verbose");
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }
}
