package ca.gc.cra.docrelay.api;

import ca.gc.cra.docrelay.config.KafkaClientConfig;
import ca.gc.cra.docrelay.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds Kafka client overrides from a YAML file ({@code config=PATH}) and {@code kafka.*} CLI arguments.
 *
 * <p>{@code kafka.sasl.mechanism=PLAIN} on the command line becomes the override {@code sasl.mechanism=PLAIN};
 * command-line values win over YAML.</p>
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);
  private static final String CLIENT_PREFIX = "kafka.";

  private ConfigCliUtils() {
    // Utility
  }

  /**
   * Consumes {@code config} and {@code kafka.*} arguments and returns the merged overrides.
   *
   * @param args mutable parsed arguments; consumed keys are removed
   * @param role selects the YAML section
   * @return client overrides in precedence order
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or malformed
   */
  static Map<String, Object> clientOverrides(Map<String, String> args, KafkaClientConfig.Role role)
      throws IOException {
    Map<String, Object> overrides = new LinkedHashMap<>();
    String configPath = args.remove("config");
    if (configPath != null) {
      Path path = Path.of(configPath);
      Optional<Map<String, String>> yaml = YamlConfigLoader.load(path, role);
      if (yaml.isEmpty()) {
        throw new IllegalArgumentException("config file not found: " + path);
      }
      overrides.putAll(yaml.get());
    }
    Iterator<Map.Entry<String, String>> it = args.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, String> entry = it.next();
      if (!entry.getKey().startsWith(CLIENT_PREFIX)) {
        continue;
      }
      String key = entry.getKey().substring(CLIENT_PREFIX.length());
      if (key.isEmpty()) {
        throw new IllegalArgumentException("kafka. prefix must be followed by a client property name");
      }
      if (overrides.containsKey(key)) {
        log.warn("CLI overrides YAML for client property: {}", key);
      }
      overrides.put(key, entry.getValue());
      it.remove();
    }
    return overrides;
  }

  /**
   * Fails when arguments remain that no option consumed.
   *
   * @param args remaining arguments
   * @throws IllegalArgumentException naming the first unknown argument
   */
  static void rejectUnknown(Map<String, String> args) {
    if (!args.isEmpty()) {
      throw new IllegalArgumentException("unknown argument: " + args.keySet().iterator().next());
    }
  }
}
