package ca.gc.cra.docrelay.application.consume;

import ca.gc.cra.docrelay.application.port.MessageSource;
import ca.gc.cra.docrelay.domain.msg.BrokerError;
import ca.gc.cra.docrelay.domain.msg.BrokerMessage;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Test double that replays a fixed sequence of poll results.
 *
 * <p>Once the script is exhausted the source either idles (empty polls) or fails the test, so a loop that
 * polls past its expected end is caught instead of spinning.</p>
 */
final class ScriptedMessageSource implements MessageSource {
  private final Deque<Optional<BrokerMessage>> script = new ArrayDeque<>();
  private final boolean idleWhenExhausted;
  private final List<List<String>> subscriptions = new ArrayList<>();
  private volatile int polls;
  private volatile int closes;
  private long nextOffset;

  ScriptedMessageSource() {
    this(false);
  }

  ScriptedMessageSource(boolean idleWhenExhausted) {
    this.idleWhenExhausted = idleWhenExhausted;
  }

  ScriptedMessageSource record(String topic, String value) {
    return record(topic, value.getBytes(StandardCharsets.UTF_8));
  }

  ScriptedMessageSource record(String topic, byte[] value) {
    script.add(Optional.of(BrokerMessage.record(topic, 0, nextOffset++, null, value)));
    return this;
  }

  ScriptedMessageSource empty() {
    script.add(Optional.empty());
    return this;
  }

  ScriptedMessageSource error(String topic) {
    script.add(Optional.of(BrokerMessage.failed(topic, new BrokerError("TimeoutException", "broker busy", true))));
    return this;
  }

  @Override
  public void subscribe(List<String> topics) {
    subscriptions.add(List.copyOf(topics));
  }

  @Override
  public Optional<BrokerMessage> poll(Duration timeout) {
    if (closes > 0) {
      throw new IllegalStateException("poll after close");
    }
    polls++;
    Optional<BrokerMessage> next = script.poll();
    if (next != null) {
      return next;
    }
    if (!idleWhenExhausted) {
      throw new AssertionError("poll #" + polls + " past the end of the script");
    }
    try {
      Thread.sleep(1);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    return Optional.empty();
  }

  @Override
  public void close() {
    closes++;
  }

  int polls() {
    return polls;
  }

  int closes() {
    return closes;
  }

  List<List<String>> subscriptions() {
    return subscriptions;
  }

  @Override
  public String toString() {
    return "ScriptedMessageSource";
  }
}
