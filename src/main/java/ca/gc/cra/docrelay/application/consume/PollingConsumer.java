package ca.gc.cra.docrelay.application.consume;

import ca.gc.cra.docrelay.application.port.Codec;
import ca.gc.cra.docrelay.application.port.DecodeException;
import ca.gc.cra.docrelay.application.port.MessageSource;
import ca.gc.cra.docrelay.application.port.MetricsPort;
import ca.gc.cra.docrelay.domain.msg.BrokerMessage;
import ca.gc.cra.docrelay.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Blocking poll loop that decodes broker messages and dispatches them to a handler.
 * <p><strong>Why:</strong> Turns an indefinite, at-least-once broker stream into a sequence of decoded values
 * delivered to user logic, with explicit termination and failure semantics.</p>
 * <p><strong>Role:</strong> Application service on the consume side; {@link DocumentConsumer} specializes it for
 * {@code (name, document)} payloads.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Poll the {@link MessageSource} with a bounded timeout, one result at a time.</li>
 *   <li>Skip empty polls, log and skip broker errors, decode and dispatch records.</li>
 *   <li>Evaluate the continuation predicate after every dispatched message only.</li>
 *   <li>Release the broker connection on every exit path and rethrow unrecovered faults.</li>
 * </ul>
 * <p><strong>Lifecycle:</strong> {@link ConsumerState#CREATED} to {@link ConsumerState#RUNNING} to
 * {@link ConsumerState#STOPPED}; instances are single-use.</p>
 * <p><strong>Thread-safety:</strong> One loop per instance. {@link #requestStop()} and {@link #state()} may be
 * called from any thread; {@link #stop()} closes the source and belongs on the polling thread (or a thread
 * that knows no loop is running).</p>
 * <p><strong>Observability:</strong> Emits {@code consumer.poll.empty}, {@code consumer.broker.errors},
 * {@code consumer.decode.failures}, {@code consumer.messages.dispatched} and
 * {@code consumer.dispatch.latencyNanos}.</p>
 *
 * @param <T> decoded message type
 * @since 0.1.0
 */
public class PollingConsumer<T> {
  /** Poll timeout used when none is configured. */
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);

  private static final Logger log = LoggerFactory.getLogger(PollingConsumer.class);

  private final MessageSource source;
  private final List<String> topics;
  private final Codec<T> codec;
  private final MessageHandler<T> handler;
  private final Duration pollTimeout;
  private final MetricsPort metrics;
  private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.CREATED);
  private volatile boolean stopRequested;

  /**
   * Creates a consumer with the default poll timeout and no metrics.
   *
   * @param source broker source; ownership passes to this consumer
   * @param topics topics to subscribe to; must not be empty
   * @param codec payload decoder
   * @param handler receives each decoded message
   */
  public PollingConsumer(
      MessageSource source, List<String> topics, Codec<T> codec, MessageHandler<T> handler) {
    this(source, topics, codec, handler, DEFAULT_POLL_TIMEOUT, MetricsPort.NO_OP);
  }

  /**
   * Creates a consumer and subscribes its source to {@code topics}.
   *
   * @param source broker source; ownership passes to this consumer
   * @param topics topics to subscribe to; must not be empty
   * @param codec payload decoder
   * @param handler receives each decoded message
   * @param pollTimeout upper bound on each blocking poll; must be positive
   * @param metrics metrics sink; {@code null} disables metrics
   * @throws IllegalArgumentException if {@code topics} is empty or contains an invalid name, or the timeout is not positive;
   *     {@code source} is closed before any constructor failure propagates
   */
  public PollingConsumer(
      MessageSource source,
      List<String> topics,
      Codec<T> codec,
      MessageHandler<T> handler,
      Duration pollTimeout,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    try {
      this.topics = sanitizeTopics(topics);
      this.codec = Objects.requireNonNull(codec, "codec");
      this.handler = Objects.requireNonNull(handler, "handler");
      this.pollTimeout = requirePositive(pollTimeout);
      this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
      log.info("Subscribing to topic(s) {} via {}", this.topics, source);
      this.source.subscribe(this.topics);
    } catch (RuntimeException ex) {
      closeQuietly(source, ex);
      throw ex;
    }
  }

  /**
   * Runs the poll loop until the source is stopped; equivalent to {@code start(() -> true)}.
   *
   * @throws AlreadyStoppedException if this consumer has already been stopped
   */
  public void start() {
    start(() -> true);
  }

  /**
   * Runs the poll loop on the calling thread until {@code continuePolling} returns {@code false} after a
   * dispatched message, {@link #stop()} or {@link #requestStop()} is called, or a fault escapes.
   *
   * <p>The predicate is not consulted after empty polls or broker errors, so it bounds the number of
   * handled messages rather than wall-clock time. The broker connection is closed before this method
   * returns or throws.</p>
   *
   * @param continuePolling evaluated after each dispatched message; the loop ends when it returns {@code false}
   * @throws AlreadyStoppedException if this consumer has already been stopped; no poll is issued
   * @throws IllegalStateException if the loop is already running
   * @throws DecodeException if a payload cannot be decoded
   * @throws RuntimeException any fault thrown by the handler or by the broker client, rethrown unchanged
   */
  public void start(BooleanSupplier continuePolling) {
    Objects.requireNonNull(continuePolling, "continuePolling");
    enterRunning();
    log.info("Polling topic(s) {} with timeout {}", topics, pollTimeout);
    try (RunScope ignored = new RunScope()) {
      pollLoop(continuePolling);
    } catch (RuntimeException ex) {
      log.warn("Consumer for topic(s) {} stopped by {}", topics, ex.toString());
      throw ex;
    }
    log.info("Consumer for topic(s) {} finished polling", topics);
  }

  /**
   * Closes the broker connection and moves to {@link ConsumerState#STOPPED}. Repeated calls are no-ops.
   */
  public void stop() {
    ConsumerState previous = state.getAndSet(ConsumerState.STOPPED);
    if (previous == ConsumerState.STOPPED) {
      log.debug("Consumer for topic(s) {} already stopped", topics);
      return;
    }
    log.info("Closing consumer for topic(s) {}", topics);
    source.close();
  }

  /**
   * Asks a running loop to exit at the top of its next iteration; the wait is bounded by the poll timeout.
   * Safe to call from any thread, including shutdown hooks.
   */
  public void requestStop() {
    stopRequested = true;
  }

  /**
   * Returns the current lifecycle state.
   *
   * @return lifecycle state
   */
  public ConsumerState state() {
    return state.get();
  }

  /**
   * Returns the subscribed topics.
   *
   * @return immutable topic list
   */
  public List<String> topics() {
    return topics;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "(topics=" + topics
        + ", state=" + state.get()
        + ", pollTimeout=" + pollTimeout
        + ", source=" + source + ")";
  }

  private void pollLoop(BooleanSupplier continuePolling) {
    while (state.get() == ConsumerState.RUNNING && !stopRequested) {
      Optional<BrokerMessage> polled = source.poll(pollTimeout);
      if (polled.isEmpty()) {
        metrics.increment("consumer.poll.empty");
        continue;
      }
      BrokerMessage message = polled.get();
      if (message.hasError()) {
        metrics.increment("consumer.broker.errors");
        log.error("Broker error while polling topic(s) {}: {}", topics, message.error().orElseThrow());
        continue;
      }
      dispatch(message);
      if (!continuePolling.getAsBoolean()) {
        log.debug("Continuation predicate ended polling for topic(s) {}", topics);
        return;
      }
    }
    if (stopRequested) {
      log.info("Stop requested for consumer on topic(s) {}", topics);
    }
  }

  private void dispatch(BrokerMessage message) {
    T decoded;
    try {
      decoded = codec.decode(message.value());
    } catch (DecodeException ex) {
      metrics.increment("consumer.decode.failures");
      log.error("Undecodable payload at {}-{}@{}", message.topic(), message.partition(), message.offset());
      throw ex;
    }
    long started = System.nanoTime();
    handler.handle(this, message.topic(), decoded);
    metrics.observe("consumer.dispatch.latencyNanos", System.nanoTime() - started);
    metrics.increment("consumer.messages.dispatched");
  }

  private void enterRunning() {
    if (state.compareAndSet(ConsumerState.CREATED, ConsumerState.RUNNING)) {
      return;
    }
    if (state.get() == ConsumerState.STOPPED) {
      throw new AlreadyStoppedException(
          "This consumer has already been started and stopped; create a fresh instance of " + this);
    }
    throw new IllegalStateException("Poll loop is already running for " + this);
  }

  private static void closeQuietly(MessageSource source, RuntimeException cause) {
    try {
      source.close();
    } catch (RuntimeException closeFailure) {
      cause.addSuppressed(closeFailure);
    }
  }

  private static List<String> sanitizeTopics(List<String> topics) {
    Objects.requireNonNull(topics, "topics");
    if (topics.isEmpty()) {
      throw new IllegalArgumentException("topics must not be empty");
    }
    List<String> sanitized = new ArrayList<>(topics.size());
    for (String topic : topics) {
      sanitized.add(Strings.sanitizeTopic(topic));
    }
    return List.copyOf(sanitized);
  }

  private static Duration requirePositive(Duration timeout) {
    Objects.requireNonNull(timeout, "pollTimeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be positive");
    }
    return timeout;
  }

  /** Ties the broker connection to the loop's lexical scope. */
  private final class RunScope implements AutoCloseable {
    @Override
    public void close() {
      stop();
    }
  }
}
