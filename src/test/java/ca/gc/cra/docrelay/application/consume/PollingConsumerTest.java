package ca.gc.cra.docrelay.application.consume;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docrelay.application.port.DecodeException;
import ca.gc.cra.docrelay.application.port.MessageSource;
import ca.gc.cra.docrelay.domain.msg.BrokerMessage;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PollingConsumerTest {
  private static final String TOPIC = "runs";

  private final List<String> handled = new ArrayList<>();
  private final Utf8Codec codec = new Utf8Codec();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(PollingConsumer.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void dispatchesExactlyTheRequestedNumberOfMessagesThenStops() {
    ScriptedMessageSource source = new ScriptedMessageSource()
        .empty()
        .record(TOPIC, "a")
        .error(TOPIC)
        .empty()
        .record(TOPIC, "b")
        .record(TOPIC, "c")
        .record(TOPIC, "never");
    PollingConsumer<String> consumer = collecting(source);

    consumer.start(Continuations.untilCount(handled, 3));

    assertEquals(List.of("a", "b", "c"), handled);
    assertEquals(6, source.polls());
    assertEquals(1, source.closes());
    assertEquals(ConsumerState.STOPPED, consumer.state());
    assertEquals(3, metrics.count("consumer.messages.dispatched"));
    assertEquals(2, metrics.count("consumer.poll.empty"));
    assertEquals(3, metrics.observed("consumer.dispatch.latencyNanos").size());
  }

  @Test
  void brokerErrorsAreLoggedAndNeverDecoded() {
    ScriptedMessageSource source = new ScriptedMessageSource()
        .error(TOPIC)
        .error(TOPIC)
        .record(TOPIC, "a");
    PollingConsumer<String> consumer = collecting(source);

    consumer.start(() -> false);

    assertEquals(List.of("a"), handled);
    assertEquals(1, codec.decodes());
    assertEquals(2, metrics.count("consumer.broker.errors"));
    long errors = appender.list.stream()
        .filter(event -> event.getLevel() == Level.ERROR)
        .filter(event -> event.getFormattedMessage().contains("broker busy"))
        .count();
    assertEquals(2, errors);
  }

  @Test
  void predicateIsOnlyEvaluatedAfterDispatchedMessages() {
    ScriptedMessageSource source = new ScriptedMessageSource()
        .empty()
        .error(TOPIC)
        .record(TOPIC, "a")
        .empty()
        .error(TOPIC)
        .record(TOPIC, "b");
    PollingConsumer<String> consumer = collecting(source);
    AtomicInteger evaluations = new AtomicInteger();

    consumer.start(() -> evaluations.incrementAndGet() < 2);

    assertEquals(2, evaluations.get());
    assertEquals(List.of("a", "b"), handled);
  }

  @Test
  void malformedPayloadStopsTheLoopAndReachesTheCaller() {
    ScriptedMessageSource source = new ScriptedMessageSource()
        .record(TOPIC, "a")
        .record(TOPIC, "!garbage")
        .record(TOPIC, "never");
    PollingConsumer<String> consumer = collecting(source);

    DecodeException thrown = assertThrows(DecodeException.class, consumer::start);

    assertTrue(thrown.getMessage().contains("!garbage"));
    assertEquals(List.of("a"), handled);
    assertEquals(1, source.closes());
    assertEquals(ConsumerState.STOPPED, consumer.state());
    assertEquals(1, metrics.count("consumer.decode.failures"));
  }

  @Test
  void handlerFaultIsRethrownUnchangedAfterClosingTheSource() {
    ScriptedMessageSource source = new ScriptedMessageSource().record(TOPIC, "a");
    IllegalStateException boom = new IllegalStateException("boom");
    PollingConsumer<String> consumer = new PollingConsumer<>(source, List.of(TOPIC), codec,
        (c, topic, message) -> {
          throw boom;
        });

    IllegalStateException thrown = assertThrows(IllegalStateException.class, consumer::start);

    assertSame(boom, thrown);
    assertEquals(1, source.closes());
  }

  @Test
  void startAfterStopThrowsWithoutPolling() {
    ScriptedMessageSource source = new ScriptedMessageSource().record(TOPIC, "a");
    PollingConsumer<String> consumer = collecting(source);
    consumer.start(() -> false);
    int pollsBefore = source.polls();

    AlreadyStoppedException thrown = assertThrows(AlreadyStoppedException.class, consumer::start);

    assertInstanceOf(IllegalStateException.class, thrown);
    assertEquals(pollsBefore, source.polls());
    assertEquals(1, source.closes());
  }

  @Test
  void startOnAStoppedConsumerThatNeverRanThrows() {
    ScriptedMessageSource source = new ScriptedMessageSource();
    PollingConsumer<String> consumer = collecting(source);
    consumer.stop();

    assertThrows(AlreadyStoppedException.class, () -> consumer.start(Continuations.forever()));
    assertEquals(0, source.polls());
  }

  @Test
  void startingARunningConsumerIsRejected() {
    ScriptedMessageSource source = new ScriptedMessageSource().record(TOPIC, "a");
    PollingConsumer<String> consumer = new PollingConsumer<>(source, List.of(TOPIC), codec,
        (c, topic, message) -> c.start());

    IllegalStateException thrown = assertThrows(IllegalStateException.class, consumer::start);

    assertFalse(thrown instanceof AlreadyStoppedException);
    assertEquals(ConsumerState.STOPPED, consumer.state());
  }

  @Test
  void handlerMayStopTheConsumer() {
    ScriptedMessageSource source = new ScriptedMessageSource()
        .record(TOPIC, "a")
        .record(TOPIC, "b");
    PollingConsumer<String> consumer = new PollingConsumer<>(source, List.of(TOPIC), codec,
        (c, topic, message) -> {
          handled.add(message);
          c.stop();
        });

    consumer.start();

    assertEquals(List.of("a"), handled);
    assertEquals(1, source.polls());
    assertEquals(1, source.closes());
  }

  @Test
  void stopIsIdempotent() {
    ScriptedMessageSource source = new ScriptedMessageSource();
    PollingConsumer<String> consumer = collecting(source);

    consumer.stop();
    consumer.stop();

    assertEquals(1, source.closes());
    assertEquals(ConsumerState.STOPPED, consumer.state());
  }

  @Test
  void requestStopFromAnotherThreadEndsAnIdleLoop() throws InterruptedException {
    ScriptedMessageSource source = new ScriptedMessageSource(true);
    PollingConsumer<String> consumer = new PollingConsumer<>(source, List.of(TOPIC), codec,
        (c, topic, message) -> handled.add(message), Duration.ofMillis(10), metrics);
    Thread loop = new Thread(consumer::start, "polling-consumer-test");
    loop.start();
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (source.polls() == 0 && System.nanoTime() < deadline) {
      Thread.sleep(1);
    }

    consumer.requestStop();
    loop.join(5_000);

    assertFalse(loop.isAlive(), "loop should exit after requestStop");
    assertEquals(ConsumerState.STOPPED, consumer.state());
    assertEquals(1, source.closes());
  }

  @Test
  void constructorSubscribesToSanitizedTopics() {
    ScriptedMessageSource source = new ScriptedMessageSource();
    PollingConsumer<String> consumer = new PollingConsumer<>(source, List.of(" runs ", "events"), codec,
        (c, topic, message) -> {});

    assertEquals(List.of(List.of("runs", "events")), source.subscriptions());
    assertEquals(List.of("runs", "events"), consumer.topics());
    assertEquals(ConsumerState.CREATED, consumer.state());
  }

  @Test
  void constructorRejectsInvalidArguments() {
    ScriptedMessageSource source = new ScriptedMessageSource();
    MessageHandler<String> handler = (c, topic, message) -> {};

    assertThrows(IllegalArgumentException.class,
        () -> new PollingConsumer<>(source, List.of(), codec, handler));
    assertThrows(IllegalArgumentException.class,
        () -> new PollingConsumer<>(source, List.of("bad topic"), codec, handler));
    assertThrows(IllegalArgumentException.class,
        () -> new PollingConsumer<>(source, List.of(TOPIC), codec, handler, Duration.ZERO, metrics));
    assertThrows(NullPointerException.class,
        () -> new PollingConsumer<>(source, List.of(TOPIC), null, handler));
  }

  @Test
  void rejectedConstructionClosesTheSource() {
    ScriptedMessageSource source = new ScriptedMessageSource();

    assertThrows(IllegalArgumentException.class,
        () -> new PollingConsumer<>(source, List.of("bad topic!"), codec, (c, topic, message) -> {}));

    assertEquals(1, source.closes());
    assertTrue(source.subscriptions().isEmpty());
  }

  @Test
  void failedSubscriptionClosesTheSourceAndRethrows() {
    AtomicInteger closes = new AtomicInteger();
    IllegalStateException refused = new IllegalStateException("subscription refused");
    MessageSource source = new MessageSource() {
      @Override
      public void subscribe(List<String> topics) {
        throw refused;
      }

      @Override
      public Optional<BrokerMessage> poll(Duration timeout) {
        throw new AssertionError("poll after failed subscription");
      }

      @Override
      public void close() {
        closes.incrementAndGet();
      }
    };

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> new PollingConsumer<>(source, List.of(TOPIC), codec, (c, topic, message) -> {}));

    assertSame(refused, thrown);
    assertEquals(1, closes.get());
  }

  @Test
  void toStringDescribesTopicsStateAndSource() {
    PollingConsumer<String> consumer = collecting(new ScriptedMessageSource());

    String rendered = consumer.toString();

    assertTrue(rendered.startsWith("PollingConsumer("));
    assertTrue(rendered.contains("topics=[runs]"));
    assertTrue(rendered.contains("state=CREATED"));
    assertTrue(rendered.contains("source=ScriptedMessageSource"));
  }

  private PollingConsumer<String> collecting(ScriptedMessageSource source) {
    return new PollingConsumer<>(source, List.of(TOPIC), codec,
        (consumer, topic, message) -> handled.add(message),
        PollingConsumer.DEFAULT_POLL_TIMEOUT, metrics);
  }
}
