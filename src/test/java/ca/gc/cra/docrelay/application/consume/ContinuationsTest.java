package ca.gc.cra.docrelay.application.consume;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docrelay.domain.doc.Document;
import ca.gc.cra.docrelay.domain.doc.DocumentName;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;

class ContinuationsTest {

  @Test
  void foreverNeverEnds() {
    assertTrue(Continuations.forever().getAsBoolean());
  }

  @Test
  void untilCountTracksTheCollection() {
    List<String> received = new ArrayList<>();
    BooleanSupplier predicate = Continuations.untilCount(received, 2);

    assertTrue(predicate.getAsBoolean());
    received.add("a");
    assertTrue(predicate.getAsBoolean());
    received.add("b");
    assertFalse(predicate.getAsBoolean());
  }

  @Test
  void untilCountRejectsNonPositiveTargets() {
    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
        () -> Continuations.untilCount(new ArrayList<>(), 0));

    assertEquals("expected was 0, but must be greater than 0", thrown.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Continuations.untilCount(List.of(), -3));
  }

  @Test
  void untilFirstStopWatchesForStopDocuments() {
    List<Document> received = new ArrayList<>();
    BooleanSupplier predicate = Continuations.untilFirstStop(received);

    received.add(Document.of(DocumentName.START, Map.of()));
    received.add(new Document("Stop", Map.of()));
    assertTrue(predicate.getAsBoolean());

    received.add(Document.of(DocumentName.STOP, Map.of()));
    assertFalse(predicate.getAsBoolean());
  }

  @Test
  void untilFirstStopReadsEachDocumentOnce() {
    AtomicInteger reads = new AtomicInteger();
    List<Document> received = new ArrayList<>() {
      @Override
      public Document get(int index) {
        reads.incrementAndGet();
        return super.get(index);
      }
    };
    BooleanSupplier predicate = Continuations.untilFirstStop(received);

    for (int i = 0; i < 500; i++) {
      received.add(Document.of(DocumentName.EVENT, Map.of("seq_num", (long) i)));
      assertTrue(predicate.getAsBoolean());
    }
    received.add(Document.of(DocumentName.STOP, Map.of()));
    received.add(Document.of(DocumentName.START, Map.of()));

    assertFalse(predicate.getAsBoolean());
    assertFalse(predicate.getAsBoolean());
    assertEquals(501, reads.get());
  }
}
