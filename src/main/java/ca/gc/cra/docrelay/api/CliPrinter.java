package ca.gc.cra.docrelay.api;

import ca.gc.cra.docrelay.application.publish.DeliveryTally;
import ca.gc.cra.docrelay.infrastructure.codec.JacksonCodec;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes usage text, consumed documents and publish totals to stdout.
 *
 * <p>Writes through the stdout file descriptor rather than {@code System.out} so console logging
 * configuration cannot interleave partial lines with document output.</p>
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final JacksonCodec JSON = JacksonCodec.json();
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /** Prints help or summary usage without the trailing blank line of the text block. */
  static void printUsage(String usage) {
    target().println(usage.stripTrailing());
  }

  /**
   * Prints one consumed document as a compact JSON line {@code ["name", payload]}, the same shape
   * {@code publish} reads.
   */
  static void printDocument(String name, Object payload) {
    byte[] line = JSON.encode(List.of(name, payload));
    target().println(new String(line, StandardCharsets.UTF_8));
  }

  static void printTotals(long published, DeliveryTally tally) {
    target().println("published=" + published + " delivered=" + tally.delivered() + " failed=" + tally.failed());
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter target() {
    PrintWriter testWriter = override;
    return testWriter == null ? STDOUT : testWriter;
  }
}
