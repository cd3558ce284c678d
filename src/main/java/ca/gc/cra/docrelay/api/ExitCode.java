package ca.gc.cra.docrelay.api;

/**
 * <strong>What:</strong> Process exit codes shared by the docrelay subcommands.
 * <p><strong>Why:</strong> Scripts driving {@code publish} and {@code consume} need to tell bad arguments from
 * broker or delivery failures without parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Input could not be read or held a malformed document line. */
  IO_ERROR(3),
  /** Client configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** A delivery failed, a payload could not be decoded, or the broker client faulted. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
