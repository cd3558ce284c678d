package ca.gc.cra.docrelay.application.consume;

/**
 * Lifecycle of a {@link PollingConsumer}.
 *
 * <ul>
 *   <li>{@code CREATED} - subscribed, no poll issued yet</li>
 *   <li>{@code RUNNING} - the poll loop is active on some thread</li>
 *   <li>{@code STOPPED} - broker connection released; terminal</li>
 * </ul>
 *
 * @since 0.1.0
 */
public enum ConsumerState {
  CREATED,
  RUNNING,
  STOPPED
}
