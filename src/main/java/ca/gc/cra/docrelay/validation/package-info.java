/**
 * Validation helpers for topic names, broker endpoints and numeric CLI values.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface as {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docrelay.validation;
