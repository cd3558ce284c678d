/**
 * Immutable domain values: documents and broker messages, reports and metadata.
 */
package ca.gc.cra.docrelay.domain;
