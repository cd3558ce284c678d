/**
 * Kafka client configuration: merging explicit settings with overrides and YAML files.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Secret values ({@code sasl.*}, {@code *password}) are masked whenever a
 * configuration is rendered.</p>
 */
package ca.gc.cra.docrelay.config;
