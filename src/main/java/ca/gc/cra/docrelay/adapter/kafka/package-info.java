/**
 * Kafka adapters implementing the broker ports with {@code org.apache.kafka.clients}.
 *
 * <p>Both adapters accept an injected client through a package-private constructor so tests can use
 * {@code MockConsumer} and {@code MockProducer}.</p>
 */
package ca.gc.cra.docrelay.adapter.kafka;
