/**
 * Application layer: broker ports ({@code port}), the polling consumer and document redelivery
 * ({@code consume}) and publishers ({@code publish}).
 * <p><strong>Role:</strong> Depends only on the domain and the ports; Kafka types stay in
 * {@code ca.gc.cra.docrelay.adapter.kafka}.</p>
 */
package ca.gc.cra.docrelay.application;
