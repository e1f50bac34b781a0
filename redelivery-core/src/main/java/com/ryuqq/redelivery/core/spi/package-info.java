/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to connect the redelivery core to a concrete message broker.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.spi.MessageSender} - Scheduled enqueue</li>
 *   <li>{@link com.ryuqq.redelivery.core.spi.MessageReceiver} - Complete, abandon, defer, dead-letter</li>
 *   <li>{@link com.ryuqq.redelivery.core.spi.TransactionalTransport} - Optional atomic complete + send</li>
 *   <li>{@link com.ryuqq.redelivery.core.spi.MessageSource} - Pull-based receive used by workers</li>
 *   <li>{@link com.ryuqq.redelivery.core.spi.TimeProvider} - Wall clock and monotonic timestamps</li>
 *   <li>{@link com.ryuqq.redelivery.core.spi.TelemetrySink} - Event reporting</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., redelivery-adapter-inmemory) are responsible for providing
 * concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on broker client libraries</li>
 *   <li><strong>Asynchronous:</strong> Broker calls return {@link java.util.concurrent.CompletionStage}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.spi;
