/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by adapter modules:</p>
 * <ul>
 *   <li>{@link com.ryuqq.messenger.core.spi.MessengerStore} - transactional store (messenger-adapter-mvstore)</li>
 *   <li>{@link com.ryuqq.messenger.core.spi.FrameCodec} - frame encoding (messenger-adapter-msgpack)</li>
 *   <li>{@link com.ryuqq.messenger.core.spi.Connection} - client transport (provided by the embedding listener)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Messenger Team
 */
package com.ryuqq.messenger.core.spi;
