/**
 * Service Provider Interfaces.
 *
 * <p>Core defines the contract; adapters provide the implementation.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.core.spi.TimeoutGuard} - Enforces a time budget on blocking work</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.core.spi;
