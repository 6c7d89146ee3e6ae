/**
 * Abstract SPI contract tests.
 *
 * <p>Adapter modules extend these classes from their test sources so every implementation
 * of a protection SPI is held to the same behavioral rules.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.contract;
