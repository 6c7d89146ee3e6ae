/**
 * Test utilities shared by the adapter modules.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.testkit.MutableClock}: deterministic time</li>
 *   <li>{@link com.ryuqq.resilience.testkit.ScriptedCall}: fail-N-times-then-succeed unit of work</li>
 *   <li>{@code contract}: abstract SPI contract tests</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit;
