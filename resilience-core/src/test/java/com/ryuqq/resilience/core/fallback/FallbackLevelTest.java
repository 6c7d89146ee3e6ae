package com.ryuqq.resilience.core.fallback;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FallbackLevel / FallbackResult 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class FallbackLevelTest {

    @Test
    void values_DeclaredInAttemptOrder() {
        // When
        FallbackLevel[] levels = FallbackLevel.values();

        // Then
        assertArrayEquals(new FallbackLevel[] {
            FallbackLevel.PRIMARY,
            FallbackLevel.REPLICA,
            FallbackLevel.DISTRIBUTED_CACHE,
            FallbackLevel.LOCAL_CACHE,
            FallbackLevel.DEFAULT
        }, levels);
    }

    @Test
    void of_NonPrimaryLevel_IsDegraded() {
        // When
        FallbackResult<String> primary = FallbackResult.of("fresh", FallbackLevel.PRIMARY);
        FallbackResult<String> cached = FallbackResult.of("stale", FallbackLevel.LOCAL_CACHE);

        // Then
        assertFalse(primary.degraded());
        assertTrue(cached.degraded());
        assertEquals(FallbackLevel.LOCAL_CACHE, cached.levelUsed());
    }

    @Test
    void constructor_NullLevel_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new FallbackResult<>("x", null, false));
    }
}
