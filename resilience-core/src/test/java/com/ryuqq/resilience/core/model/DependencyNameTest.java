package com.ryuqq.resilience.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DependencyName Value Object 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class DependencyNameTest {

    @Test
    void of_ValidValue_CreatesDependencyName() {
        // Given
        String value = "payment-api";

        // When
        DependencyName name = DependencyName.of(value);

        // Then
        assertNotNull(name);
        assertEquals(value, name.getValue());
    }

    @Test
    void of_ValueWithDotsAndUnderscores_CreatesDependencyName() {
        // Given
        String value = "db.primary_replica-1";

        // When
        DependencyName name = DependencyName.of(value);

        // Then
        assertEquals(value, name.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DependencyName.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DependencyName.of("   ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_ValueExceeds128Characters_ThrowsException() {
        // Given
        String value = "a".repeat(129);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DependencyName.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 128"));
    }

    @Test
    void of_ValueWithInvalidCharacters_ThrowsException() {
        // Given: 공백과 슬래시 포함
        String value = "openai /chat";

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DependencyName.of(value)
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        DependencyName first = DependencyName.of("redis");
        DependencyName second = DependencyName.of("redis");

        // When & Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void equals_DifferentValue_ReturnsFalse() {
        // Given
        DependencyName first = DependencyName.of("redis");
        DependencyName second = DependencyName.of("postgres");

        // When & Then
        assertNotEquals(first, second);
        assertNotEquals(null, first);
    }

    @Test
    void toString_ReturnsRawValue() {
        // Given
        DependencyName name = DependencyName.of("openai");

        // When & Then
        assertEquals("openai", name.toString());
    }
}
