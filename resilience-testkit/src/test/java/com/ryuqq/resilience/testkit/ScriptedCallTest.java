package com.ryuqq.resilience.testkit;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptedCall 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ScriptedCallTest {

    @Test
    void failingTimes_FailsThenSucceeds() throws Exception {
        // Given
        ScriptedCall<String> call = ScriptedCall.failingTimes(2, () -> new IOException("reset"), "ok");

        // When & Then
        assertThatThrownBy(call::call).isInstanceOf(IOException.class);
        assertThatThrownBy(call::call).isInstanceOf(IOException.class);
        assertThat(call.call()).isEqualTo("ok");
        assertThat(call.invocations()).isEqualTo(3);
        assertThat(call.invocationThreads()).hasSize(3);
    }

    @Test
    void alwaysFailing_NeverSucceeds() {
        // Given
        ScriptedCall<String> call = ScriptedCall.alwaysFailing(() -> new IllegalStateException("down"));

        // When & Then
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(call::call).isInstanceOf(IllegalStateException.class);
        }
        assertThat(call.invocations()).isEqualTo(5);
    }
}
