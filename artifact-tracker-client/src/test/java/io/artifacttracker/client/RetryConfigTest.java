package io.artifacttracker.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryConfigTest {

    @Test
    void defaultsAreThreeRetriesOneSecondApart() {
        assertThat(RetryConfig.defaults()).isEqualTo(new RetryConfig(3, 1000));
        assertThat(RetryConfig.defaults().maxAttempts()).isEqualTo(4);
    }

    @Test
    void zeroRetriesMeansOneAttempt() {
        assertThat(RetryConfig.disabled().maxAttempts()).isEqualTo(1);
    }

    @Test
    void attemptCountDoesNotOverflowAtIntegerLimit() {
        assertThat(new RetryConfig(Integer.MAX_VALUE, 0).maxAttempts()).isEqualTo(Integer.MAX_VALUE + 1L);
    }

    @Test
    void negativeValuesAreRejected() {
        assertThatThrownBy(() -> new RetryConfig(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryConfig(0, -5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsDuration() {
        assertThat(RetryConfig.of(2, Duration.ofSeconds(2))).isEqualTo(new RetryConfig(2, 2000));
    }
}
