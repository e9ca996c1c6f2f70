package com.certextract.infrastructure.resilience;

import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void delays_grow_exponentially() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void delays_are_capped_at_max() {
        BackoffPolicy policy = new BackoffPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(5), 3.0);

        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.nextDelay(9)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void attempt_is_one_based() {
        assertThatThrownBy(() -> BackoffPolicy.defaults().nextDelay(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejects_invalid_policy() {
        assertThatThrownBy(() -> new BackoffPolicy(0, Duration.ZERO, Duration.ZERO, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(3, Duration.ZERO, Duration.ZERO, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void interval_function_follows_the_same_schedule() {
        BackoffPolicy policy = new BackoffPolicy(6, Duration.ofMillis(100), Duration.ofMillis(500), 2.0);
        IntervalFunction intervals = policy.toIntervalFunction();

        assertThat(intervals.apply(1)).isEqualTo(100L);
        assertThat(intervals.apply(2)).isEqualTo(200L);
        assertThat(intervals.apply(3)).isEqualTo(400L);
        assertThat(intervals.apply(4)).isEqualTo(500L);
    }

    @Test
    void zero_delays_produce_an_immediate_schedule() {
        IntervalFunction intervals = new BackoffPolicy(3, Duration.ZERO, Duration.ZERO, 2.0).toIntervalFunction();

        assertThat(intervals.apply(1)).isZero();
        assertThat(intervals.apply(2)).isZero();
    }
}
