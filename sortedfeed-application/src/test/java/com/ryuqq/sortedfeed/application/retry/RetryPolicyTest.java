package com.ryuqq.sortedfeed.application.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryPolicy 설정 테스트.
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
@DisplayName("RetryPolicy 테스트")
class RetryPolicyTest {

    @Test
    @DisplayName("기본 정책은 무제한 재시도")
    void defaultPolicy_IsUnbounded() {
        RetryPolicy policy = new RetryPolicy();

        assertThat(policy).isEqualTo(RetryPolicy.unbounded());
        assertThat(policy.maxAttempts()).isEqualTo(RetryPolicy.UNBOUNDED);
        assertThat(policy.baseDelayMs()).isEqualTo(1);
        assertThat(policy.maxDelayMs()).isEqualTo(100);
        assertThat(policy.jitterFactor()).isEqualTo(0.5);
        assertThat(policy.isExhausted(Integer.MAX_VALUE)).isFalse();
    }

    @Test
    @DisplayName("bounded 정책은 한도에 도달하면 소진된다")
    void bounded_ExhaustsAtMaxAttempts() {
        RetryPolicy policy = RetryPolicy.bounded(3);

        assertThat(policy.isUnbounded()).isFalse();
        assertThat(policy.isExhausted(2)).isFalse();
        assertThat(policy.isExhausted(3)).isTrue();
    }

    @Test
    @DisplayName("bounded 정책의 한도는 양수여야 한다")
    void bounded_NonPositive_Throws() {
        assertThatThrownBy(() -> RetryPolicy.bounded(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be positive");
    }

    @Test
    @DisplayName("immediate 정책은 대기 없이 무제한 재시도")
    void immediate_HasNoDelay() {
        RetryPolicy policy = RetryPolicy.immediate();

        assertThat(policy.isUnbounded()).isTrue();
        assertThat(policy.baseDelayMs()).isZero();
        assertThat(policy.maxDelayMs()).isZero();
    }

    @Test
    void withMethods_ChangeSingleField() {
        RetryPolicy policy = RetryPolicy.unbounded()
            .withMaxAttempts(5)
            .withBaseDelayMs(10)
            .withMaxDelayMs(1000)
            .withJitterFactor(0.0);

        assertThat(policy).isEqualTo(new RetryPolicy(5, 10, 1000, 0.0));
    }

    @Test
    void compactConstructor_RejectsInvalidValues() {
        assertThatThrownBy(() -> new RetryPolicy(-1, 1, 100, 0.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts");
        assertThatThrownBy(() -> new RetryPolicy(0, -1, 100, 0.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs");
        assertThatThrownBy(() -> new RetryPolicy(0, 50, 10, 0.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs");
        assertThatThrownBy(() -> new RetryPolicy(0, 1, 100, 1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
    }
}
