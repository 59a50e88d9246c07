package com.linlay.carassist.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BackendRetryPolicyTest {

    @Test
    void defaultPolicyShouldEscalateThenGiveUp() {
        BackendRetryPolicy policy = new BackendRetryPolicy(BackendRetryPolicy.DEFAULT_MAX_ATTEMPTS);

        assertThat(policy.stepFor(1)).isEqualTo(BackendRetryPolicy.Step.SEND);
        assertThat(policy.stepFor(2)).isEqualTo(BackendRetryPolicy.Step.RESEND);
        assertThat(policy.stepFor(3)).isEqualTo(BackendRetryPolicy.Step.RECREATE_SESSION_AND_SEND);
        assertThat(policy.stepFor(4)).isEqualTo(BackendRetryPolicy.Step.RECREATE_SESSION_AND_SEND);
        assertThat(policy.stepFor(5)).isEqualTo(BackendRetryPolicy.Step.GIVE_UP);
    }

    @Test
    void nonPositiveBudgetShouldFallBackToDefault() {
        assertThat(new BackendRetryPolicy(0).maxAttempts()).isEqualTo(4);
    }

    @Test
    void smallerBudgetShouldGiveUpEarlier() {
        BackendRetryPolicy policy = new BackendRetryPolicy(2);

        assertThat(policy.stepFor(2)).isEqualTo(BackendRetryPolicy.Step.RESEND);
        assertThat(policy.stepFor(3)).isEqualTo(BackendRetryPolicy.Step.GIVE_UP);
    }
}
