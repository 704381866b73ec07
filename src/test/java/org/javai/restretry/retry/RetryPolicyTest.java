package org.javai.restretry.retry;

import org.javai.restretry.Failure;
import org.javai.restretry.FailureId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private static final Failure TRANSIENT =
            Failure.transientFailure(FailureId.of("network", "timeout"), "timed out", "Op", null);
    private static final Failure FATAL =
            Failure.fatal(FailureId.of("fatal", "IllegalStateException"), "broken", "Op", null);

    @AfterEach
    void clearProperties() {
        System.clearProperty(RetryPolicy.MAX_ATTEMPTS_PROPERTY);
        System.clearProperty(RetryPolicy.RETRY_DELAY_PROPERTY);
    }

    @Test
    void defaults_areThreeAttemptsFiveSecondsApart() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.retryDelay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void decide_transientBeforeLastAttempt_retriesAfterDelay() {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofSeconds(1));

        assertThat(policy.decide(0, TRANSIENT)).isEqualTo(RetryDecision.Retry.after(Duration.ofSeconds(1)));
        assertThat(policy.decide(1, TRANSIENT)).isEqualTo(RetryDecision.Retry.after(Duration.ofSeconds(1)));
    }

    @Test
    void decide_transientOnLastAttempt_suppresses() {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofSeconds(1));

        assertThat(policy.decide(2, TRANSIENT)).isInstanceOf(RetryDecision.Suppress.class);
    }

    @Test
    void decide_fatal_rethrowsOnEveryAttempt() {
        RetryPolicy policy = RetryPolicy.of(5, Duration.ofSeconds(1));

        for (int attempt = 0; attempt < 5; attempt++) {
            assertThat(policy.decide(attempt, FATAL)).isInstanceOf(RetryDecision.Rethrow.class);
        }
    }

    @Test
    void decide_singleAttempt_suppressesImmediately() {
        assertThat(RetryPolicy.immediate(1).decide(0, TRANSIENT)).isInstanceOf(RetryDecision.Suppress.class);
    }

    @Test
    void constructor_acceptsZeroAttempts() {
        assertThat(RetryPolicy.immediate(0).maxAttempts()).isZero();
    }

    @Test
    void constructor_rejectsNegativeOrNullDelay() {
        assertThatThrownBy(() -> RetryPolicy.of(3, Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryDelay");
        assertThatThrownBy(() -> RetryPolicy.of(3, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void retryDecision_rejectsNegativeDelay() {
        assertThatThrownBy(() -> RetryDecision.Retry.after(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromConfiguration_readsSystemProperties() {
        System.setProperty(RetryPolicy.MAX_ATTEMPTS_PROPERTY, "5");
        System.setProperty(RetryPolicy.RETRY_DELAY_PROPERTY, "PT0.25S");

        RetryPolicy policy = RetryPolicy.fromConfiguration();

        assertThat(policy.maxAttempts()).isEqualTo(5);
        assertThat(policy.retryDelay()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void fromConfiguration_blankValuesFallBackToDefaults() {
        System.setProperty(RetryPolicy.MAX_ATTEMPTS_PROPERTY, "  ");

        RetryPolicy policy = RetryPolicy.fromConfiguration();

        // assumes RESTRETRY_* variables are not set in the test environment
        assertThat(policy).isEqualTo(RetryPolicy.defaults());
    }

    @Test
    void fromConfiguration_malformedAttempts_namesTheSetting() {
        System.setProperty(RetryPolicy.MAX_ATTEMPTS_PROPERTY, "three");

        assertThatThrownBy(RetryPolicy::fromConfiguration)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("restretry.maxAttempts");
    }

    @Test
    void fromConfiguration_malformedDelay_namesTheSetting() {
        System.setProperty(RetryPolicy.RETRY_DELAY_PROPERTY, "5 seconds");

        assertThatThrownBy(RetryPolicy::fromConfiguration)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("restretry.retryDelay");
    }

    @Test
    void fromConfiguration_negativeDelay_isRejected() {
        System.setProperty(RetryPolicy.RETRY_DELAY_PROPERTY, "-PT1S");

        assertThatThrownBy(RetryPolicy::fromConfiguration)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("negative");
    }
}
