package org.javai.storage.retry;

import org.javai.storage.Failure;
import org.javai.storage.FailureId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private static final Instant START = Instant.parse("2024-01-20T10:30:00Z");

    @Test
    void fixed_retriesTransientUntilMaxAttempts() {
        RetryPolicy policy = RetryPolicy.fixed("fixed", 3, Duration.ofMillis(250));

        assertThat(policy.decide(attempt(1), transientFailure())).isEqualTo(RetryDecision.Retry.after(Duration.ofMillis(250)));
        assertThat(policy.decide(attempt(2), transientFailure())).isInstanceOf(RetryDecision.Retry.class);
        assertThat(policy.decide(attempt(3), transientFailure()))
                .isEqualTo(RetryDecision.GiveUp.because("max attempts reached"));
    }

    @Test
    void everyPolicy_givesUpOnPermanentFailure() {
        Failure permanent = Failure.permanentFailure(FailureId.of("storage", "notFound"), "gone", "objects.get", null);

        for (RetryPolicy policy : new RetryPolicy[]{
                RetryPolicy.fixed("fixed", 3, Duration.ZERO),
                RetryPolicy.exponentialBackoff("exp", 3, Duration.ofMillis(100), Duration.ofSeconds(1)),
                RetryPolicy.untilDeadline("deadline", Duration.ofMillis(100), Duration.ofSeconds(1), 2.0)}) {
            assertThat(policy.decide(attempt(1), permanent))
                    .as(policy.id())
                    .isEqualTo(RetryDecision.GiveUp.because("failure is not retryable"));
        }
    }

    @Test
    void exponentialBackoff_doublesAndCaps() {
        RetryPolicy policy = RetryPolicy.exponentialBackoff("exp", 10, Duration.ofMillis(100), Duration.ofMillis(300));

        assertThat(delayAt(policy, 1)).isEqualTo(Duration.ofMillis(100));
        assertThat(delayAt(policy, 2)).isEqualTo(Duration.ofMillis(200));
        assertThat(delayAt(policy, 3)).isEqualTo(Duration.ofMillis(300));
        assertThat(delayAt(policy, 4)).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    void untilDeadline_appliesMultiplierAndCap() {
        RetryPolicy policy = RetryPolicy.untilDeadline("deadline", Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0);

        assertThat(delayAt(policy, 1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(delayAt(policy, 2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(delayAt(policy, 6)).isEqualTo(Duration.ofSeconds(32));
        assertThat(delayAt(policy, 7)).isEqualTo(Duration.ofSeconds(60));
        assertThat(delayAt(policy, 200)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void untilDeadline_givesUpOnceBudgetSpent() {
        RetryPolicy policy = RetryPolicy.untilDeadline("deadline", Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0);
        RetryContext spent = new RetryContext(4, START, Duration.ofSeconds(120), Duration.ofSeconds(120));

        assertThat(policy.decide(spent, transientFailure()))
                .isEqualTo(RetryDecision.GiveUp.because("budget exhausted"));
    }

    @Test
    void untilDeadline_givesUpWhenWaitWouldOverrunBudget() {
        RetryPolicy policy = RetryPolicy.untilDeadline("deadline", Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0);
        RetryContext roomy = new RetryContext(2, START, Duration.ofSeconds(100), Duration.ofSeconds(120));
        RetryContext nearEnd = new RetryContext(2, START, Duration.ofSeconds(118), Duration.ofSeconds(120));

        assertThat(policy.decide(roomy, transientFailure())).isEqualTo(RetryDecision.Retry.after(Duration.ofSeconds(2)));
        assertThat(policy.decide(nearEnd, transientFailure()))
                .isEqualTo(RetryDecision.GiveUp.because("budget exhausted"));
    }

    @Test
    void retryAfterHint_winsWhenLonger() {
        RetryPolicy policy = RetryPolicy.exponentialBackoff("exp", 5, Duration.ofMillis(100), Duration.ofSeconds(1));
        Failure hinted = Failure.transientFailure(FailureId.of("storage", "rateLimitExceeded"), "slow down",
                "objects.insert", null, Duration.ofSeconds(5));

        RetryDecision decision = policy.decide(attempt(1), hinted);

        assertThat(decision).isEqualTo(RetryDecision.Retry.after(Duration.ofSeconds(5)));
    }

    @Test
    void noRetry_alwaysGivesUp() {
        assertThat(RetryPolicy.noRetry().decide(attempt(1), transientFailure()))
                .isInstanceOf(RetryDecision.GiveUp.class);
    }

    @Test
    void invalidParameters_areRejected() {
        assertThatThrownBy(() -> RetryPolicy.fixed("fixed", 0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.untilDeadline("deadline", Duration.ZERO, Duration.ZERO, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryDecision.Retry.after(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void context_tracksElapsedAndRemainingBudget() {
        RetryContext first = RetryContext.first(START, Duration.ofSeconds(10));
        RetryContext second = first.next(START.plusSeconds(4));

        assertThat(second.attemptNumber()).isEqualTo(2);
        assertThat(second.elapsed()).isEqualTo(Duration.ofSeconds(4));
        assertThat(second.remainingBudget()).isEqualTo(Duration.ofSeconds(6));
        assertThat(second.next(START.plusSeconds(12)).remainingBudget()).isEqualTo(Duration.ZERO);
        assertThat(RetryContext.first(START).remainingBudget()).isNull();
    }

    @Test
    void context_retimedAtFailureKeepsAttemptNumber() {
        RetryContext failed = RetryContext.first(START, Duration.ofSeconds(10)).at(START.plusSeconds(7));

        assertThat(failed.attemptNumber()).isEqualTo(1);
        assertThat(failed.elapsed()).isEqualTo(Duration.ofSeconds(7));
        assertThat(failed.allowsWaiting(Duration.ofSeconds(2))).isTrue();
        assertThat(failed.allowsWaiting(Duration.ofSeconds(3))).isFalse();
        assertThat(RetryContext.first(START).at(START.plusSeconds(7)).allowsWaiting(Duration.ofDays(1))).isTrue();
    }

    private static Duration delayAt(RetryPolicy policy, int attemptNumber) {
        RetryDecision decision = policy.decide(attempt(attemptNumber), transientFailure());
        assertThat(decision).isInstanceOf(RetryDecision.Retry.class);
        return ((RetryDecision.Retry) decision).delay();
    }

    private static RetryContext attempt(int attemptNumber) {
        return new RetryContext(attemptNumber, START, Duration.ZERO, null);
    }

    private static Failure transientFailure() {
        return Failure.transientFailure(FailureId.of("storage", "backendError"), "backend error",
                "objects.get", null);
    }
}
