package com.musicinsights.playlistmerge.application.job.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link RetryPolicy} 단위 테스트.
 *
 * <p>실패 분류별 대기 시간, 백오프 단계 진행, 시도 횟수 소진을 검증한다.</p>
 */
@DisplayName("재시도 정책 테스트")
class RetryPolicyTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final RetryPolicy policy = new RetryPolicy(5, sleeper);

    @Test
    @DisplayName("첫 시도에 성공하면 대기 없이 값을 반환")
    void success_firstAttempt() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(policy.withRetry("op", () -> {
                    calls.incrementAndGet();
                    return Mono.just(RemoteResult.ok("v"));
                }))
                .expectNext("v")
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("일시적 오류가 계속되면 2,3,5,9초 대기 후 RetryExhaustedException")
    void transient_exponentialBackoff_thenExhausted() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(policy.withRetry("op", () -> {
                    calls.incrementAndGet();
                    return Mono.just(RemoteResult.<String>failed(RemoteFailure.transientError("HTTP 503", 503)));
                }))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(RetryExhaustedException.class);
                    assertThat(((RetryExhaustedException) e).failure().status()).isEqualTo(503);
                    assertThat(((RetryExhaustedException) e).code()).isEqualTo("RETRY_EXHAUSTED");
                })
                .verify();

        assertThat(calls.get()).isEqualTo(5);
        assertThat(sleeper.sleeps()).containsExactly(
                Duration.ofSeconds(2), Duration.ofSeconds(3), Duration.ofSeconds(5), Duration.ofSeconds(9));
    }

    @Test
    @DisplayName("Retry-After=3이면 4초 대기 후 재시도하고 백오프 단계는 그대로")
    void rateLimited_waitsRetryAfterPlusOne_withoutAdvancingStep() {
        Deque<RemoteResult<String>> script = new ArrayDeque<>(List.of(
                RemoteResult.failed(RemoteFailure.rateLimited(Duration.ofSeconds(3), "HTTP 429")),
                RemoteResult.failed(RemoteFailure.transientError("HTTP 502", 502)),
                RemoteResult.ok("done")
        ));

        StepVerifier.create(policy.withRetry("op", () -> Mono.just(script.pop())))
                .expectNext("done")
                .verifyComplete();

        // rate limit은 단계를 소비하지 않으므로 이어지는 일시적 오류는 첫 단계(2초)
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(4), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Retry-After가 없으면 기본 5초 + 1초 대기")
    void rateLimited_withoutRetryAfter_usesDefault() {
        Deque<RemoteResult<String>> script = new ArrayDeque<>(List.of(
                RemoteResult.failed(RemoteFailure.rateLimited(null, "HTTP 429")),
                RemoteResult.ok("done")
        ));

        StepVerifier.create(policy.withRetry("op", () -> Mono.just(script.pop())))
                .expectNext("done")
                .verifyComplete();

        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(6));
    }

    @Test
    @DisplayName("rate limit 시도도 최대 시도 횟수에 포함")
    void rateLimited_countsTowardMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy three = new RetryPolicy(3, sleeper);

        StepVerifier.create(three.withRetry("op", () -> {
                    calls.incrementAndGet();
                    return Mono.just(RemoteResult.<String>failed(
                            RemoteFailure.rateLimited(Duration.ofSeconds(1), "HTTP 429")));
                }))
                .expectError(RetryExhaustedException.class)
                .verify();

        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("재시도 불가 오류는 즉시 실패하고 대기하지 않음")
    void terminal_failsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(policy.withRetry("op", () -> {
                    calls.incrementAndGet();
                    return Mono.just(RemoteResult.<String>failed(RemoteFailure.terminal("HTTP 404", 404)));
                }))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(NonRetryableRemoteException.class);
                    assertThat(((NonRetryableRemoteException) e).failure().kind()).isEqualTo(FailureKind.TERMINAL);
                })
                .verify();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("데이터 오류도 재시도하지 않음")
    void data_failsImmediately() {
        StepVerifier.create(policy.withRetry("op",
                        () -> Mono.just(RemoteResult.<String>failed(RemoteFailure.data("bad body")))))
                .expectError(NonRetryableRemoteException.class)
                .verify();

        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("호출이 예외를 던지면 일시적 오류로 보고 재시도")
    void thrownException_isTransient() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(policy.withRetry("op", () -> {
                    if (calls.incrementAndGet() == 1) {
                        return Mono.error(new IllegalStateException("connection reset"));
                    }
                    return Mono.just(RemoteResult.ok(42));
                }))
                .expectNext(42)
                .verifyComplete();

        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("마지막 시도 뒤에는 대기하지 않음")
    void noSleepAfterFinalAttempt() {
        RetryPolicy one = new RetryPolicy(1, sleeper);

        StepVerifier.create(one.withRetry("op",
                        () -> Mono.just(RemoteResult.<String>failed(RemoteFailure.transientError("HTTP 500", 500)))))
                .expectError(RetryExhaustedException.class)
                .verify();

        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("지수 백오프는 2^step + 1초")
    void exponentialBackoff_values() {
        assertThat(RetryPolicy.exponentialBackoff(0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(RetryPolicy.exponentialBackoff(1)).isEqualTo(Duration.ofSeconds(3));
        assertThat(RetryPolicy.exponentialBackoff(4)).isEqualTo(Duration.ofSeconds(17));
    }
}
