package com.musicinsights.playlistmerge.application.job.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 원격 호출을 감싸 실패 분류({@link FailureKind})에 따라 재시도/중단을 결정하는 정책입니다.
 * <p>
 * <ul>
 *     <li>RATE_LIMITED: {@code retryAfter + 1}초 대기 후 재시도, 지수 백오프 단계는 증가하지 않음</li>
 *     <li>TRANSIENT: {@code 2^step + 1}초 대기 후 재시도, 단계 증가</li>
 *     <li>TERMINAL / DATA: 즉시 {@link NonRetryableRemoteException}</li>
 *     <li>시도 횟수 소진: {@link RetryExhaustedException}</li>
 * </ul>
 * 모든 시도(rate limit 포함)는 {@code maxAttempts}에 포함된다.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** 기본 최대 시도 횟수 */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    /** Retry-After 값이 없을 때의 기본 대기 시간 */
    public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(5);

    private final int maxAttempts;
    private final BackoffSleeper sleeper;

    public RetryPolicy(int maxAttempts, BackoffSleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
    }

    /**
     * 설정된 최대 시도 횟수로 원격 호출을 실행한다.
     *
     * @param operation 로그/에러 메시지에 쓰일 호출 이름
     * @param call      호출마다 새 요청을 만드는 supplier
     * @param <T>       성공 값 타입
     * @return 성공 값(응답 본문이 없는 성공이면 empty)
     */
    public <T> Mono<T> withRetry(String operation, Supplier<Mono<RemoteResult<T>>> call) {
        return withRetry(operation, maxAttempts, call);
    }

    /**
     * 지정한 최대 시도 횟수로 원격 호출을 실행한다.
     *
     * @param operation   호출 이름
     * @param maxAttempts 최대 시도 횟수(1 이상)
     * @param call        호출마다 새 요청을 만드는 supplier
     * @param <T>         성공 값 타입
     * @return 성공 값
     */
    public <T> Mono<T> withRetry(String operation, int maxAttempts, Supplier<Mono<RemoteResult<T>>> call) {
        if (maxAttempts < 1) {
            return Mono.error(new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts));
        }
        return attempt(operation, call, maxAttempts, 0, 0);
    }

    private <T> Mono<T> attempt(
            String operation,
            Supplier<Mono<RemoteResult<T>>> call,
            int maxAttempts,
            int attempt,
            int backoffStep
    ) {
        return Mono.defer(call)
                .onErrorResume(e -> Mono.just(RemoteResult.<T>failed(RemoteFailure.transientError(e))))
                .defaultIfEmpty(RemoteResult.<T>failed(RemoteFailure.data("no result from " + operation)))
                .flatMap(result -> {
                    if (result.isOk()) {
                        return Mono.justOrEmpty(result.value());
                    }

                    RemoteFailure failure = result.failure();
                    if (failure.kind() == FailureKind.TERMINAL || failure.kind() == FailureKind.DATA) {
                        log.error("{} failed without retry: {}", operation, failure.message());
                        return Mono.error(new NonRetryableRemoteException(operation, failure));
                    }

                    int next = attempt + 1;
                    if (next >= maxAttempts) {
                        log.error("{} gave up after {} attempts: {}", operation, maxAttempts, failure.message());
                        return Mono.error(new RetryExhaustedException(operation, maxAttempts, failure));
                    }

                    Duration wait;
                    int nextStep;
                    switch (failure.kind()) {
                        case RATE_LIMITED -> {
                            Duration retryAfter = failure.retryAfter() == null ? DEFAULT_RETRY_AFTER : failure.retryAfter();
                            wait = retryAfter.plusSeconds(1);
                            nextStep = backoffStep;
                            log.warn("Rate limited during {}. Waiting {}s (attempt {}/{})",
                                    operation, wait.toSeconds(), next, maxAttempts);
                        }
                        default -> {
                            wait = exponentialBackoff(backoffStep);
                            nextStep = backoffStep + 1;
                            log.warn("{} failed ({}). Retrying in {}s (attempt {}/{})",
                                    operation, failure.message(), wait.toSeconds(), next, maxAttempts);
                        }
                    }

                    return sleeper.sleep(wait)
                            .then(Mono.defer(() -> attempt(operation, call, maxAttempts, next, nextStep)));
                });
    }

    /**
     * 지수 백오프 대기 시간({@code 2^step + 1}초).
     *
     * @param step 0부터 시작하는 백오프 단계
     * @return 대기 시간
     */
    static Duration exponentialBackoff(int step) {
        return Duration.ofSeconds((1L << step) + 1);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
