package com.musicinsights.playlistmerge.application.job.retry;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 재시도/배치 사이의 대기를 수행한다.
 */
@FunctionalInterface
public interface BackoffSleeper {

    /**
     * 주어진 시간만큼 기다린 뒤 완료되는 Mono를 반환한다.
     *
     * @param duration 대기 시간
     * @return 대기 완료 신호
     */
    Mono<Void> sleep(Duration duration);

    /** {@link Mono#delay(Duration)} 기반 기본 구현 */
    static BackoffSleeper delaying() {
        return duration -> Mono.delay(duration).then();
    }
}
