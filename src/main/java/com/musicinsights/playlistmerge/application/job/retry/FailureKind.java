package com.musicinsights.playlistmerge.application.job.retry;

/**
 * 원격 호출 실패의 분류.
 *
 * <p>{@link RetryPolicy}는 이 값으로 재시도 여부와 대기 시간을 결정한다.</p>
 */
public enum FailureKind {

    /** 업스트림이 Retry-After와 함께 명시적으로 호출 속도를 제한한 경우 */
    RATE_LIMITED,

    /** 5xx, 네트워크 장애, 타임아웃 등 일시적인 오류 */
    TRANSIENT,

    /** 재시도해도 결과가 바뀌지 않는 거절(권한, 잘못된 요청 등) */
    TERMINAL,

    /** 응답 본문을 해석할 수 없는 경우 */
    DATA
}
