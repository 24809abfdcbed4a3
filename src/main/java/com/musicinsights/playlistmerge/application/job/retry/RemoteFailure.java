package com.musicinsights.playlistmerge.application.job.retry;

import java.time.Duration;

/**
 * 분류가 끝난 원격 호출 실패 정보.
 *
 * @param kind       실패 분류
 * @param message    사람이 읽을 수 있는 실패 메시지
 * @param retryAfter {@link FailureKind#RATE_LIMITED}일 때 업스트림이 요구한 대기 시간(그 외 null)
 * @param status     HTTP 상태 코드(없으면 null)
 */
public record RemoteFailure(
        FailureKind kind,
        String message,
        Duration retryAfter,
        Integer status
) {

    public static RemoteFailure rateLimited(Duration retryAfter, String message) {
        return new RemoteFailure(FailureKind.RATE_LIMITED, message, retryAfter, 429);
    }

    public static RemoteFailure transientError(String message, Integer status) {
        return new RemoteFailure(FailureKind.TRANSIENT, message, null, status);
    }

    /**
     * 분류되지 않은 예외를 일시적 오류로 감싼다.
     *
     * @param e 원인 예외
     * @return TRANSIENT 실패
     */
    public static RemoteFailure transientError(Throwable e) {
        return transientError(describe(e), null);
    }

    public static RemoteFailure terminal(String message, Integer status) {
        return new RemoteFailure(FailureKind.TERMINAL, message, null, status);
    }

    public static RemoteFailure data(String message) {
        return new RemoteFailure(FailureKind.DATA, message, null, null);
    }

    /**
     * 예외 메시지, 메시지가 없으면 예외 클래스 이름.
     *
     * @param e 예외
     * @return 로그/체크포인트에 남길 설명
     */
    public static String describe(Throwable e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }
}
