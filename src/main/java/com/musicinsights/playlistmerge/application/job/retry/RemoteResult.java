package com.musicinsights.playlistmerge.application.job.retry;

import java.util.Objects;

/**
 * 원격 호출 한 번의 결과. 성공 값 또는 분류된 실패 중 하나만 가진다.
 *
 * @param value   성공 값(실패면 null, 응답 본문이 없는 성공도 null일 수 있음)
 * @param failure 실패 정보(성공이면 null)
 * @param <T>     성공 값 타입
 */
public record RemoteResult<T>(T value, RemoteFailure failure) {

    public static <T> RemoteResult<T> ok(T value) {
        return new RemoteResult<>(value, null);
    }

    public static <T> RemoteResult<T> failed(RemoteFailure failure) {
        return new RemoteResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isOk() {
        return failure == null;
    }
}
