package com.musicinsights.playlistmerge.application.job.retry;

/**
 * 재시도 정책이 더 이상 진행할 수 없다고 판단한 원격 호출 실패.
 *
 * <p>마지막 {@link RemoteFailure}와 에러 코드를 함께 보관한다.</p>
 */
public class RemoteCallException extends RuntimeException {
    private final RemoteFailure failure;
    private final String code;

    public RemoteCallException(String message, RemoteFailure failure, String code) {
        super(message);
        this.failure = failure;
        this.code = code;
    }

    /**
     * 마지막으로 관측된 실패를 반환한다.
     *
     * @return 실패 정보
     */
    public RemoteFailure failure() {
        return failure;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return code;
    }
}
