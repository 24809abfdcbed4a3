package com.musicinsights.playlistmerge.application.common.error;

/**
 * 잘못된 입력(인자, 파일, 자격 증명)으로 작업을 시작할 수 없는 상황을 표현하는 예외.
 *
 * <p>재시도 대상이 아니며, CLI는 종료 코드 1로 끝난다.</p>
 */
public class JobInputException extends RuntimeException {
    private final String code;

    public JobInputException(String message, String code) {
        super(message);
        this.code = code;
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
