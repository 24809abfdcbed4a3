package com.musicinsights.playlistmerge.application.job.retry;

/**
 * 업스트림이 재시도 불가능한 실패(TERMINAL/DATA)를 돌려준 경우.
 */
public class NonRetryableRemoteException extends RemoteCallException {

    public NonRetryableRemoteException(String operation, RemoteFailure failure) {
        super(operation + " rejected (" + failure.kind() + "): " + failure.message(), failure, "REMOTE_REJECTED");
    }
}
