package com.musicinsights.playlistmerge.application.job.retry;

/**
 * 최대 시도 횟수를 모두 소진한 경우.
 */
public class RetryExhaustedException extends RemoteCallException {

    public RetryExhaustedException(String operation, int maxAttempts, RemoteFailure lastFailure) {
        super("Max retries (" + maxAttempts + ") exceeded for " + operation + ": " + lastFailure.message(),
                lastFailure, "RETRY_EXHAUSTED");
    }
}
