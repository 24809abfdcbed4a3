package com.musicinsights.playlistmerge.infrastructure.spotify;

import com.musicinsights.playlistmerge.application.job.retry.RemoteFailure;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;

import java.time.Duration;

/**
 * WebClient 호출 중 발생한 예외를 {@link RemoteFailure}로 분류한다.
 * <ul>
 *     <li>429: RATE_LIMITED ({@code Retry-After} 초 단위, 없거나 잘못되면 기본값)</li>
 *     <li>5xx: TRANSIENT</li>
 *     <li>그 외 4xx: TERMINAL</li>
 *     <li>응답 본문 디코딩 실패: DATA</li>
 *     <li>연결/타임아웃 등 나머지: TRANSIENT</li>
 * </ul>
 */
public final class SpotifyFailureClassifier {

    private final Duration defaultRetryAfter;

    public SpotifyFailureClassifier(Duration defaultRetryAfter) {
        this.defaultRetryAfter = defaultRetryAfter;
    }

    public RemoteFailure classify(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            String message = "HTTP " + status + " " + wcre.getStatusText();
            if (status == 429) {
                return RemoteFailure.rateLimited(retryAfter(wcre.getHeaders()), message);
            }
            if (wcre.getStatusCode().is5xxServerError()) {
                return RemoteFailure.transientError(message, status);
            }
            return RemoteFailure.terminal(message + bodySuffix(wcre), status);
        }
        if (hasCause(e, DecodingException.class) || hasCause(e, JacksonException.class)) {
            return RemoteFailure.data("Undecodable response: " + e.getMessage());
        }
        return RemoteFailure.transientError(e);
    }

    Duration retryAfter(HttpHeaders headers) {
        String raw = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (raw == null || raw.isBlank()) {
            return defaultRetryAfter;
        }
        try {
            long seconds = Long.parseLong(raw.trim());
            return seconds < 0 ? defaultRetryAfter : Duration.ofSeconds(seconds);
        } catch (NumberFormatException ignored) {
            return defaultRetryAfter;
        }
    }

    private static String bodySuffix(WebClientResponseException wcre) {
        String body = wcre.getResponseBodyAsString();
        return (body == null || body.isBlank()) ? "" : ": " + body;
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }
}
