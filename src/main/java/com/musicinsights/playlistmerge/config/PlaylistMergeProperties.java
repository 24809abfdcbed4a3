package com.musicinsights.playlistmerge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * {@code playlistmerge.*} 설정.
 *
 * @param spotify    Spotify Web API 접속 설정
 * @param checkpoint 체크포인트 저장 위치
 * @param fetch      페이지 fetch 설정
 * @param write      배치 write 설정
 * @param retry      재시도 정책 설정
 * @param report     리포트 설정
 */
@Validated
@ConfigurationProperties("playlistmerge")
public record PlaylistMergeProperties(
        @Valid @NotNull Spotify spotify,
        @Valid @NotNull Checkpoint checkpoint,
        @Valid @NotNull Fetch fetch,
        @Valid @NotNull Write write,
        @Valid @NotNull Retry retry,
        @Valid @NotNull Report report
) {

    /**
     * @param baseUrl     API 기본 URL
     * @param accessToken 이미 발급된 bearer 토큰(비어 있을 수 있음)
     * @param timeout     호출당 응답 대기 시간
     */
    public record Spotify(
            @NotBlank String baseUrl,
            String accessToken,
            @NotNull Duration timeout
    ) {
        public boolean hasAccessToken() {
            return accessToken != null && !accessToken.isBlank();
        }
    }

    public record Checkpoint(@NotBlank String dir) {}

    /**
     * @param pageSize            페이지 크기
     * @param checkpointEveryPages 몇 페이지마다 체크포인트를 남길지
     */
    public record Fetch(
            @Min(1) @Max(100) int pageSize,
            @Min(1) int checkpointEveryPages
    ) {}

    /**
     * @param batchSize       한 번에 추가할 ID 수
     * @param interBatchDelay 배치 사이 대기
     * @param maxPlaylistSize 대상 플레이리스트 하나에 넣을 최대 트랙 수
     */
    public record Write(
            @Min(1) @Max(100) int batchSize,
            @NotNull Duration interBatchDelay,
            @Min(1) int maxPlaylistSize
    ) {}

    /**
     * @param maxAttempts       최대 시도 횟수
     * @param defaultRetryAfter Retry-After 헤더가 없을 때의 대기
     */
    public record Retry(
            @Min(1) int maxAttempts,
            @NotNull Duration defaultRetryAfter
    ) {}

    public record Report(@Min(0) int topArtists) {}
}
