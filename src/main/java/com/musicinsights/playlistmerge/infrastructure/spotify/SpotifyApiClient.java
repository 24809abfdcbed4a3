package com.musicinsights.playlistmerge.infrastructure.spotify;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import com.musicinsights.playlistmerge.application.job.retry.RemoteFailure;
import com.musicinsights.playlistmerge.application.job.retry.RemoteResult;
import com.musicinsights.playlistmerge.infrastructure.mapper.NormalizeUtils;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.CreatedPlaylist;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistInfo;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistPage;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.SnapshotResponse;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.SpotifyUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Spotify Web API 어댑터입니다.
 * <p>
 * 모든 호출은 예외 대신 {@link RemoteResult}를 돌려주며, 실패는 {@link SpotifyFailureClassifier}로 분류됩니다.
 * 재시도 여부는 호출하는 쪽의 재시도 정책이 결정합니다.
 */
public class SpotifyApiClient {

    private static final Logger log = LoggerFactory.getLogger(SpotifyApiClient.class);

    private final WebClient webClient;
    private final SpotifyFailureClassifier classifier;
    private final Duration timeout;
    private final boolean hasCredentials;

    public SpotifyApiClient(
            WebClient webClient,
            SpotifyFailureClassifier classifier,
            Duration timeout,
            boolean hasCredentials
    ) {
        this.webClient = webClient;
        this.classifier = classifier;
        this.timeout = timeout;
        this.hasCredentials = hasCredentials;
    }

    /**
     * 플레이리스트 트랙 한 페이지를 조회한다.
     *
     * @param playlistId 플레이리스트 ID
     * @param offset     시작 offset
     * @param limit      페이지 크기(최대 100)
     * @return 페이지 결과
     */
    public Mono<RemoteResult<PlaylistPage>> playlistTracks(String playlistId, long offset, int limit) {
        return call(webClient.get()
                .uri(b -> b.path("/playlists/{id}/tracks")
                        .queryParam("offset", offset)
                        .queryParam("limit", limit)
                        .build(playlistId))
                .retrieve()
                .bodyToMono(PlaylistPage.class));
    }

    /** 플레이리스트 이름(로그용) */
    public Mono<RemoteResult<String>> playlistName(String playlistId) {
        return call(webClient.get()
                .uri(b -> b.path("/playlists/{id}")
                        .queryParam("fields", "name")
                        .build(playlistId))
                .retrieve()
                .bodyToMono(PlaylistInfo.class)
                .map(info -> info.name() == null ? playlistId : info.name()));
    }

    /** 현재 토큰 소유자 */
    public Mono<RemoteResult<SpotifyUser>> currentUser() {
        return call(webClient.get()
                .uri("/me")
                .retrieve()
                .bodyToMono(SpotifyUser.class));
    }

    /**
     * 비공개 플레이리스트를 생성한다.
     *
     * @param userId      소유자 ID
     * @param name        플레이리스트 이름
     * @param description 설명
     * @return 생성된 플레이리스트
     */
    public Mono<RemoteResult<CreatedPlaylist>> createPlaylist(String userId, String name, String description) {
        Map<String, Object> body = Map.of(
                "name", name,
                "public", false,
                "description", description == null ? "" : description
        );
        return call(webClient.post()
                .uri("/users/{userId}/playlists", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(CreatedPlaylist.class));
    }

    /**
     * 플레이리스트에 트랙을 추가한다.
     *
     * @param playlistId 대상 플레이리스트 ID
     * @param trackIds   트랙 ID 또는 URI(최대 100개)
     * @return 변경 후 스냅샷 ID
     */
    public Mono<RemoteResult<String>> addTracks(String playlistId, List<String> trackIds) {
        List<String> uris = trackIds.stream().map(NormalizeUtils::toTrackUri).toList();
        return call(webClient.post()
                .uri("/playlists/{id}/tracks", playlistId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uris", uris))
                .retrieve()
                .bodyToMono(SnapshotResponse.class)
                .map(r -> r.snapshotId() == null ? "" : r.snapshotId()));
    }

    /**
     * API 호출이 필요한 명령 전에 자격 증명이 있는지 확인한다.
     *
     * @throws JobInputException 토큰이 설정되지 않은 경우
     */
    public void requireCredentials() {
        if (!hasCredentials) {
            throw new JobInputException(
                    "Spotify access token is not configured (set SPOTIFY_ACCESS_TOKEN)", "MISSING_CREDENTIALS");
        }
    }

    private <T> Mono<RemoteResult<T>> call(Mono<T> request) {
        return request
                .timeout(timeout)
                .map(RemoteResult::ok)
                .switchIfEmpty(Mono.fromSupplier(() -> RemoteResult.<T>failed(RemoteFailure.data("empty response body"))))
                .onErrorResume(e -> {
                    RemoteFailure failure = classifier.classify(e);
                    log.debug("Spotify call failed: {} ({})", failure.message(), failure.kind());
                    return Mono.just(RemoteResult.<T>failed(failure));
                });
    }
}
