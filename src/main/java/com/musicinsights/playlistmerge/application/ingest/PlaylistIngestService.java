package com.musicinsights.playlistmerge.application.ingest;

import com.musicinsights.playlistmerge.application.job.checkpoint.JobKeys;
import com.musicinsights.playlistmerge.application.job.fetch.PaginatedFetcher;
import com.musicinsights.playlistmerge.application.job.retry.RemoteFailure;
import com.musicinsights.playlistmerge.application.job.retry.RetryPolicy;
import com.musicinsights.playlistmerge.application.store.CanonicalTrackStore;
import com.musicinsights.playlistmerge.config.PlaylistMergeProperties;
import com.musicinsights.playlistmerge.infrastructure.mapper.PlaylistItemMapper;
import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import com.musicinsights.playlistmerge.infrastructure.spotify.SpotifyApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * 플레이리스트들을 원격에서 읽어 canonical store에 적재하는 서비스입니다.
 * <p>
 * 플레이리스트마다 다음 순서로 처리합니다:
 * 이름 조회 → 재개 가능한 페이지 fetch({@code fetch:<id>}) → 정규화 → 소스 단위 full refresh
 * <p>
 * 한 플레이리스트가 실패해도 나머지는 계속 처리하고, 끝난 뒤 실패가 있으면 {@link IngestFailedException}을 냅니다.
 */
@Service
public class PlaylistIngestService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistIngestService.class);

    private final SpotifyApiClient spotify;
    private final PaginatedFetcher fetcher;
    private final RetryPolicy retryPolicy;
    private final PlaylistItemMapper mapper;
    private final CanonicalTrackStore store;
    private final int pageSize;

    public PlaylistIngestService(
            SpotifyApiClient spotify,
            PaginatedFetcher fetcher,
            RetryPolicy retryPolicy,
            PlaylistItemMapper mapper,
            CanonicalTrackStore store,
            PlaylistMergeProperties props
    ) {
        this.spotify = spotify;
        this.fetcher = fetcher;
        this.retryPolicy = retryPolicy;
        this.mapper = mapper;
        this.store = store;
        this.pageSize = props.fetch().pageSize();
    }

    /**
     * 플레이리스트들을 순서대로 적재합니다.
     *
     * @param playlistIds 플레이리스트 ID 목록
     * @return 모두 성공하면 요약, 하나라도 실패하면 {@link IngestFailedException}
     */
    public Mono<IngestSummary> ingestAll(List<String> playlistIds) {
        List<String> ids = playlistIds.stream().distinct().toList();
        List<IngestSummary.Ingested> ok = new ArrayList<>();
        List<IngestSummary.Failure> failed = new ArrayList<>();

        return Mono.fromRunnable(spotify::requireCredentials)
                .thenMany(Flux.fromIterable(ids))
                .concatMap(id -> ingestOne(id)
                        .doOnNext(ok::add)
                        .onErrorResume(e -> {
                            log.error("Failed to ingest playlist {}: {}", id, RemoteFailure.describe(e));
                            failed.add(new IngestSummary.Failure(id, RemoteFailure.describe(e)));
                            return Mono.empty();
                        }))
                .then(Mono.fromCallable(() -> new IngestSummary(List.copyOf(ok), List.copyOf(failed))))
                .flatMap(summary -> {
                    log.info("Ingest finished: {} playlists, {} tracks stored, {} failed",
                            summary.ingested().size(), summary.totalTracks(), summary.failures().size());
                    return summary.hasFailures()
                            ? Mono.error(new IngestFailedException(summary))
                            : Mono.just(summary);
                });
    }

    /**
     * 플레이리스트 하나를 적재합니다.
     *
     * @param playlistId 플레이리스트 ID(소스 태그로도 사용)
     * @return 적재 결과
     */
    public Mono<IngestSummary.Ingested> ingestOne(String playlistId) {
        return retryPolicy.withRetry("name " + playlistId, () -> spotify.playlistName(playlistId))
                .defaultIfEmpty(playlistId)
                .flatMap(name -> {
                    log.info("Ingesting playlist {} ({})", name, playlistId);
                    return fetcher.fetch(
                                    JobKeys.fetch(playlistId),
                                    pageSize,
                                    (offset, limit) -> spotify.playlistTracks(playlistId, offset, limit))
                            .flatMap(items -> {
                                List<TrackRow> rows = mapper.toRows(items, playlistId);
                                return store.replaceSource(playlistId, rows)
                                        .map(stored -> new IngestSummary.Ingested(playlistId, name, items.size(), stored));
                            });
                });
    }
}
