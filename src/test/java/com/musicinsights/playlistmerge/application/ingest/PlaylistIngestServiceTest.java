package com.musicinsights.playlistmerge.application.ingest;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import com.musicinsights.playlistmerge.application.job.checkpoint.InMemoryCheckpointStore;
import com.musicinsights.playlistmerge.application.job.fetch.PaginatedFetcher;
import com.musicinsights.playlistmerge.application.job.retry.RecordingSleeper;
import com.musicinsights.playlistmerge.application.job.retry.RemoteFailure;
import com.musicinsights.playlistmerge.application.job.retry.RemoteResult;
import com.musicinsights.playlistmerge.application.job.retry.RetryPolicy;
import com.musicinsights.playlistmerge.application.store.CanonicalTrackStore;
import com.musicinsights.playlistmerge.config.TestProperties;
import com.musicinsights.playlistmerge.infrastructure.mapper.PlaylistItemMapper;
import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import com.musicinsights.playlistmerge.infrastructure.spotify.SpotifyApiClient;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistItem;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistPage;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.TrackPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * {@link PlaylistIngestService} 단위 테스트.
 *
 * <p>fetch → 정규화 → 소스 단위 교체 흐름과, 한 플레이리스트 실패가 나머지를 막지 않는지 검증한다.</p>
 */
@DisplayName("플레이리스트 ingest 서비스 테스트")
class PlaylistIngestServiceTest {

    SpotifyApiClient spotify;
    CanonicalTrackStore store;
    InMemoryCheckpointStore checkpoints;
    PlaylistIngestService service;

    @BeforeEach
    void setUp() {
        spotify = mock(SpotifyApiClient.class);
        store = mock(CanonicalTrackStore.class);
        checkpoints = new InMemoryCheckpointStore();
        RetryPolicy retry = new RetryPolicy(5, new RecordingSleeper());
        service = new PlaylistIngestService(
                spotify,
                new PaginatedFetcher(checkpoints, retry, 5),
                retry,
                new PlaylistItemMapper(),
                store,
                TestProperties.defaults());
    }

    private static PlaylistItem item(String id) {
        return new PlaylistItem("2024-01-01T00:00:00Z",
                new TrackPayload(id, "Song " + id, List.of(), null, null, null, false, null));
    }

    private void stubPlaylist(String playlistId, List<PlaylistItem> items) {
        when(spotify.playlistName(playlistId)).thenReturn(Mono.just(RemoteResult.ok("Name " + playlistId)));
        when(spotify.playlistTracks(eq(playlistId), anyLong(), anyInt())).thenAnswer(inv -> {
            long offset = inv.getArgument(1);
            int limit = inv.getArgument(2);
            int from = (int) Math.min(offset, items.size());
            int to = (int) Math.min(offset + limit, items.size());
            return Mono.just(RemoteResult.ok(new PlaylistPage(items.subList(from, to), items.size())));
        });
    }

    @Test
    @DisplayName("플레이리스트를 가져와 플레이리스트 ID 태그로 교체 저장")
    @SuppressWarnings("unchecked")
    void ingestAll_fetchesNormalizesAndReplaces() {
        // given
        stubPlaylist("p1", List.of(item("t1"), item("t2"), new PlaylistItem(null, null)));
        when(store.replaceSource(eq("p1"), anyList())).thenReturn(Mono.just(2L));

        // when & then
        StepVerifier.create(service.ingestAll(List.of("p1")))
                .assertNext(summary -> {
                    assertThat(summary.hasFailures()).isFalse();
                    assertThat(summary.ingested()).containsExactly(new IngestSummary.Ingested("p1", "Name p1", 3, 2));
                })
                .verifyComplete();

        ArgumentCaptor<List<TrackRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(store).replaceSource(eq("p1"), rows.capture());
        assertThat(rows.getValue()).extracting(TrackRow::trackId).containsExactly("t1", "t2");
        assertThat(rows.getValue()).allMatch(r -> r.sourceTag().equals("p1"));
        assertThat(checkpoints.latest("fetch:p1").complete()).isTrue();
    }

    @Test
    @DisplayName("한 플레이리스트가 실패해도 나머지는 적재하고 마지막에 IngestFailedException")
    void ingestAll_continuesPastFailure_thenFails() {
        // given
        when(spotify.playlistName("bad")).thenReturn(Mono.just(RemoteResult.failed(RemoteFailure.terminal("HTTP 404", 404))));
        stubPlaylist("good", List.of(item("t1")));
        when(store.replaceSource(eq("good"), anyList())).thenReturn(Mono.just(1L));

        // when & then
        StepVerifier.create(service.ingestAll(List.of("bad", "good")))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(IngestFailedException.class);
                    IngestSummary summary = ((IngestFailedException) e).summary();
                    assertThat(summary.failures()).extracting(IngestSummary.Failure::playlistId).containsExactly("bad");
                    assertThat(summary.ingested()).extracting(IngestSummary.Ingested::playlistId).containsExactly("good");
                    assertThat(((IngestFailedException) e).code()).isEqualTo("INGEST_FAILED");
                })
                .verify();

        verify(store, never()).replaceSource(eq("bad"), anyList());
    }

    @Test
    @DisplayName("자격 증명이 없으면 원격 호출 전에 입력 오류")
    void ingestAll_withoutCredentials() {
        doThrow(new JobInputException("no token", "MISSING_CREDENTIALS")).when(spotify).requireCredentials();

        StepVerifier.create(service.ingestAll(List.of("p1")))
                .expectError(JobInputException.class)
                .verify();

        verify(spotify, never()).playlistTracks(anyString(), anyLong(), anyInt());
    }
}
