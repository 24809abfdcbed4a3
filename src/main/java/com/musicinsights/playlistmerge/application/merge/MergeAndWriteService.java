package com.musicinsights.playlistmerge.application.merge;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import com.musicinsights.playlistmerge.application.job.checkpoint.Checkpoint;
import com.musicinsights.playlistmerge.application.job.checkpoint.CheckpointStore;
import com.musicinsights.playlistmerge.application.job.checkpoint.JobKeys;
import com.musicinsights.playlistmerge.application.job.retry.RetryPolicy;
import com.musicinsights.playlistmerge.application.job.write.BatchedWriter;
import com.musicinsights.playlistmerge.application.job.write.Partitions;
import com.musicinsights.playlistmerge.application.store.CanonicalTrackStore;
import com.musicinsights.playlistmerge.config.PlaylistMergeProperties;
import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import com.musicinsights.playlistmerge.infrastructure.spotify.SpotifyApiClient;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.CreatedPlaylist;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.SpotifyUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 중복 제거된 트랙 집합을 새 대상 플레이리스트(들)로 내보내는 서비스입니다.
 * <p>
 * 흐름: 중복 제거 조회 → {@code maxPlaylistSize} 단위로 분할 → 조각마다 플레이리스트 생성(또는 재사용)
 * → {@link BatchedWriter}로 재개 가능한 배치 쓰기.
 * <p>
 * 생성한 플레이리스트 ID는 {@code create:<name>#<part>} 체크포인트에 남겨, 중단된 병합을 재실행하면 새로 만들지 않고 이어서 씁니다.
 * 쓰기가 끝난 병합과 같은 이름으로 다시 실행하면 새 플레이리스트를 만듭니다.
 */
@Service
public class MergeAndWriteService {

    private static final Logger log = LoggerFactory.getLogger(MergeAndWriteService.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final CanonicalTrackStore store;
    private final SpotifyApiClient spotify;
    private final BatchedWriter writer;
    private final RetryPolicy retryPolicy;
    private final CheckpointStore checkpoints;
    private final Clock clock;
    private final int batchSize;
    private final int maxPlaylistSize;

    public MergeAndWriteService(
            CanonicalTrackStore store,
            SpotifyApiClient spotify,
            BatchedWriter writer,
            RetryPolicy retryPolicy,
            CheckpointStore checkpoints,
            Clock clock,
            PlaylistMergeProperties props
    ) {
        this.store = store;
        this.spotify = spotify;
        this.writer = writer;
        this.retryPolicy = retryPolicy;
        this.checkpoints = checkpoints;
        this.clock = clock;
        this.batchSize = props.write().batchSize();
        this.maxPlaylistSize = props.write().maxPlaylistSize();
    }

    /** 이름이 주어지지 않았을 때의 기본 이름({@code Master Library yyyy-MM-dd}) */
    public String defaultName() {
        return "Master Library " + LocalDate.now(clock).format(DAY);
    }

    /**
     * 중복 제거 결과로 분할 계획을 만든다. 원격 호출은 하지 않는다.
     *
     * @param name 기본 이름(null/blank면 {@link #defaultName()})
     * @return 분할 계획
     */
    public Mono<MergePlan> plan(String name) {
        String base = (name == null || name.isBlank()) ? defaultName() : name.trim();
        return store.deduplicated()
                .map(TrackRow::trackId)
                .collectList()
                .map(ids -> {
                    List<List<String>> chunks = Partitions.of(ids, maxPlaylistSize);
                    List<MergePlan.Part> parts = new ArrayList<>(chunks.size());
                    for (int i = 0; i < chunks.size(); i++) {
                        String partName = chunks.size() > 1 ? base + " (Part " + (i + 1) + ")" : base;
                        parts.add(new MergePlan.Part(i + 1, partName, chunks.get(i)));
                    }
                    return new MergePlan(base, parts);
                });
    }

    /**
     * 계획대로 대상 플레이리스트를 만들고 트랙을 채운다.
     *
     * @param plan 분할 계획
     * @return 대상 플레이리스트 목록(조각 순서)
     */
    public Mono<List<MergedPlaylist>> execute(MergePlan plan) {
        if (plan.parts().isEmpty()) {
            return Mono.error(new JobInputException("No tracks in the canonical store; run ingest first", "INPUT_ERROR"));
        }

        return Mono.fromRunnable(spotify::requireCredentials)
                .then(retryPolicy.withRetry("current user", spotify::currentUser))
                .map(SpotifyUser::id)
                .flatMapMany(userId -> Flux.fromIterable(plan.parts())
                        .concatMap(part -> writePart(userId, plan.name(), part)))
                .collectList()
                .doOnNext(created -> created.forEach(p ->
                        log.info("Playlist {}: {} tracks, {}", p.name(), p.tracks(), p.url())));
    }

    /**
     * 계획 수립과 실행을 한 번에 수행한다.
     *
     * @param name 기본 이름(null/blank면 기본값)
     * @return 대상 플레이리스트 목록
     */
    public Mono<List<MergedPlaylist>> mergeAndWrite(String name) {
        return plan(name).flatMap(this::execute);
    }

    private Mono<MergedPlaylist> writePart(String userId, String baseName, MergePlan.Part part) {
        String createKey = JobKeys.create(baseName, part.number());

        return checkpoints.load(createKey)
                .filter(cp -> cp.complete() && cp.ref() != null)
                .flatMap(cp -> unfinishedTarget(cp.ref(), part))
                .switchIfEmpty(Mono.defer(() -> createPlaylist(userId, part, createKey)))
                .flatMap(targetId -> writer.write(
                                JobKeys.write(targetId),
                                targetId,
                                part.trackIds(),
                                batchSize,
                                spotify::addTracks)
                        .map(written -> new MergedPlaylist(part.name(), targetId, written)));
    }

    /**
     * 이전 실행이 만든 플레이리스트는 그 쓰기 job이 끝나지 않았을 때만 이어 쓴다.
     * 쓰기가 완료된 플레이리스트는 이전 병합 결과이므로 empty를 반환해 새로 만들게 한다.
     */
    private Mono<String> unfinishedTarget(String targetId, MergePlan.Part part) {
        return checkpoints.load(JobKeys.write(targetId))
                .map(cp -> !cp.complete())
                .defaultIfEmpty(true)
                .flatMap(unfinished -> {
                    if (unfinished) {
                        log.info("Resuming playlist {} for {}", targetId, part.name());
                        return Mono.just(targetId);
                    }
                    log.info("Playlist {} already holds a finished merge for {}, creating a new one",
                            targetId, part.name());
                    return Mono.<String>empty();
                });
    }

    private Mono<String> createPlaylist(String userId, MergePlan.Part part, String createKey) {
        String description = "Merged playlist created on " + LocalDate.now(clock).format(DAY);
        return retryPolicy.withRetry("create " + part.name(),
                        () -> spotify.createPlaylist(userId, part.name(), description))
                .map(CreatedPlaylist::id)
                .flatMap(id -> {
                    log.info("Created playlist {} ({})", part.name(), id);
                    return checkpoints.save(Checkpoint.created(createKey, id)).thenReturn(id);
                });
    }
}
