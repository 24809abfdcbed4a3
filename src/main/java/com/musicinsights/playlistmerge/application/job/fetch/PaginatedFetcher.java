package com.musicinsights.playlistmerge.application.job.fetch;

import com.musicinsights.playlistmerge.application.job.checkpoint.Checkpoint;
import com.musicinsights.playlistmerge.application.job.checkpoint.CheckpointStore;
import com.musicinsights.playlistmerge.application.job.retry.RemoteFailure;
import com.musicinsights.playlistmerge.application.job.retry.RetryPolicy;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistItem;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.stream.LongStream;

/**
 * 원격 컬렉션의 모든 페이지를 순서대로 가져오는 fetcher입니다.
 * <p>
 * 흐름: 체크포인트 로드 → (완료면 버퍼 즉시 반환) → 커서부터 페이지 순차 요청 → N 페이지마다 체크포인트 저장
 * → 마지막에 complete 체크포인트 저장.
 * <p>
 * 실패 시에는 지금까지의 커서와 버퍼, 에러 메시지를 저장한 뒤 에러를 전파합니다.
 * 다음 실행은 마지막으로 완료된 커서부터 이어갑니다.
 */
public class PaginatedFetcher {

    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);

    /** 기본 체크포인트 주기(페이지 수) */
    public static final int DEFAULT_CHECKPOINT_EVERY_PAGES = 5;

    private final CheckpointStore checkpoints;
    private final RetryPolicy retryPolicy;
    private final int checkpointEveryPages;

    public PaginatedFetcher(CheckpointStore checkpoints, RetryPolicy retryPolicy, int checkpointEveryPages) {
        if (checkpointEveryPages < 1) {
            throw new IllegalArgumentException("checkpointEveryPages must be >= 1: " + checkpointEveryPages);
        }
        this.checkpoints = checkpoints;
        this.retryPolicy = retryPolicy;
        this.checkpointEveryPages = checkpointEveryPages;
    }

    /**
     * 전체 아이템 수를 직접 받아 fetch 한다.
     *
     * @param jobKey     체크포인트 키
     * @param pageSize   페이지 크기
     * @param totalCount 전체 아이템 수
     * @param source     페이지 호출
     * @return 순서가 보존된 전체 아이템
     */
    public Mono<List<PlaylistItem>> fetch(String jobKey, int pageSize, long totalCount, PageSource source) {
        requirePositive(pageSize);
        return loadCheckpoint(jobKey).flatMap(found -> {
            if (found.isPresent() && found.get().complete()) {
                return Mono.just(alreadyFetched(found.get()));
            }
            return run(jobKey, pageSize, totalCount, found.orElse(null), source);
        });
    }

    /**
     * 전체 아이템 수를 모르는 상태에서 fetch 한다.
     * <p>
     * 새로 시작하는 실행에서만 {@code page(0, 1)} probe로 total을 읽고,
     * 재개하는 실행은 체크포인트에 기록된 최초 total을 그대로 사용한다.
     *
     * @param jobKey   체크포인트 키
     * @param pageSize 페이지 크기
     * @param source   페이지 호출
     * @return 순서가 보존된 전체 아이템
     */
    public Mono<List<PlaylistItem>> fetch(String jobKey, int pageSize, PageSource source) {
        requirePositive(pageSize);
        return loadCheckpoint(jobKey).flatMap(found -> {
            Checkpoint cp = found.orElse(null);
            if (cp != null && cp.complete()) {
                return Mono.just(alreadyFetched(cp));
            }
            if (cp != null && cp.total() != null) {
                return run(jobKey, pageSize, cp.total(), cp, source);
            }
            return probeTotal(jobKey, source)
                    .flatMap(total -> run(jobKey, pageSize, total, cp, source));
        });
    }

    private Mono<Optional<Checkpoint>> loadCheckpoint(String jobKey) {
        return checkpoints.load(jobKey)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private List<PlaylistItem> alreadyFetched(Checkpoint cp) {
        log.info("{} already fully fetched, loading {} items from checkpoint", cp.jobKey(), cp.items().size());
        return cp.items();
    }

    private Mono<Long> probeTotal(String jobKey, PageSource source) {
        return retryPolicy.withRetry(jobKey + " probe", () -> source.page(0, 1))
                .map(PlaylistPage::total)
                .onErrorResume(e -> checkpoints.save(Checkpoint.fetchFailed(jobKey, 0L, null, List.of(), RemoteFailure.describe(e)))
                        .then(Mono.error(e)));
    }

    private Mono<List<PlaylistItem>> run(
            String jobKey,
            int pageSize,
            long total,
            Checkpoint resumeFrom,
            PageSource source
    ) {
        FetchProgress progress = FetchProgress.start(jobKey, total, resumeFrom);
        if (resumeFrom != null) {
            log.info("Resuming {} from offset {} ({} items already fetched, total {})",
                    jobKey, progress.cursor(), resumeFrom.items().size(), total);
        } else {
            log.info("Fetching {} ({} items, page size {})", jobKey, total, pageSize);
        }

        return Flux.fromIterable(offsets(progress.cursor(), total, pageSize))
                .concatMap(offset ->
                        retryPolicy.withRetry(jobKey + " page@" + offset, () -> source.page(offset, pageSize))
                                .flatMap(page -> {
                                    progress.advance(page.items(), pageSize);
                                    return progress.pagesThisRun() % checkpointEveryPages == 0
                                            ? checkpoints.save(progress.snapshot())
                                            : Mono.<Void>empty();
                                })
                )
                .then(Mono.defer(() -> checkpoints.save(progress.completed())))
                .then(Mono.fromCallable(progress::items))
                .doOnNext(items -> log.info("{} fetched {} items", jobKey, items.size()))
                .onErrorResume(e -> checkpoints.save(progress.failed(e))
                        .onErrorResume(saveError -> {
                            e.addSuppressed(saveError);
                            return Mono.empty();
                        })
                        .then(Mono.error(e)));
    }

    /** 커서부터 total 미만까지 페이지 시작 offset 목록 */
    static List<Long> offsets(long cursor, long total, int pageSize) {
        return LongStream.iterate(cursor, o -> o < total, o -> o + pageSize)
                .boxed()
                .toList();
    }

    private static void requirePositive(int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
        }
    }
}
