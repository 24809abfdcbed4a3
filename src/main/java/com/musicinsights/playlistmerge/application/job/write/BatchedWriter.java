package com.musicinsights.playlistmerge.application.job.write;

import com.musicinsights.playlistmerge.application.job.checkpoint.Checkpoint;
import com.musicinsights.playlistmerge.application.job.checkpoint.CheckpointStore;
import com.musicinsights.playlistmerge.application.job.retry.BackoffSleeper;
import com.musicinsights.playlistmerge.application.job.retry.RemoteFailure;
import com.musicinsights.playlistmerge.application.job.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ID 목록을 하나의 대상 컬렉션에 배치 단위로 추가하는 writer입니다.
 * <p>
 * 체크포인트의 커서는 "이미 쓴 ID 수"이며 배치가 성공할 때마다 저장합니다.
 * 재실행 시 커서만큼 건너뛰므로 같은 ID를 두 번 쓰지 않습니다.
 * <ul>
 *     <li>배치 크기: {@code min(batchSize, 100)}</li>
 *     <li>배치 사이 대기: {@code interBatchDelay}(0이면 생략)</li>
 *     <li>각 배치 호출은 {@link RetryPolicy}를 거친다</li>
 * </ul>
 */
public class BatchedWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchedWriter.class);

    /** 업스트림이 한 번에 받는 최대 ID 수 */
    public static final int MAX_BATCH_SIZE = 100;

    private final CheckpointStore checkpoints;
    private final RetryPolicy retryPolicy;
    private final BackoffSleeper sleeper;
    private final Duration interBatchDelay;

    public BatchedWriter(
            CheckpointStore checkpoints,
            RetryPolicy retryPolicy,
            BackoffSleeper sleeper,
            Duration interBatchDelay
    ) {
        this.checkpoints = checkpoints;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.interBatchDelay = (interBatchDelay == null) ? Duration.ZERO : interBatchDelay;
    }

    /**
     * ID 목록을 대상 컬렉션에 쓴다.
     *
     * @param jobKey    체크포인트 키
     * @param targetId  대상 컬렉션 ID
     * @param ids       쓸 ID 목록(순서 유지)
     * @param batchSize 요청 배치 크기(100 초과면 100으로 제한)
     * @param target    배치 쓰기 호출
     * @return 지금까지 쓴 ID 수(이전 실행분 포함)
     */
    public Mono<Long> write(String jobKey, String targetId, List<String> ids, int batchSize, BatchWriteTarget target) {
        if (batchSize < 1) {
            return Mono.error(new IllegalArgumentException("batchSize must be >= 1: " + batchSize));
        }
        int effective = Math.min(batchSize, MAX_BATCH_SIZE);

        return checkpoints.load(jobKey)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> {
                    if (found.isPresent() && found.get().complete()) {
                        log.info("{} already complete ({} written), skipping", jobKey, found.get().cursor());
                        return Mono.just(found.get().cursor());
                    }
                    long cursor = found.map(Checkpoint::cursor).orElse(0L);
                    return run(jobKey, targetId, ids, effective, cursor, target);
                });
    }

    private Mono<Long> run(
            String jobKey,
            String targetId,
            List<String> ids,
            int batchSize,
            long cursor,
            BatchWriteTarget target
    ) {
        int start = (int) Math.min(cursor, ids.size());
        List<List<String>> batches = Partitions.of(ids.subList(start, ids.size()), batchSize);
        AtomicLong written = new AtomicLong(cursor);

        if (cursor > 0) {
            log.info("Resuming {} at {}/{}", jobKey, cursor, ids.size());
        } else {
            log.info("Writing {} ids to {} in {} batches", ids.size(), targetId, batches.size());
        }

        return Flux.range(0, batches.size())
                .concatMap(i -> Mono.defer(() -> {
                    List<String> batch = batches.get(i);
                    Mono<Void> pause = (i == 0 || interBatchDelay.isZero())
                            ? Mono.empty()
                            : sleeper.sleep(interBatchDelay);
                    return pause
                            .then(retryPolicy.withRetry(
                                            jobKey + " batch@" + written.get(),
                                            () -> target.write(targetId, batch))
                                    .then(Mono.defer(() -> {
                                        long now = written.addAndGet(batch.size());
                                        log.debug("{} wrote {}/{}", jobKey, now, ids.size());
                                        return checkpoints.save(Checkpoint.writeProgress(jobKey, now));
                                    })));
                }))
                .then(Mono.defer(() -> checkpoints.save(Checkpoint.writeComplete(jobKey, written.get()))))
                .then(Mono.fromCallable(written::get))
                .doOnNext(total -> log.info("{} complete: {} ids written to {}", jobKey, total, targetId))
                .onErrorResume(e -> checkpoints.save(Checkpoint.writeFailed(jobKey, written.get(), RemoteFailure.describe(e)))
                        .onErrorResume(saveError -> {
                            e.addSuppressed(saveError);
                            return Mono.empty();
                        })
                        .then(Mono.error(e)));
    }
}
