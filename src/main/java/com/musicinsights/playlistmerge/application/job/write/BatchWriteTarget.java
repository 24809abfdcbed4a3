package com.musicinsights.playlistmerge.application.job.write;

import com.musicinsights.playlistmerge.application.job.retry.RemoteResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 대상 컬렉션에 ID 한 묶음을 추가하는 원격 호출.
 */
@FunctionalInterface
public interface BatchWriteTarget {

    /**
     * @param targetId 대상 컬렉션 ID
     * @param idBatch  추가할 ID(최대 {@link BatchedWriter#MAX_BATCH_SIZE}개)
     * @return 호출 결과(성공 값은 업스트림이 돌려준 스냅샷 ID 등)
     */
    Mono<RemoteResult<String>> write(String targetId, List<String> idBatch);
}
