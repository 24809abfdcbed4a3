package com.musicinsights.playlistmerge.application.store;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.repo.TrackRepo;
import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 소스 태그 단위로 트랙 레코드를 보관하는 canonical store입니다.
 * <p>
 * 한 소스를 다시 적재하면 해당 태그의 기존 행을 모두 지우고 새 행을 넣습니다.
 * 삭제와 삽입은 {@link TransactionalOperator}로 하나의 리액티브 트랜잭션으로 묶여
 * 다른 소스의 행이나 중간 상태가 노출되지 않습니다.
 */
@Service
public class CanonicalTrackStore {

    private static final Logger log = LoggerFactory.getLogger(CanonicalTrackStore.class);

    private final TrackRepo trackRepo;
    private final TransactionalOperator tx;

    public CanonicalTrackStore(TrackRepo trackRepo, TransactionalOperator tx) {
        this.trackRepo = trackRepo;
        this.tx = tx;
    }

    /**
     * 소스 태그의 레코드를 새 레코드로 완전히 교체합니다.
     *
     * @param sourceTag 소스 태그
     * @param rows      새 레코드(모두 같은 sourceTag여야 함)
     * @return insert된 행 수
     */
    public Mono<Long> replaceSource(String sourceTag, List<TrackRow> rows) {
        if (sourceTag == null || sourceTag.isBlank()) {
            return Mono.error(new JobInputException("source tag is required", "INPUT_ERROR"));
        }
        for (TrackRow r : rows) {
            if (!sourceTag.equals(r.sourceTag())) {
                return Mono.error(new JobInputException(
                        "row for " + r.trackId() + " is tagged " + r.sourceTag() + ", expected " + sourceTag,
                        "INPUT_ERROR"));
            }
        }

        Mono<Long> work = trackRepo.deleteBySource(sourceTag)
                .flatMap(deleted -> trackRepo.insertBatch(rows)
                        .doOnNext(inserted -> log.info("Replaced source {}: {} rows removed, {} rows stored",
                                sourceTag, deleted, inserted)));

        return tx.transactional(work);
    }

    /**
     * 소스 전체를 합쳐 식별자(track_id, title, artist_name)마다 가장 최근에 추가된 레코드 하나만 남긴
     * 집합을 제목, 아티스트 순으로 반환합니다.
     *
     * @return 중복 제거된 레코드
     */
    public Flux<TrackRow> deduplicated() {
        return trackRepo.findDeduplicated();
    }

    public Flux<TrackRow> bySource(String sourceTag) {
        return trackRepo.findBySource(sourceTag);
    }
}
