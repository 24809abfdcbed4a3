package com.musicinsights.playlistmerge.application.store;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link CanonicalTrackStore} 통합 테스트.
 *
 * <p>소스 단위 full refresh가 다른 소스에 영향을 주지 않는지 검증한다.</p>
 */
@DisplayName("canonical store 테스트")
@SpringBootTest
class CanonicalTrackStoreTest {

    @Autowired
    CanonicalTrackStore store;
    @Autowired
    DatabaseClient db;

    @BeforeEach
    void clean() {
        StepVerifier.create(db.sql("DELETE FROM track").fetch().rowsUpdated())
                .expectNextCount(1).verifyComplete();
    }

    static TrackRow row(String id, String source) {
        return new TrackRow(id, "Song " + id, "a1", "Artist", null, null, null, null, null, false, null,
                Instant.parse("2022-01-01T00:00:00Z"), source);
    }

    @Test
    @DisplayName("같은 소스를 다시 적재하면 이전 행은 사라지고 다른 소스는 그대로")
    void replaceSource_isolatesOtherSources() {
        StepVerifier.create(store.replaceSource("A", List.of(row("t1", "A"), row("t2", "A")))
                        .then(store.replaceSource("B", List.of(row("t1", "B"))))
                        .then(store.replaceSource("A", List.of(row("t3", "A")))))
                .expectNext(1L)
                .verifyComplete();

        StepVerifier.create(store.bySource("A").map(TrackRow::trackId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("t3"))
                .verifyComplete();
        StepVerifier.create(store.bySource("B").map(TrackRow::trackId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("t1"))
                .verifyComplete();
    }

    @Test
    @DisplayName("빈 목록으로 교체하면 해당 소스가 비워짐")
    void replaceSource_withEmpty_clearsSource() {
        StepVerifier.create(store.replaceSource("A", List.of(row("t1", "A")))
                        .then(store.replaceSource("A", List.of())))
                .expectNext(0L)
                .verifyComplete();

        StepVerifier.create(store.bySource("A").count())
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    @DisplayName("다른 소스 태그가 섞인 행은 거부하고 기존 데이터는 유지")
    void replaceSource_rejectsForeignRows() {
        StepVerifier.create(store.replaceSource("A", List.of(row("t1", "A"))))
                .expectNext(1L)
                .verifyComplete();

        StepVerifier.create(store.replaceSource("A", List.of(row("t2", "B"))))
                .expectError(JobInputException.class)
                .verify();

        StepVerifier.create(store.bySource("A").count())
                .expectNext(1L)
                .verifyComplete();
    }

    @Test
    @DisplayName("여러 소스에 있는 같은 트랙은 중복 제거 결과에 한 번만")
    void deduplicated_acrossSources() {
        StepVerifier.create(store.replaceSource("A", List.of(row("t1", "A"), row("t2", "A")))
                        .then(store.replaceSource("B", List.of(row("t1", "B")))))
                .expectNext(1L)
                .verifyComplete();

        StepVerifier.create(store.deduplicated().map(TrackRow::trackId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("t1", "t2"))
                .verifyComplete();
    }
}
