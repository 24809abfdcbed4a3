package com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import io.r2dbc.spi.Row;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * track 테이블에 대한 배치 insert, 소스 단위 삭제, 중복 제거 조회를 제공하는 Repository입니다.
 * <p>
 * 시각 컬럼은 UTC 기준 {@link LocalDateTime}으로 저장합니다.
 */
@Component
public class TrackRepo extends BatchSqlSupport {

    /** 배치 insert 시 한 번에 처리할 최대 행 수 */
    private static final int CHUNK = 200;

    /**
     * 식별자(track_id, title, artist_name)마다 가장 최근에 추가된 행 하나만 남긴다.
     * 동률이면 source_tag, row_id 순으로 결정한다.
     */
    static final String DEDUPLICATED_SQL = """
        SELECT track_id, title, artist_id, artist_name, album_id, album_name,
               release_date, duration_ms, popularity, is_explicit, isrc, added_at, source_tag
        FROM (
          SELECT t.*,
                 ROW_NUMBER() OVER (
                   PARTITION BY t.track_id, t.title, t.artist_name
                   ORDER BY t.added_at DESC NULLS LAST, t.source_tag, t.row_id
                 ) AS rn
          FROM track t
        ) ranked
        WHERE rn = 1
        ORDER BY title, artist_name, track_id
        """;

    /** insert 한 행의 파라미터 이름(컬럼 순서) */
    private static final List<String> INSERT_PARAMS =
            List.of("id", "t", "aid", "an", "alid", "aln", "rd", "dm", "p", "ex", "isrc", "at", "src");

    public TrackRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 트랙 목록을 배치로 insert 합니다.
     *
     * @param rows insert할 트랙 목록
     * @return insert된 행 수(배치 합계)
     */
    public Mono<Long> insertBatch(List<TrackRow> rows) {
        return chunkedSum(rows, CHUNK, this::insertOnce);
    }

    private Mono<Long> insertOnce(List<TrackRow> rows) {
        if (rows.isEmpty()) return Mono.just(0L);

        String sql = """
            INSERT INTO track (
              track_id, title, artist_id, artist_name, album_id, album_name,
              release_date, duration_ms, popularity, is_explicit, isrc, added_at, source_tag
            ) VALUES
            """ + values(INSERT_PARAMS, rows.size());

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        for (int i = 0; i < rows.size(); i++) {
            TrackRow r = rows.get(i);
            spec = spec.bind("id" + i, r.trackId())
                    .bind("src" + i, r.sourceTag());

            spec = bindOrNull(spec, "t" + i, r.title(), String.class);
            spec = bindOrNull(spec, "aid" + i, r.artistId(), String.class);
            spec = bindOrNull(spec, "an" + i, r.artistName(), String.class);
            spec = bindOrNull(spec, "alid" + i, r.albumId(), String.class);
            spec = bindOrNull(spec, "aln" + i, r.albumName(), String.class);
            spec = bindOrNull(spec, "rd" + i, r.releaseDate(), String.class);
            spec = bindOrNull(spec, "dm" + i, r.durationMs(), Integer.class);
            spec = bindOrNull(spec, "p" + i, r.popularity(), Integer.class);
            spec = bindOrNull(spec, "ex" + i, r.explicit(), Boolean.class);
            spec = bindOrNull(spec, "isrc" + i, r.isrc(), String.class);
            spec = bindOrNull(spec, "at" + i, toUtc(r.addedAt()), LocalDateTime.class);
        }

        return spec.fetch().rowsUpdated();
    }

    /**
     * 소스 태그에 속한 모든 행을 삭제합니다.
     *
     * @param sourceTag 소스 태그
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteBySource(String sourceTag) {
        return db.sql("DELETE FROM track WHERE source_tag = :src")
                .bind("src", sourceTag)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 중복 제거된 트랙 집합을 제목, 아티스트 순으로 조회합니다.
     *
     * @return 식별자마다 하나씩인 트랙 스트림
     */
    public Flux<TrackRow> findDeduplicated() {
        return db.sql(DEDUPLICATED_SQL)
                .map((row, meta) -> toTrackRow(row))
                .all();
    }

    /**
     * 소스 태그에 속한 행을 조회합니다(삽입 순서).
     *
     * @param sourceTag 소스 태그
     * @return 트랙 스트림
     */
    public Flux<TrackRow> findBySource(String sourceTag) {
        return db.sql("""
                SELECT track_id, title, artist_id, artist_name, album_id, album_name,
                       release_date, duration_ms, popularity, is_explicit, isrc, added_at, source_tag
                FROM track
                WHERE source_tag = :src
                ORDER BY row_id
                """)
                .bind("src", sourceTag)
                .map((row, meta) -> toTrackRow(row))
                .all();
    }

    private static TrackRow toTrackRow(Row row) {
        LocalDateTime addedAt = row.get("added_at", LocalDateTime.class);
        return new TrackRow(
                row.get("track_id", String.class),
                row.get("title", String.class),
                row.get("artist_id", String.class),
                row.get("artist_name", String.class),
                row.get("album_id", String.class),
                row.get("album_name", String.class),
                row.get("release_date", String.class),
                row.get("duration_ms", Integer.class),
                row.get("popularity", Integer.class),
                row.get("is_explicit", Boolean.class),
                row.get("isrc", String.class),
                fromUtc(addedAt),
                row.get("source_tag", String.class)
        );
    }
}
