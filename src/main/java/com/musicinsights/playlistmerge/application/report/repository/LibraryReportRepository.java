package com.musicinsights.playlistmerge.application.report.repository;

import com.musicinsights.playlistmerge.application.report.dto.LibraryReport;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static com.musicinsights.playlistmerge.application.report.repository.LibraryReportSql.*;

@Component
public class LibraryReportRepository {
    private final DatabaseClient db;

    public LibraryReportRepository(DatabaseClient db) {
        this.db = db;
    }

    public Flux<LibraryReport.SourceStats> findSourceStats() {
        return db.sql(SQL_SOURCE_COUNTS)
                .map((row, meta) -> new LibraryReport.SourceStats(
                        row.get("sourceTag", String.class),
                        row.get("entries", Number.class).longValue(),
                        row.get("uniqueTracks", Number.class).longValue()
                )).all();
    }

    public Mono<Long> countEntries() {
        return count(SQL_COUNT_ENTRIES);
    }

    public Mono<Long> countDistinctTracks() {
        return count(SQL_COUNT_DISTINCT_TRACKS);
    }

    public Mono<Long> countDeduplicated() {
        return count(SQL_COUNT_DEDUPLICATED);
    }

    public Mono<Long> countSharedTracks() {
        return count(SQL_COUNT_SHARED_TRACKS);
    }

    public Flux<LibraryReport.ArtistCount> findTopArtists(int limit) {
        return db.sql(SQL_TOP_ARTISTS)
                .bind("limit", limit)
                .map((row, meta) -> new LibraryReport.ArtistCount(
                        row.get("artistName", String.class),
                        row.get("trackCount", Number.class).longValue()
                )).all();
    }

    private Mono<Long> count(String sql) {
        return db.sql(sql).map((row, meta) -> {
            Number n = row.get("total", Number.class);
            return (n == null) ? 0L : n.longValue();
        }).one().defaultIfEmpty(0L);
    }
}
