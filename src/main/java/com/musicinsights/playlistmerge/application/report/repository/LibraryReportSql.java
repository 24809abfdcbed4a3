package com.musicinsights.playlistmerge.application.report.repository;

/**
 * 라이브러리 리포트 집계에 사용되는 SQL 상수 모음.
 */
final class LibraryReportSql {
    private LibraryReportSql() {}

    /** 소스별 레코드 수와 고유 트랙 수 */
    static final String SQL_SOURCE_COUNTS = """
        SELECT source_tag                AS sourceTag,
               COUNT(*)                  AS entries,
               COUNT(DISTINCT track_id)  AS uniqueTracks
        FROM track
        GROUP BY source_tag
        ORDER BY source_tag
    """;

    /** 전체 고유 트랙 수(track_id 기준) */
    static final String SQL_COUNT_DISTINCT_TRACKS = """
        SELECT COUNT(DISTINCT track_id) AS total
        FROM track
    """;

    /** 전체 레코드 수 */
    static final String SQL_COUNT_ENTRIES = """
        SELECT COUNT(*) AS total
        FROM track
    """;

    /** 중복 제거 집합 크기(track_id, title, artist_name 식별자 기준) */
    static final String SQL_COUNT_DEDUPLICATED = """
        SELECT COUNT(*) AS total
        FROM (
          SELECT DISTINCT track_id, title, artist_name
          FROM track
        ) ids
    """;

    /** 둘 이상의 소스에 들어 있는 트랙 수 */
    static final String SQL_COUNT_SHARED_TRACKS = """
        SELECT COUNT(*) AS total
        FROM (
          SELECT track_id
          FROM track
          GROUP BY track_id
          HAVING COUNT(DISTINCT source_tag) > 1
        ) shared
    """;

    /** 고유 트랙 수 기준 상위 아티스트 */
    static final String SQL_TOP_ARTISTS = """
        SELECT artist_name              AS artistName,
               COUNT(DISTINCT track_id) AS trackCount
        FROM track
        WHERE artist_name IS NOT NULL
        GROUP BY artist_name
        ORDER BY trackCount DESC, artistName ASC
        LIMIT :limit
    """;
}
