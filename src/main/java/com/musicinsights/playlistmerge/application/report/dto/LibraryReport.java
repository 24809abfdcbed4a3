package com.musicinsights.playlistmerge.application.report.dto;

import java.util.List;

/**
 * canonical store 전체에 대한 요약 리포트.
 *
 * @param sources           소스별 집계
 * @param totalEntries      전체 레코드 수
 * @param uniqueTracks      전체 고유 트랙 수(track_id 기준)
 * @param deduplicated      중복 제거 집합 크기
 * @param sharedTracks      둘 이상의 소스에 있는 트랙 수
 * @param topArtists        고유 트랙 수 기준 상위 아티스트
 */
public record LibraryReport(
        List<SourceStats> sources,
        long totalEntries,
        long uniqueTracks,
        long deduplicated,
        long sharedTracks,
        List<ArtistCount> topArtists
) {

    /** 중복 제거로 빠지는 레코드 수 */
    public long duplicatesRemoved() {
        return totalEntries - deduplicated;
    }

    public record SourceStats(String sourceTag, long entries, long uniqueTracks) {}

    public record ArtistCount(String artistName, long trackCount) {}
}
