package com.musicinsights.playlistmerge.application.ingest;

import java.util.List;

/**
 * ingest 실행 결과 요약.
 *
 * @param ingested 성공한 플레이리스트별 적재 결과
 * @param failures 실패한 플레이리스트별 원인
 */
public record IngestSummary(
        List<Ingested> ingested,
        List<Failure> failures
) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public long totalTracks() {
        return ingested.stream().mapToLong(Ingested::tracks).sum();
    }

    /**
     * @param playlistId 플레이리스트 ID(= 소스 태그)
     * @param name       플레이리스트 이름
     * @param items      받은 원본 아이템 수
     * @param tracks     저장된 트랙 레코드 수
     */
    public record Ingested(String playlistId, String name, int items, long tracks) {}

    public record Failure(String playlistId, String message) {}
}
