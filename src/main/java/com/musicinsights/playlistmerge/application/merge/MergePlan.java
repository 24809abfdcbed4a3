package com.musicinsights.playlistmerge.application.merge;

import java.util.List;

/**
 * 중복 제거된 트랙을 대상 플레이리스트들에 나눠 담는 계획.
 *
 * @param name  기본 이름
 * @param parts 대상 플레이리스트별 조각(순서 유지)
 */
public record MergePlan(String name, List<Part> parts) {

    public long totalTracks() {
        return parts.stream().mapToLong(p -> p.trackIds().size()).sum();
    }

    /**
     * @param number   1부터 시작하는 조각 번호
     * @param name     생성할 플레이리스트 이름
     * @param trackIds 담을 트랙 ID
     */
    public record Part(int number, String name, List<String> trackIds) {}
}
