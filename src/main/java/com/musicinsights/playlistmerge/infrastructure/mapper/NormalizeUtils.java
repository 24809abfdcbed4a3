package com.musicinsights.playlistmerge.infrastructure.mapper;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * 정규화 단계에서 반복적으로 사용하는 문자열/시각 유틸리티입니다.
 */
public final class NormalizeUtils {

    /** Spotify 트랙 URI 접두사 */
    public static final String TRACK_URI_PREFIX = "spotify:track:";

    private NormalizeUtils() {}

    /**
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * ISO-8601 시각 문자열(예: {@code 2021-03-04T05:06:07Z})을 {@link Instant}로 파싱합니다.
     * <p>
     * 빈 값이거나 파싱에 실패하면 null을 반환합니다.
     *
     * @param s 시각 문자열
     * @return 파싱된 Instant 또는 null
     */
    public static Instant parseInstantOrNull(String s) {
        String t = norm(s);
        if (t == null) return null;
        try {
            return Instant.parse(t);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(t).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    /**
     * 트랙 ID를 Spotify URI로 변환합니다. 이미 URI면 그대로 반환합니다.
     *
     * @param trackId 트랙 ID 또는 URI
     * @return {@code spotify:track:<id>}
     */
    public static String toTrackUri(String trackId) {
        String id = norm(trackId);
        if (id == null) {
            throw new IllegalArgumentException("track id is blank");
        }
        return id.startsWith("spotify:") ? id : TRACK_URI_PREFIX + id;
    }
}
