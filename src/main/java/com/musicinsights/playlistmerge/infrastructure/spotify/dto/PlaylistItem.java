package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 플레이리스트의 "한 줄(= 한 트랙 항목)" 원본 DTO입니다.
 * <p>
 * 로컬 파일/삭제된 트랙은 {@code track}이 null이거나 id가 없을 수 있으며,
 * 정규화 단계에서 걸러집니다.
 *
 * @param addedAt 플레이리스트에 추가된 시각(ISO-8601 문자열)
 * @param track   트랙 본문
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistItem(
        @JsonProperty("added_at") String addedAt,
        @JsonProperty("track") TrackPayload track
) {}
