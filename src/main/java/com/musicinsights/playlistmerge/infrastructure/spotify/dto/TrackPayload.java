package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Spotify track 객체 중 적재에 필요한 필드만 매핑한 DTO.
 *
 * @param id          트랙 ID
 * @param name        트랙 제목
 * @param artists     참여 아티스트(첫 번째가 대표 아티스트)
 * @param album       수록 앨범
 * @param durationMs  재생 시간(밀리초)
 * @param popularity  인기도(0~100)
 * @param explicit    노골적인 콘텐츠 여부
 * @param externalIds 외부 식별자(예: {@code isrc})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackPayload(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("artists") List<ArtistRef> artists,
        @JsonProperty("album") AlbumRef album,
        @JsonProperty("duration_ms") Integer durationMs,
        @JsonProperty("popularity") Integer popularity,
        @JsonProperty("explicit") Boolean explicit,
        @JsonProperty("external_ids") Map<String, String> externalIds
) {}
