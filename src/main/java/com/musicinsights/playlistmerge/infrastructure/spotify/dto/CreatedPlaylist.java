package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** 새로 생성된 플레이리스트 응답 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreatedPlaylist(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("external_urls") Map<String, String> externalUrls
) {}
