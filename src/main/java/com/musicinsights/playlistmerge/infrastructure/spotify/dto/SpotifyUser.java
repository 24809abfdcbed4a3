package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code GET /me} 응답 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyUser(
        @JsonProperty("id") String id,
        @JsonProperty("display_name") String displayName
) {}
