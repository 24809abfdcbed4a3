package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** {@code GET /playlists/{id}?fields=name} 응답 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistInfo(String name) {}
