package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param id          앨범 ID
 * @param name        앨범명
 * @param releaseDate 발매일(연도만 있을 수 있음: "1999", "1999-05", "1999-05-01")
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlbumRef(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("release_date") String releaseDate
) {}
