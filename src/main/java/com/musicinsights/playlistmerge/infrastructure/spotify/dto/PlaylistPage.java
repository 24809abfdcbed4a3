package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * {@code GET /playlists/{id}/tracks} 한 페이지 응답.
 *
 * @param items 페이지 아이템(없으면 빈 리스트)
 * @param total 컬렉션 전체 아이템 수
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistPage(
        List<PlaylistItem> items,
        long total
) {
    public PlaylistPage {
        items = (items == null) ? List.of() : items;
    }
}
