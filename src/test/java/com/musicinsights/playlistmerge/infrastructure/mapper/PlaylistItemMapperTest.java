package com.musicinsights.playlistmerge.infrastructure.mapper;

import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.AlbumRef;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.ArtistRef;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistItem;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.TrackPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("플레이리스트 아이템 매퍼 테스트")
class PlaylistItemMapperTest {

    private final PlaylistItemMapper mapper = new PlaylistItemMapper();

    @Test
    @DisplayName("대표 아티스트, 앨범, isrc, 추가 시각을 매핑")
    void toRows_mapsFields() {
        PlaylistItem item = new PlaylistItem("2021-03-04T05:06:07Z", new TrackPayload(
                " t1 ", "  Song ",
                List.of(new ArtistRef("a1", "First"), new ArtistRef("a2", "Second")),
                new AlbumRef("al1", "Album", "1999-05"),
                215000, 71, null, Map.of("isrc", "USRC1")));

        List<TrackRow> rows = mapper.toRows(List.of(item), "pl-1");

        assertEquals(1, rows.size());
        TrackRow r = rows.get(0);
        assertEquals("t1", r.trackId());
        assertEquals("Song", r.title());
        assertEquals("a1", r.artistId());
        assertEquals("First", r.artistName());
        assertEquals("Album", r.albumName());
        assertEquals("1999-05", r.releaseDate());
        assertEquals(215000, r.durationMs());
        assertEquals(Boolean.FALSE, r.explicit());
        assertEquals("USRC1", r.isrc());
        assertEquals(Instant.parse("2021-03-04T05:06:07Z"), r.addedAt());
        assertEquals("pl-1", r.sourceTag());
    }

    @Test
    @DisplayName("track 또는 track id가 없는 아이템은 버림")
    void toRows_dropsItemsWithoutTrackId() {
        List<PlaylistItem> items = Arrays.asList(
                new PlaylistItem("2021-01-01T00:00:00Z", null),
                new PlaylistItem("2021-01-01T00:00:00Z",
                        new TrackPayload(null, "Local file", List.of(), null, null, null, null, null)),
                null,
                new PlaylistItem(null, new TrackPayload("t2", "Kept", null, null, null, null, true, null))
        );

        List<TrackRow> rows = mapper.toRows(items, "pl-1");

        assertEquals(1, rows.size());
        assertEquals("t2", rows.get(0).trackId());
        assertNull(rows.get(0).artistName());
        assertNull(rows.get(0).addedAt());
        assertTrue(rows.get(0).explicit());
    }

    @Test
    @DisplayName("파싱할 수 없는 추가 시각은 null")
    void toRows_unparseableAddedAt_isNull() {
        PlaylistItem item = new PlaylistItem("yesterday",
                new TrackPayload("t1", "Song", List.of(), null, null, null, false, null));

        assertNull(mapper.toRows(List.of(item), "pl-1").get(0).addedAt());
    }
}
