package com.musicinsights.playlistmerge.infrastructure.mapper;

import com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row.TrackRow;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.AlbumRef;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.ArtistRef;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistItem;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.TrackPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.musicinsights.playlistmerge.infrastructure.mapper.NormalizeUtils.*;

/**
 * 플레이리스트 원본 아이템을 canonical store 입력용 {@link TrackRow}로 변환한다.
 * <p>
 * track이 없거나 track id가 없는 아이템(로컬 파일, 삭제된 트랙)은 버린다.
 */
@Component
public class PlaylistItemMapper {

    private static final Logger log = LoggerFactory.getLogger(PlaylistItemMapper.class);

    /**
     * @param items     원본 아이템(순서 유지)
     * @param sourceTag 레코드에 붙일 소스 태그
     * @return 변환된 레코드
     */
    public List<TrackRow> toRows(List<PlaylistItem> items, String sourceTag) {
        List<TrackRow> out = new ArrayList<>(items.size());
        int dropped = 0;

        for (PlaylistItem item : items) {
            TrackRow row = toRow(item, sourceTag);
            if (row == null) {
                dropped++;
            } else {
                out.add(row);
            }
        }

        if (dropped > 0) {
            log.debug("Dropped {} items without a track id from {}", dropped, sourceTag);
        }
        return out;
    }

    /**
     * 아이템 하나를 변환한다.
     *
     * @return 변환 결과, track id가 없으면 null
     */
    TrackRow toRow(PlaylistItem item, String sourceTag) {
        if (item == null || item.track() == null) return null;
        TrackPayload t = item.track();
        String trackId = norm(t.id());
        if (trackId == null) return null;

        ArtistRef primary = (t.artists() == null || t.artists().isEmpty()) ? null : t.artists().get(0);
        AlbumRef album = t.album();
        Map<String, String> externalIds = t.externalIds();

        return new TrackRow(
                trackId,
                norm(t.name()),
                primary == null ? null : norm(primary.id()),
                primary == null ? null : norm(primary.name()),
                album == null ? null : norm(album.id()),
                album == null ? null : norm(album.name()),
                album == null ? null : norm(album.releaseDate()),
                t.durationMs(),
                t.popularity(),
                Boolean.TRUE.equals(t.explicit()),
                externalIds == null ? null : norm(externalIds.get("isrc")),
                parseInstantOrNull(item.addedAt()),
                sourceTag
        );
    }
}
