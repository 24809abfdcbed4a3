package com.musicinsights.playlistmerge.infrastructure.persistence.r2dbc.row;

import java.time.Instant;

/**
 * canonical store의 트랙 레코드 한 건입니다.
 * <p>
 * 같은 트랙이 여러 소스에 있으면 소스마다 한 행씩 존재합니다.
 *
 * @param trackId     업스트림 트랙 ID
 * @param title       트랙 제목
 * @param artistId    대표(첫 번째) 아티스트 ID
 * @param artistName  대표 아티스트명
 * @param albumId     앨범 ID
 * @param albumName   앨범명
 * @param releaseDate 발매일 원문("1999", "1999-05-01" 등)
 * @param durationMs  재생 시간(밀리초)
 * @param popularity  인기도
 * @param explicit    노골적인 콘텐츠 여부
 * @param isrc        ISRC 코드
 * @param addedAt     소스에 추가된 시각
 * @param sourceTag   레코드를 만든 소스(플레이리스트 ID)
 */
public record TrackRow(
        String trackId,
        String title,
        String artistId,
        String artistName,
        String albumId,
        String albumName,
        String releaseDate,
        Integer durationMs,
        Integer popularity,
        Boolean explicit,
        String isrc,
        Instant addedAt,
        String sourceTag
) {}
