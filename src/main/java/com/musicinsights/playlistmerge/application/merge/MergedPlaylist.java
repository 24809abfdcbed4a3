package com.musicinsights.playlistmerge.application.merge;

/**
 * 생성(또는 재사용)되어 트랙이 채워진 대상 플레이리스트.
 *
 * @param name   플레이리스트 이름
 * @param id     플레이리스트 ID
 * @param tracks 추가된 트랙 수
 */
public record MergedPlaylist(String name, String id, long tracks) {

    public String url() {
        return "https://open.spotify.com/playlist/" + id;
    }
}
