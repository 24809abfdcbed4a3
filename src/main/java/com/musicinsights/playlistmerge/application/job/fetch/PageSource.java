package com.musicinsights.playlistmerge.application.job.fetch;

import com.musicinsights.playlistmerge.application.job.retry.RemoteResult;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistPage;
import reactor.core.publisher.Mono;

/**
 * 원격 컬렉션의 한 페이지를 가져오는 호출.
 */
@FunctionalInterface
public interface PageSource {

    /**
     * {@code offset}부터 최대 {@code limit}개의 아이템을 요청한다.
     *
     * @param offset 시작 위치
     * @param limit  최대 개수
     * @return 페이지 또는 분류된 실패
     */
    Mono<RemoteResult<PlaylistPage>> page(long offset, int limit);
}
