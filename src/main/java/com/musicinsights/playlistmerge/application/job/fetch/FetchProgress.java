package com.musicinsights.playlistmerge.application.job.fetch;

import com.musicinsights.playlistmerge.application.job.checkpoint.Checkpoint;
import com.musicinsights.playlistmerge.application.job.retry.RemoteFailure;
import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 한 번의 fetch 실행 동안의 진행 상태(커서 + 버퍼). 순차 실행 전제라 동기화하지 않는다.
 */
final class FetchProgress {
    private final String jobKey;
    private final long total;
    private final List<PlaylistItem> items;
    private long cursor;
    private int pagesThisRun;

    private FetchProgress(String jobKey, long total, long cursor, List<PlaylistItem> items) {
        this.jobKey = jobKey;
        this.total = total;
        this.cursor = cursor;
        this.items = new ArrayList<>(items);
    }

    static FetchProgress start(String jobKey, long total, Checkpoint resumeFrom) {
        if (resumeFrom == null) {
            return new FetchProgress(jobKey, total, 0L, List.of());
        }
        return new FetchProgress(jobKey, total, resumeFrom.cursor(), resumeFrom.items());
    }

    /** 요청한 페이지 크기만큼 커서를 전진시킨다(짧은 마지막 페이지 포함). */
    void advance(List<PlaylistItem> page, int pageSize) {
        items.addAll(page);
        cursor += pageSize;
        pagesThisRun++;
    }

    long cursor() {
        return cursor;
    }

    int pagesThisRun() {
        return pagesThisRun;
    }

    List<PlaylistItem> items() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    Checkpoint snapshot() {
        return Checkpoint.fetchProgress(jobKey, cursor, total, items);
    }

    Checkpoint completed() {
        return Checkpoint.fetchComplete(jobKey, cursor, total, items);
    }

    Checkpoint failed(Throwable e) {
        return Checkpoint.fetchFailed(jobKey, cursor, total, items, RemoteFailure.describe(e));
    }
}
