package com.musicinsights.playlistmerge.application.job.checkpoint;

import com.musicinsights.playlistmerge.infrastructure.spotify.dto.PlaylistItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 하나의 job(fetch / write / create)에 대한 재개 가능한 진행 표시입니다.
 *
 * @param jobKey    {@link JobKeys}로 만든 결정적 키
 * @param cursor    진행 커서(fetch: 다음 offset, write: 이미 쓴 id 수). 감소하지 않는다
 * @param total     fetch job이 최초 실행 때 probe한 전체 아이템 수(그 외 null)
 * @param complete  최종 성공 여부
 * @param error     마지막 실패 메시지(없으면 null)
 * @param timestamp 저장 시각
 * @param items     fetch job이 지금까지 받은 원본 아이템 버퍼
 * @param ref       job이 생성한 원격 리소스 ID(create job 전용)
 */
public record Checkpoint(
        String jobKey,
        long cursor,
        Long total,
        boolean complete,
        String error,
        Instant timestamp,
        List<PlaylistItem> items,
        String ref
) {
    public Checkpoint {
        items = (items == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static Checkpoint fetchProgress(String jobKey, long cursor, Long total, List<PlaylistItem> items) {
        return new Checkpoint(jobKey, cursor, total, false, null, null, items, null);
    }

    public static Checkpoint fetchComplete(String jobKey, long cursor, Long total, List<PlaylistItem> items) {
        return new Checkpoint(jobKey, cursor, total, true, null, null, items, null);
    }

    public static Checkpoint fetchFailed(String jobKey, long cursor, Long total, List<PlaylistItem> items, String error) {
        return new Checkpoint(jobKey, cursor, total, false, error, null, items, null);
    }

    public static Checkpoint writeProgress(String jobKey, long written) {
        return new Checkpoint(jobKey, written, null, false, null, null, List.of(), null);
    }

    public static Checkpoint writeComplete(String jobKey, long written) {
        return new Checkpoint(jobKey, written, null, true, null, null, List.of(), null);
    }

    public static Checkpoint writeFailed(String jobKey, long written, String error) {
        return new Checkpoint(jobKey, written, null, false, error, null, List.of(), null);
    }

    /** 원격 리소스 생성이 끝났음을 기록한다. */
    public static Checkpoint created(String jobKey, String ref) {
        return new Checkpoint(jobKey, 1, null, true, null, null, List.of(), ref);
    }

    public Checkpoint withTimestamp(Instant at) {
        return new Checkpoint(jobKey, cursor, total, complete, error, at, items, ref);
    }
}
