package com.musicinsights.playlistmerge.application.job.checkpoint;

import reactor.core.publisher.Mono;

/**
 * job 키별 체크포인트 저장소.
 * <p>
 * 같은 키에 대해 동시에 두 job이 실행되지 않는다는 전제(single writer per key)에서 동작하며,
 * 별도의 잠금은 제공하지 않습니다.
 */
public interface CheckpointStore {

    /**
     * 체크포인트를 통째로 덮어쓴다(last-write-wins).
     * <p>
     * 프로세스가 중간에 죽어도 읽는 쪽은 이전 값 또는 새 값 중 하나만 보아야 한다.
     *
     * @param checkpoint 저장할 체크포인트(타임스탬프는 저장소가 채운다)
     * @return 저장 완료 신호
     */
    Mono<Void> save(Checkpoint checkpoint);

    /**
     * 체크포인트를 읽는다.
     *
     * @param jobKey job 키
     * @return 체크포인트, 없으면 empty(= 처음부터 시작)
     */
    Mono<Checkpoint> load(String jobKey);
}
