package com.musicinsights.playlistmerge.application.job.checkpoint;

/**
 * job 종류 + 대상 식별자로 결정적인 체크포인트 키를 만든다.
 */
public final class JobKeys {
    private JobKeys() {}

    public static String fetch(String playlistId) {
        return "fetch:" + playlistId;
    }

    public static String write(String playlistId) {
        return "write:" + playlistId;
    }

    /**
     * 병합 결과 플레이리스트 생성 job 키.
     *
     * @param mergeName 병합 플레이리스트 이름
     * @param part      1부터 시작하는 파트 번호
     * @return job 키
     */
    public static String create(String mergeName, int part) {
        return "create:" + mergeName + "#" + part;
    }
}
