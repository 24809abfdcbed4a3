package com.musicinsights.playlistmerge.application.job.write;

import java.util.ArrayList;
import java.util.List;

/**
 * 리스트를 순서를 유지한 고정 크기 조각으로 나눈다.
 */
public final class Partitions {

    private Partitions() {}

    /**
     * @param list 원본 리스트
     * @param size 조각 크기(1 이상)
     * @return 마지막 조각만 size보다 작을 수 있는 부분 리스트 목록
     */
    public static <T> List<List<T>> of(List<T> list, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1: " + size);
        }
        List<List<T>> out = new ArrayList<>((list.size() + size - 1) / size);
        for (int i = 0; i < list.size(); i += size) {
            out.add(List.copyOf(list.subList(i, Math.min(i + size, list.size()))));
        }
        return out;
    }
}
