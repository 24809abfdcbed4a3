package com.musicinsights.playlistmerge.bootstrap;

/**
 * 되돌릴 수 없는 원격 작업 전에 사용자 확인을 받는다.
 */
@FunctionalInterface
public interface Confirmation {

    /**
     * @param question 질문
     * @return 사용자가 동의하면 true
     */
    boolean confirm(String question);
}
