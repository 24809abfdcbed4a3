package com.musicinsights.playlistmerge.application.report.service;

import com.musicinsights.playlistmerge.application.report.dto.LibraryReport;
import reactor.core.publisher.Mono;

/**
 * canonical store 요약 리포트 서비스
 */
public interface LibraryReportService {

    /**
     * 소스별 집계, 중복 현황, 상위 아티스트를 조회한다.
     *
     * @param topArtists 상위 아티스트 개수
     * @return 리포트
     */
    Mono<LibraryReport> buildReport(int topArtists);
}
