package com.musicinsights.playlistmerge.application.report.service;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import com.musicinsights.playlistmerge.application.report.dto.LibraryReport;
import com.musicinsights.playlistmerge.application.report.repository.LibraryReportRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 라이브러리 리포트 서비스 구현체.
 *
 * <p>집계 쿼리들을 병렬로 실행한 뒤 하나의 {@link LibraryReport}로 합친다.</p>
 */
@Service
public class LibraryReportServiceImpl implements LibraryReportService {

    private final LibraryReportRepository reportRepository;

    public LibraryReportServiceImpl(LibraryReportRepository reportRepository) {
        this.reportRepository = reportRepository;
    }

    @Override
    public Mono<LibraryReport> buildReport(int topArtists) {
        if (topArtists < 0) {
            return Mono.error(new JobInputException("topArtists must be >= 0", "INPUT_ERROR"));
        }

        return Mono.zip(
                reportRepository.findSourceStats().collectList(),
                reportRepository.countEntries(),
                reportRepository.countDistinctTracks(),
                reportRepository.countDeduplicated(),
                reportRepository.countSharedTracks(),
                topArtists == 0
                        ? Mono.just(List.<LibraryReport.ArtistCount>of())
                        : reportRepository.findTopArtists(topArtists).collectList()
        ).map(t -> new LibraryReport(t.getT1(), t.getT2(), t.getT3(), t.getT4(), t.getT5(), t.getT6()));
    }
}
