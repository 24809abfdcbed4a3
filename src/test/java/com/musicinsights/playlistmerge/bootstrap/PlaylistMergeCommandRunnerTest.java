package com.musicinsights.playlistmerge.bootstrap;

import com.musicinsights.playlistmerge.application.ingest.IngestFailedException;
import com.musicinsights.playlistmerge.application.ingest.IngestSummary;
import com.musicinsights.playlistmerge.application.ingest.PlaylistIngestService;
import com.musicinsights.playlistmerge.application.merge.MergeAndWriteService;
import com.musicinsights.playlistmerge.application.merge.MergePlan;
import com.musicinsights.playlistmerge.application.merge.MergedPlaylist;
import com.musicinsights.playlistmerge.application.report.dto.LibraryReport;
import com.musicinsights.playlistmerge.application.report.service.LibraryReportService;
import com.musicinsights.playlistmerge.config.TestProperties;
import com.musicinsights.playlistmerge.infrastructure.input.text.PlaylistIdFileReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * {@link PlaylistMergeCommandRunner} 단위 테스트.
 *
 * <p>명령 분기, 확인 절차, 실패 시 종료 코드 1을 검증한다.</p>
 */
@DisplayName("CLI 명령 러너 테스트")
class PlaylistMergeCommandRunnerTest {

    PlaylistIngestService ingestService;
    LibraryReportService reportService;
    MergeAndWriteService mergeService;
    Confirmation confirmation;
    PlaylistMergeCommandRunner runner;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        ingestService = mock(PlaylistIngestService.class);
        reportService = mock(LibraryReportService.class);
        mergeService = mock(MergeAndWriteService.class);
        confirmation = mock(Confirmation.class);
        runner = new PlaylistMergeCommandRunner(ingestService, new PlaylistIdFileReader(), reportService,
                mergeService, confirmation, TestProperties.defaults());
    }

    private void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    private static MergePlan plan() {
        return new MergePlan("Mix", List.of(new MergePlan.Part(1, "Mix", List.of("t1", "t2"))));
    }

    @Test
    @DisplayName("인자가 없으면 사용법 오류로 종료 코드 1")
    void noCommand_exitsOne() {
        run();

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("알 수 없는 명령은 종료 코드 1")
    void unknownCommand_exitsOne() {
        run("explode");

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("ingest: 파일의 ID 목록으로 ingest 호출, 성공 시 종료 코드 0")
    void ingest_readsFile() throws Exception {
        Path file = dir.resolve("ids.txt");
        Files.writeString(file, "p1\n# skip\np2\n");
        when(ingestService.ingestAll(List.of("p1", "p2")))
                .thenReturn(Mono.just(new IngestSummary(List.of(), List.of())));

        run("ingest", file.toString());

        verify(ingestService).ingestAll(List.of("p1", "p2"));
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("ingest 실패는 종료 코드 1")
    void ingest_failure_exitsOne() throws Exception {
        Path file = dir.resolve("ids.txt");
        Files.writeString(file, "p1\n");
        IngestSummary summary = new IngestSummary(List.of(), List.of(new IngestSummary.Failure("p1", "HTTP 404")));
        when(ingestService.ingestAll(anyList())).thenReturn(Mono.error(new IngestFailedException(summary)));

        run("ingest", file.toString());

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("ingest 파일이 없으면 종료 코드 1")
    void ingest_missingFile_exitsOne() {
        run("ingest", dir.resolve("missing.txt").toString());

        assertThat(runner.getExitCode()).isEqualTo(1);
        verifyNoInteractions(ingestService);
    }

    @Test
    @DisplayName("report: 설정된 상위 아티스트 수로 리포트 조회")
    void report_usesConfiguredTopArtists() {
        when(reportService.buildReport(20)).thenReturn(Mono.just(
                new LibraryReport(List.of(), 0, 0, 0, 0, List.of())));

        run("report");

        verify(reportService).buildReport(20);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("merge-and-write: 확인을 거절하면 원격 작업을 하지 않음")
    void merge_declined_doesNothing() {
        when(mergeService.plan("Mix")).thenReturn(Mono.just(plan()));
        when(confirmation.confirm(anyString())).thenReturn(false);

        run("merge-and-write", "Mix");

        verify(mergeService, never()).execute(any());
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("merge-and-write --yes: 확인 없이 실행")
    void merge_yes_skipsConfirmation() {
        when(mergeService.plan("Mix")).thenReturn(Mono.just(plan()));
        when(mergeService.execute(any())).thenReturn(Mono.just(List.of(new MergedPlaylist("Mix", "pl-1", 2))));

        run("merge-and-write", "Mix", "--yes");

        verifyNoInteractions(confirmation);
        verify(mergeService).execute(plan());
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("merge-and-write -y 도 --yes와 같고 이름 인자로 취급하지 않음")
    void merge_shortYes() {
        when(mergeService.plan(null)).thenReturn(Mono.just(plan()));
        when(mergeService.execute(any())).thenReturn(Mono.just(List.of()));

        run("merge-and-write", "-y");

        verify(mergeService).plan(null);
        verifyNoInteractions(confirmation);
    }

    @Test
    @DisplayName("merge-and-write 실행 실패는 종료 코드 1")
    void merge_failure_exitsOne() {
        when(mergeService.plan(any())).thenReturn(Mono.just(plan()));
        when(mergeService.execute(any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        run("merge-and-write", "--yes");

        assertThat(runner.getExitCode()).isEqualTo(1);
    }
}
