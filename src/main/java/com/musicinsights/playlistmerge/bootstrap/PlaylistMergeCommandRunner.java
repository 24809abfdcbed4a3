package com.musicinsights.playlistmerge.bootstrap;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import com.musicinsights.playlistmerge.application.ingest.IngestSummary;
import com.musicinsights.playlistmerge.application.ingest.PlaylistIngestService;
import com.musicinsights.playlistmerge.application.merge.MergeAndWriteService;
import com.musicinsights.playlistmerge.application.merge.MergePlan;
import com.musicinsights.playlistmerge.application.merge.MergedPlaylist;
import com.musicinsights.playlistmerge.application.report.dto.LibraryReport;
import com.musicinsights.playlistmerge.application.report.service.LibraryReportService;
import com.musicinsights.playlistmerge.config.PlaylistMergeProperties;
import com.musicinsights.playlistmerge.infrastructure.input.text.PlaylistIdFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * 커맨드라인 명령을 실행하는 {@link ApplicationRunner}.
 *
 * <p>Profile이 {@code cli}일 때만 활성화된다.</p>
 * <ul>
 *     <li>{@code ingest <playlists-file>}: 플레이리스트를 읽어 canonical store에 적재</li>
 *     <li>{@code report}: 소스/중복 현황 출력</li>
 *     <li>{@code merge-and-write [name] [--yes]}: 중복 제거 결과를 새 플레이리스트로 내보내기</li>
 * </ul>
 * 모든 실패는 여기서 로그로 남기고 종료 코드 1로 바꾼다.
 */
@Component
@Profile("cli")
public class PlaylistMergeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlaylistMergeCommandRunner.class);

    static final String USAGE = "Usage: playlist-merge <ingest <playlists-file> | report | merge-and-write [name] [--yes]>";

    private final PlaylistIngestService ingestService;
    private final PlaylistIdFileReader idFileReader;
    private final LibraryReportService reportService;
    private final MergeAndWriteService mergeService;
    private final Confirmation confirmation;
    private final int topArtists;

    private int exitCode = 0;

    public PlaylistMergeCommandRunner(
            PlaylistIngestService ingestService,
            PlaylistIdFileReader idFileReader,
            LibraryReportService reportService,
            MergeAndWriteService mergeService,
            Confirmation confirmation,
            PlaylistMergeProperties props
    ) {
        this.ingestService = ingestService;
        this.idFileReader = idFileReader;
        this.reportService = reportService;
        this.mergeService = mergeService;
        this.confirmation = confirmation;
        this.topArtists = props.report().topArtists();
    }

    /**
     * 명령을 실행하고 완료될 때까지 {@code block()}으로 대기한다.
     *
     * @param args 커맨드라인 인자
     */
    @Override
    public void run(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs().stream()
                .filter(a -> !a.equals("-y"))
                .toList();
        boolean yes = args.containsOption("yes") || args.getNonOptionArgs().contains("-y");

        try {
            if (words.isEmpty()) {
                throw new JobInputException(USAGE, "INPUT_ERROR");
            }
            switch (words.get(0)) {
                case "ingest" -> ingest(words);
                case "report" -> report();
                case "merge-and-write" -> mergeAndWrite(words.size() > 1 ? words.get(1) : null, yes);
                default -> throw new JobInputException("Unknown command '" + words.get(0) + "'. " + USAGE, "INPUT_ERROR");
            }
        } catch (JobInputException e) {
            log.error("{} ({})", e.getMessage(), e.code());
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Command failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void ingest(List<String> words) {
        if (words.size() < 2) {
            throw new JobInputException("ingest requires a playlists file. " + USAGE, "INPUT_ERROR");
        }
        List<String> ids = idFileReader.readIds(Path.of(words.get(1))).collectList().block();
        if (ids == null || ids.isEmpty()) {
            throw new JobInputException("No playlist ids in " + words.get(1), "INPUT_ERROR");
        }

        IngestSummary summary = ingestService.ingestAll(ids).block();
        if (summary != null) {
            summary.ingested().forEach(p ->
                    log.info("  {} ({}): {} items, {} tracks", p.name(), p.playlistId(), p.items(), p.tracks()));
        }
    }

    private void report() {
        LibraryReport r = reportService.buildReport(topArtists).block();
        if (r == null) return;

        log.info("Sources: {}", r.sources().size());
        r.sources().forEach(s -> log.info("  {}: {} entries, {} unique", s.sourceTag(), s.entries(), s.uniqueTracks()));
        log.info("Total entries: {}", r.totalEntries());
        log.info("Unique tracks: {}", r.uniqueTracks());
        log.info("After deduplication: {} ({} duplicates removed)", r.deduplicated(), r.duplicatesRemoved());
        log.info("Tracks in more than one source: {}", r.sharedTracks());
        r.topArtists().forEach(a -> log.info("  {}: {}", a.artistName(), a.trackCount()));
    }

    private void mergeAndWrite(String name, boolean yes) {
        MergePlan plan = mergeService.plan(name).block();
        if (plan == null || plan.parts().isEmpty()) {
            throw new JobInputException("No tracks in the canonical store; run ingest first", "INPUT_ERROR");
        }

        log.info("{} unique tracks into {} new playlist(s) named '{}'",
                plan.totalTracks(), plan.parts().size(), plan.name());
        if (!yes && !confirmation.confirm("Create " + plan.parts().size() + " playlist(s)?")) {
            log.info("Cancelled");
            return;
        }

        List<MergedPlaylist> created = mergeService.execute(plan).block();
        if (created != null) {
            created.forEach(p -> log.info("  {}: {} tracks, {}", p.name(), p.tracks(), p.url()));
        }
    }
}
