package com.musicinsights.playlistmerge.infrastructure.input.text;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * 플레이리스트 ID 목록 파일(한 줄에 하나)을 읽는 리더입니다.
 * <p>
 * 빈 줄과 {@code #}으로 시작하는 주석 줄은 건너뜁니다.
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class PlaylistIdFileReader {

    private static final Logger log = LoggerFactory.getLogger(PlaylistIdFileReader.class);

    /**
     * @param file ID 목록 파일
     * @return 파일 순서대로의 플레이리스트 ID
     */
    public Flux<String> readIds(Path file) {
        return Flux.using(
                        () -> open(file),
                        br -> Flux.fromStream(br.lines()),
                        br -> {
                            try {
                                br.close();
                            } catch (IOException e) {
                                log.warn("Failed to close {}: {}", file, e.getMessage());
                            }
                        }
                )
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static BufferedReader open(Path file) throws IOException {
        try {
            return Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new JobInputException("Playlist file not found: " + file, "FILE_NOT_FOUND");
        }
    }
}
