package com.musicinsights.playlistmerge.infrastructure.input.text;

import com.musicinsights.playlistmerge.application.common.error.JobInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("플레이리스트 ID 파일 리더 테스트")
class PlaylistIdFileReaderTest {

    private final PlaylistIdFileReader reader = new PlaylistIdFileReader();

    @TempDir
    Path dir;

    @Test
    @DisplayName("빈 줄과 주석을 건너뛰고 순서대로 ID를 읽음")
    void readIds_skipsBlankAndComments() throws Exception {
        Path file = dir.resolve("playlists.txt");
        Files.writeString(file, """
                # my playlists
                37i9dQZF1DXcBWIGoYBM5M

                  1A2B3C  
                # 4D5E6F
                """);

        StepVerifier.create(reader.readIds(file))
                .expectNext("37i9dQZF1DXcBWIGoYBM5M", "1A2B3C")
                .verifyComplete();
    }

    @Test
    @DisplayName("파일이 없으면 FILE_NOT_FOUND 입력 오류")
    void readIds_missingFile() {
        StepVerifier.create(reader.readIds(dir.resolve("nope.txt")))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(JobInputException.class);
                    assertThat(((JobInputException) e).code()).isEqualTo("FILE_NOT_FOUND");
                })
                .verify();
    }
}
