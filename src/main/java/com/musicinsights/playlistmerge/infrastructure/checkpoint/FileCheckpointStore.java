package com.musicinsights.playlistmerge.infrastructure.checkpoint;

import com.musicinsights.playlistmerge.application.job.checkpoint.Checkpoint;
import com.musicinsights.playlistmerge.application.job.checkpoint.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * job 키마다 JSON 파일 하나로 체크포인트를 보관하는 저장소입니다.
 * <p>
 * 저장은 같은 디렉터리의 임시 파일에 쓰고 fsync 한 뒤 {@link StandardCopyOption#ATOMIC_MOVE}로
 * 대상 파일을 교체합니다. 따라서 읽는 쪽은 이전 체크포인트 또는 새 체크포인트만 보게 됩니다.
 * <p>
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    /** 파일명 접두어 최대 길이 */
    static final int MAX_PREFIX = 80;

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileCheckpointStore(Path directory, ObjectMapper mapper, Clock clock) {
        this.directory = directory;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public Mono<Void> save(Checkpoint checkpoint) {
        return Mono.fromCallable(() -> {
                    writeAtomically(checkpoint.withTimestamp(clock.instant()));
                    return checkpoint.jobKey();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Checkpoint> load(String jobKey) {
        return Mono.fromCallable(() -> read(jobKey))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * job 키에 대응하는 체크포인트 파일 경로.
     * <p>
     * 파일명은 읽기 쉬운 접두어(파일명에 쓸 수 없는 문자를 {@code _}로 치환, 최대 {@value #MAX_PREFIX}자)와
     * 원래 키의 SHA-256 hex로 구성한다(예: {@code fetch:abc} → {@code fetch_abc-<sha256>.json}).
     * 치환 결과가 같은 서로 다른 키도 해시가 달라 다른 파일을 쓴다.
     *
     * @param jobKey job 키
     * @return 파일 경로
     */
    public Path pathFor(String jobKey) {
        String prefix = jobKey.replaceAll("[^A-Za-z0-9._-]", "_");
        if (prefix.length() > MAX_PREFIX) {
            prefix = prefix.substring(0, MAX_PREFIX);
        }
        return directory.resolve(prefix + "-" + sha256Hex(jobKey) + ".json");
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void writeAtomically(Checkpoint checkpoint) throws IOException {
        Files.createDirectories(directory);
        Path target = pathFor(checkpoint.jobKey());
        byte[] json = mapper.writeValueAsBytes(checkpoint);

        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        log.debug("Checkpoint saved: {} cursor={} complete={}",
                checkpoint.jobKey(), checkpoint.cursor(), checkpoint.complete());
    }

    private Checkpoint read(String jobKey) throws IOException {
        Path file = pathFor(jobKey);
        if (!Files.exists(file)) {
            return null;
        }
        Checkpoint checkpoint;
        try {
            checkpoint = mapper.readValue(Files.readAllBytes(file), Checkpoint.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("Corrupt checkpoint file: " + file, e);
        }
        if (!jobKey.equals(checkpoint.jobKey())) {
            throw new IllegalStateException("Checkpoint file " + file + " belongs to job '"
                    + checkpoint.jobKey() + "', not '" + jobKey + "'");
        }
        return checkpoint;
    }
}
