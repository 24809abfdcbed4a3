package com.musicinsights.playlistmerge.config;

import com.musicinsights.playlistmerge.application.job.checkpoint.CheckpointStore;
import com.musicinsights.playlistmerge.application.job.fetch.PaginatedFetcher;
import com.musicinsights.playlistmerge.application.job.retry.BackoffSleeper;
import com.musicinsights.playlistmerge.application.job.retry.RetryPolicy;
import com.musicinsights.playlistmerge.application.job.write.BatchedWriter;
import com.musicinsights.playlistmerge.infrastructure.checkpoint.FileCheckpointStore;
import com.musicinsights.playlistmerge.infrastructure.spotify.SpotifyApiClient;
import com.musicinsights.playlistmerge.infrastructure.spotify.SpotifyFailureClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import tools.jackson.databind.json.JsonMapper;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 재개 가능한 job 구성 요소(체크포인트, 재시도, fetcher, writer)와 Spotify 어댑터를 등록한다.
 */
@Configuration
public class JobConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.delaying();
    }

    @Bean
    public RetryPolicy retryPolicy(PlaylistMergeProperties props, BackoffSleeper sleeper) {
        return new RetryPolicy(props.retry().maxAttempts(), sleeper);
    }

    @Bean
    public CheckpointStore checkpointStore(PlaylistMergeProperties props, Clock clock) {
        return new FileCheckpointStore(Path.of(props.checkpoint().dir()), JsonMapper.builder().build(), clock);
    }

    @Bean
    public PaginatedFetcher paginatedFetcher(CheckpointStore checkpoints, RetryPolicy retryPolicy,
                                             PlaylistMergeProperties props) {
        return new PaginatedFetcher(checkpoints, retryPolicy, props.fetch().checkpointEveryPages());
    }

    @Bean
    public BatchedWriter batchedWriter(CheckpointStore checkpoints, RetryPolicy retryPolicy,
                                       BackoffSleeper sleeper, PlaylistMergeProperties props) {
        return new BatchedWriter(checkpoints, retryPolicy, sleeper, props.write().interBatchDelay());
    }

    @Bean
    public SpotifyApiClient spotifyApiClient(PlaylistMergeProperties props) {
        PlaylistMergeProperties.Spotify spotify = props.spotify();
        WebClient.Builder b = WebClient.builder().baseUrl(spotify.baseUrl());
        if (spotify.hasAccessToken()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + spotify.accessToken().trim());
        }
        return new SpotifyApiClient(
                b.build(),
                new SpotifyFailureClassifier(props.retry().defaultRetryAfter()),
                spotify.timeout(),
                spotify.hasAccessToken()
        );
    }
}
