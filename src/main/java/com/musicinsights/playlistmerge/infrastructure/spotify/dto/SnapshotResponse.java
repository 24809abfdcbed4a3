package com.musicinsights.playlistmerge.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** 플레이리스트 변경 호출 응답 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotResponse(@JsonProperty("snapshot_id") String snapshotId) {}
