package io.github.samzhu.tracehub.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Artifact builder 的回傳值
 *
 * <p>{@code artifact_id} 與 {@code timestamp} 由 span helper 與 graph 補上。
 *
 * @param artifactType 產出物類型
 * @param data 產出資料
 */
public record ArtifactPayload(
    @JsonProperty("artifact_type")
    String artifactType,

    Object data
) {}
