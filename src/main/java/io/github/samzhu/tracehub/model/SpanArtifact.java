package io.github.samzhu.tracehub.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 附加在 agent span 上、可供機器驗證的產出物
 *
 * @param artifactType 產出物類型
 * @param artifactId 產出物 ID（由 span helper 建立時即為 span ID）
 * @param data 不透明的產出資料，原樣序列化
 * @param timestamp 附加時間
 */
public record SpanArtifact(
    @JsonProperty("artifact_type")
    String artifactType,

    @JsonProperty("artifact_id")
    String artifactId,

    Object data,

    Instant timestamp
) {}
