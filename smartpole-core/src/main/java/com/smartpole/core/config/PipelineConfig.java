package com.smartpole.core.config;

import java.nio.file.Path;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartpole.core.graph.GraphDefinition;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 管线会话的配置，对应 pipeline.json。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class PipelineConfig {

    public static final String SNAPSHOT_DIR_PROPERTY = "smartpole.snapshot.dir";

    @JsonProperty("session_name")
    private String sessionName = "cctv";

    /**
     * 进度刷新周期
     */
    @JsonProperty("poll_interval_ms")
    private long pollIntervalMs = 1000L;

    /**
     * 单次时长/位置查询的超时
     */
    @JsonProperty("query_timeout_ms")
    private long queryTimeoutMs = 100L;

    @JsonProperty("event_queue_capacity")
    private int eventQueueCapacity = 1024;

    @JsonProperty("restart_on_eos")
    private boolean restartOnEos = true;

    // 为空时拓扑快照只输出到 debug 日志
    @JsonProperty("snapshot_dir")
    private String snapshotDir;

    @JsonProperty("snapshot_prefix")
    private String snapshotPrefix = "cctv";

    @JsonProperty("graph")
    private GraphDefinition graph;

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public Duration queryTimeout() {
        return Duration.ofMillis(queryTimeoutMs);
    }

    /**
     * 系统属性 smartpole.snapshot.dir 优先于配置文件。
     */
    public Path resolveSnapshotDir() {
        String dir = System.getProperty(SNAPSHOT_DIR_PROPERTY, snapshotDir);
        return dir == null || dir.isBlank() ? null : Path.of(dir);
    }
}
