package com.smartpole.core.graph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import com.smartpole.core.lifecycle.LifecycleListener;
import com.smartpole.core.lifecycle.LifecycleState;
import lombok.extern.slf4j.Slf4j;

/**
 * 进入可播放状态时输出一次拓扑快照（DOT）。
 * 配置了目录时写文件，否则只在 debug 日志中输出。快照失败不影响播放。
 */
@Slf4j
public class TopologySnapshotter implements LifecycleListener {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss.SSS");

    private final Graph graph;
    private final Path directory;
    private final String prefix;

    public TopologySnapshotter(Graph graph, Path directory, String prefix) {
        this.graph = graph;
        this.directory = directory;
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public void onStateChanged(LifecycleState oldState, LifecycleState newState) {
        if (newState.isPlayable()) {
            snapshot(oldState.name() + "_" + newState.name());
        }
    }

    /**
     * @return 写出的文件；未配置目录或写入失败时为 empty
     */
    public Optional<Path> snapshot(String transitionName) {
        String dumpName = prefix + transitionName;
        String dot = graph.toDot(dumpName);
        if (directory == null) {
            log.debug("拓扑快照 {}:\n{}", dumpName, dot);
            return Optional.empty();
        }
        Path file = directory.resolve(dumpName + "-" + LocalDateTime.now().format(TIMESTAMP) + ".dot");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, dot, StandardCharsets.UTF_8);
            log.info("拓扑快照已写出: {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("拓扑快照写出失败: {}", file, e);
            return Optional.empty();
        }
    }
}
