package com.smartpole.core.graph;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import com.smartpole.core.lifecycle.LifecycleState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class TopologySnapshotterTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("进入可播放状态时写出 DOT 文件")
    void testSnapshotOnPlayable() throws Exception {
        Graph graph = new Graph("snap");
        graph.addNode(NodeSpec.of("src", "videotestsrc"));
        TopologySnapshotter snapshotter = new TopologySnapshotter(graph, dir, "cctv");

        snapshotter.onStateChanged(LifecycleState.NULL, LifecycleState.READY);
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(0, files.count());
        }

        snapshotter.onStateChanged(LifecycleState.READY, LifecycleState.PAUSED);
        try (Stream<Path> files = Files.list(dir)) {
            Path file = files.findFirst().orElseThrow();
            assertTrue(file.getFileName().toString().startsWith("cctvREADY_PAUSED-"));
            assertTrue(file.getFileName().toString().endsWith(".dot"));
            assertTrue(Files.readString(file).contains("\"src\""));
        }
    }

    @Test
    @DisplayName("未配置目录时不写文件")
    void testNoDirectory() {
        TopologySnapshotter snapshotter = new TopologySnapshotter(new Graph("snap"), null, "cctv");

        Optional<Path> written = snapshotter.snapshot("PAUSED_PLAYING");

        assertTrue(written.isEmpty());
    }
}
