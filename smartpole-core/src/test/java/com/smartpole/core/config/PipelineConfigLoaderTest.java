package com.smartpole.core.config;

import java.nio.file.Files;
import java.nio.file.Path;

import com.smartpole.core.exception.ConfigurationException;
import com.smartpole.core.graph.Graph;
import com.smartpole.core.graph.GraphLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigLoaderTest {

    @TempDir
    Path dir;

    @AfterEach
    void tearDown() {
        System.clearProperty(PipelineConfig.SNAPSHOT_DIR_PROPERTY);
    }

    @Test
    @DisplayName("默认配置描述摄像头管线")
    void testDefaultConfig() {
        PipelineConfig config = PipelineConfigLoader.loadDefault();

        assertEquals("cctv", config.getSessionName());
        assertEquals(1000L, config.getPollIntervalMs());
        assertEquals(100L, config.getQueryTimeoutMs());
        assertTrue(config.isRestartOnEos());

        Graph graph = GraphLoader.build(config.getGraph());
        assertEquals(9, graph.getNodes().size());
        assertEquals(7, graph.getLinks().size());
        assertEquals(1, graph.getDeferredLinks().size());
        assertEquals("rtsp://10.178.134.100:8554/test", graph.requireNode("src").getParameters().get("location"));
    }

    @Test
    @DisplayName("未指定的字段使用默认值")
    void testDefaultsApplied() {
        PipelineConfig config = PipelineConfigLoader.parse("""
                { "graph": { "nodes": [ { "name": "a", "kind": "videotestsrc" } ] } }
                """);

        assertEquals(1024, config.getEventQueueCapacity());
        assertEquals("cctv", config.getSnapshotPrefix());
        assertNull(config.resolveSnapshotDir());
    }

    @Test
    @DisplayName("系统属性优先于配置中的快照目录")
    void testSnapshotDirOverride() {
        PipelineConfig config = new PipelineConfig().setSnapshotDir("/var/tmp/dot");
        assertEquals(Path.of("/var/tmp/dot"), config.resolveSnapshotDir());

        System.setProperty(PipelineConfig.SNAPSHOT_DIR_PROPERTY, dir.toString());
        assertEquals(dir, config.resolveSnapshotDir());
    }

    @Test
    @DisplayName("从文件加载与非法配置")
    void testLoadFileAndInvalid() throws Exception {
        Path file = dir.resolve("pipeline.json");
        Files.writeString(file, """
                { "session_name": "lab", "poll_interval_ms": 250,
                  "graph": { "nodes": [ { "name": "a", "kind": "videotestsrc" } ] } }
                """);

        PipelineConfig config = PipelineConfigLoader.loadFile(file);
        assertEquals("lab", config.getSessionName());
        assertEquals(250L, config.getPollIntervalMs());

        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse("{ \"session_name\": \"x\" }"));
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.parse("""
                { "poll_interval_ms": 0, "graph": { "nodes": [] } }
                """));
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.loadFile(dir.resolve("missing.json")));
        assertThrows(ConfigurationException.class, () -> PipelineConfigLoader.loadResource("missing.json"));
    }
}
