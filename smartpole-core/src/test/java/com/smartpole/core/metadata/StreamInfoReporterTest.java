package com.smartpole.core.metadata;

import java.util.List;
import java.util.Map;

import com.smartpole.core.bus.ApplicationEvent;
import com.smartpole.core.bus.TagsDiscoveredEvent;
import com.smartpole.core.engine.ScriptedMediaEngine;
import com.smartpole.core.engine.StreamKind;
import com.smartpole.core.playback.PlaybackObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StreamInfoReporterTest {

    @Mock
    private PlaybackObserver observer;

    private ScriptedMediaEngine engine;
    private StreamInfoReporter reporter;

    @BeforeEach
    void setUp() {
        engine = new ScriptedMediaEngine();
        engine.tags.put(StreamKind.VIDEO, List.of(Map.of(), Map.of("video-codec", "H.264")));
        engine.tags.put(StreamKind.AUDIO, List.of(Map.of("audio-codec", "AAC", "language-code", "en",
                "bitrate", 128000)));
        engine.tags.put(StreamKind.TEXT, List.of(Map.of("language-code", "ko")));
        reporter = new StreamInfoReporter(engine, observer);
    }

    @Test
    @DisplayName("格式化各类流的标签")
    void testFormatting() {
        List<StreamInfo> infos = reporter.analyze();

        assertEquals(4, infos.size());
        assertEquals("video stream 0:\n  codec: unknown\n", infos.get(0).getText());
        assertEquals("video stream 1:\n  codec: H.264\n", infos.get(1).getText());
        assertEquals("audio stream 0:\n  codec: AAC\n  language: en\n  bitrate: 128000\n", infos.get(2).getText());
        assertEquals("subtitle stream 0:\n  language: ko\n", infos.get(3).getText());
        verifyNoInteractions(observer);
    }

    @Test
    @DisplayName("标签事件触发推送")
    void testTagsDiscoveredTriggersReport() {
        reporter.handle(new TagsDiscoveredEvent("src", 0, StreamKind.VIDEO));

        verify(observer).onMetadataUpdate(eq(1), eq(StreamKind.VIDEO), eq("video stream 1:\n  codec: H.264\n"));
        verify(observer).onMetadataUpdate(eq(0), eq(StreamKind.TEXT), eq("subtitle stream 0:\n  language: ko\n"));
        verify(observer, times(4)).onMetadataUpdate(anyInt(), any(StreamKind.class), anyString());
    }

    @Test
    @DisplayName("只有 tags-changed 应用事件触发推送")
    void testApplicationEvents() {
        reporter.handle(new ApplicationEvent("src", "custom"));
        verifyNoInteractions(observer);

        reporter.handle(new ApplicationEvent("src", ApplicationEvent.TAGS_CHANGED));
        verify(observer, times(4)).onMetadataUpdate(anyInt(), any(StreamKind.class), anyString());
    }
}
