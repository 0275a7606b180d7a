package com.smartpole.core.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.smartpole.core.bus.ApplicationEvent;
import com.smartpole.core.bus.PipelineEvent;
import com.smartpole.core.bus.PipelineEventHandler;
import com.smartpole.core.bus.TagsDiscoveredEvent;
import com.smartpole.core.engine.MediaEngine;
import com.smartpole.core.engine.StreamKind;
import com.smartpole.core.playback.PlaybackObserver;
import lombok.extern.slf4j.Slf4j;

/**
 * 收到流标签事件后重新读取所有流的标签，格式化为文本推送给外部界面。
 * 同时处理 TAGS_DISCOVERED 与名为 tags-changed 的应用事件。
 */
@Slf4j
public class StreamInfoReporter implements PipelineEventHandler {

    public static final String TAG_VIDEO_CODEC = "video-codec";
    public static final String TAG_AUDIO_CODEC = "audio-codec";
    public static final String TAG_LANGUAGE_CODE = "language-code";
    public static final String TAG_BITRATE = "bitrate";

    private final MediaEngine engine;
    private final PlaybackObserver observer;

    public StreamInfoReporter(MediaEngine engine, PlaybackObserver observer) {
        this.engine = engine;
        this.observer = observer == null ? PlaybackObserver.NOOP : observer;
    }

    @Override
    public void handle(PipelineEvent event) {
        if (event instanceof TagsDiscoveredEvent) {
            TagsDiscoveredEvent tags = (TagsDiscoveredEvent) event;
            log.debug("StreamInfoReporter: {} 流 {} 的标签已更新", tags.getStreamKind(), tags.getStreamIndex());
            report();
        } else if (event instanceof ApplicationEvent
                && ApplicationEvent.TAGS_CHANGED.equals(((ApplicationEvent) event).getName())) {
            report();
        } else {
            log.debug("StreamInfoReporter: 忽略事件 {} from {}", event.getType(), event.getSource());
        }
    }

    /**
     * 重新分析所有流并逐条推送。
     *
     * @return 推送的条目
     */
    public List<StreamInfo> report() {
        List<StreamInfo> infos = analyze();
        for (StreamInfo info : infos) {
            observer.onMetadataUpdate(info.getStreamIndex(), info.getKind(), info.getText());
        }
        return infos;
    }

    public List<StreamInfo> analyze() {
        List<StreamInfo> infos = new ArrayList<>();
        for (StreamKind kind : StreamKind.values()) {
            int count = engine.streamCount(kind);
            for (int i = 0; i < count; i++) {
                Optional<Map<String, Object>> tags = engine.streamTags(kind, i);
                if (tags.isPresent()) {
                    infos.add(new StreamInfo(i, kind, format(kind, i, tags.get())));
                }
            }
        }
        return infos;
    }

    static String format(StreamKind kind, int index, Map<String, Object> tags) {
        StringBuilder sb = new StringBuilder();
        switch (kind) {
            case VIDEO:
                sb.append("video stream ").append(index).append(":\n");
                Object codec = tags.get(TAG_VIDEO_CODEC);
                sb.append("  codec: ").append(codec == null ? "unknown" : codec).append('\n');
                break;
            case AUDIO:
                sb.append("audio stream ").append(index).append(":\n");
                appendIfPresent(sb, "codec", tags.get(TAG_AUDIO_CODEC));
                appendIfPresent(sb, "language", tags.get(TAG_LANGUAGE_CODE));
                appendIfPresent(sb, "bitrate", tags.get(TAG_BITRATE));
                break;
            case TEXT:
            default:
                sb.append("subtitle stream ").append(index).append(":\n");
                appendIfPresent(sb, "language", tags.get(TAG_LANGUAGE_CODE));
                break;
        }
        return sb.toString();
    }

    private static void appendIfPresent(StringBuilder sb, String label, Object value) {
        if (value != null) {
            sb.append("  ").append(label).append(": ").append(value).append('\n');
        }
    }
}
