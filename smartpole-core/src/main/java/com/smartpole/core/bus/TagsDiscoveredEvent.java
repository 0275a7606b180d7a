package com.smartpole.core.bus;

import com.smartpole.core.engine.StreamKind;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class TagsDiscoveredEvent extends PipelineEvent {

    private final int streamIndex;
    private final StreamKind streamKind;

    public TagsDiscoveredEvent(String source, int streamIndex, StreamKind streamKind) {
        super(EventType.TAGS_DISCOVERED, source);
        this.streamIndex = streamIndex;
        this.streamKind = streamKind;
    }
}
