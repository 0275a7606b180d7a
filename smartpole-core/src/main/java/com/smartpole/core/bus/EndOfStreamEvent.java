package com.smartpole.core.bus;

import lombok.ToString;

@ToString
public class EndOfStreamEvent extends PipelineEvent {

    public EndOfStreamEvent(String source) {
        super(EventType.END_OF_STREAM, source);
    }
}
