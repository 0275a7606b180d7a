package com.smartpole.core.bus;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ErrorEvent extends PipelineEvent {

    private final String message;
    private final String detail;

    public ErrorEvent(String source, String message, String detail) {
        super(EventType.ERROR, source);
        this.message = message;
        this.detail = detail;
    }
}
