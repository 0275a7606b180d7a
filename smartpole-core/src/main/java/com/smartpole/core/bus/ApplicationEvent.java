package com.smartpole.core.bus;

import java.util.Map;

import lombok.Getter;
import lombok.ToString;

/**
 * 应用自定义事件，按名称区分，例如 {@code tags-changed}。
 */
@Getter
@ToString
public class ApplicationEvent extends PipelineEvent {

    public static final String TAGS_CHANGED = "tags-changed";

    private final String name;
    private final Map<String, Object> properties;

    public ApplicationEvent(String source, String name, Map<String, Object> properties) {
        super(EventType.APPLICATION, source);
        this.name = name;
        this.properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public ApplicationEvent(String source, String name) {
        this(source, name, Map.of());
    }
}
