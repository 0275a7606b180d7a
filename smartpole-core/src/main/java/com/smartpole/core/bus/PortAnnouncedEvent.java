package com.smartpole.core.bus;

import com.smartpole.core.graph.PortShape;
import lombok.Getter;
import lombok.ToString;

/**
 * 动态输出节点在流协商完成后宣告了新输出端口。
 * 引擎在流线程上产生该事件，图的修改仍在控制线程上进行。
 */
@Getter
@ToString
public class PortAnnouncedEvent extends PipelineEvent {

    private final String nodeName;
    private final String portName;
    private final PortShape shape;

    public PortAnnouncedEvent(String nodeName, String portName, PortShape shape) {
        super(EventType.PORT_ANNOUNCED, nodeName);
        this.nodeName = nodeName;
        this.portName = portName;
        this.shape = shape;
    }
}
