package com.smartpole.core.engine;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import com.smartpole.core.bus.EventSink;
import com.smartpole.core.graph.NodeSpec;
import com.smartpole.core.graph.PortRef;
import com.smartpole.core.lifecycle.LifecycleState;

/**
 * 外部媒体处理引擎的边界。
 * 引擎拥有自己的工作线程，只能通过 {@link EventSink} 投递事件与控制核心交互。
 * 除 {@link #setEventSink(EventSink)} 外，所有方法都由控制线程调用，且不得无限期阻塞。
 */
public interface MediaEngine extends AutoCloseable {

    void setEventSink(EventSink sink);

    /**
     * 按类型与初始参数创建节点。
     */
    void createNode(NodeSpec spec);

    /**
     * 在引擎内部连接两个端口。
     *
     * @return 引擎拒绝时返回 false
     */
    boolean linkPorts(PortRef output, PortRef input);

    StateChangeReturn requestState(LifecycleState target);

    OptionalLong queryDuration(Duration timeout);

    OptionalLong queryPosition(Duration timeout);

    boolean seek(long positionNanos, Set<SeekFlag> flags);

    /**
     * 修改节点运行时参数，不重启管线。
     *
     * @return 引擎拒绝时返回 false
     */
    boolean setNodeProperty(String nodeName, String key, Object value);

    int streamCount(StreamKind kind);

    /**
     * 读取某条流的标签，例如 codec、language、bitrate。
     */
    Optional<Map<String, Object>> streamTags(StreamKind kind, int streamIndex);

    @Override
    void close();
}
