package com.smartpole.core.graph;

import java.util.Optional;

import com.smartpole.core.bus.PipelineEvent;
import com.smartpole.core.bus.PipelineEventHandler;
import com.smartpole.core.bus.PortAnnouncedEvent;
import com.smartpole.core.engine.MediaEngine;
import com.smartpole.core.exception.LinkException;
import com.smartpole.core.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * 处理动态输出节点的端口宣告：补全图中的延迟连接，并让引擎建立实际连接。
 * 连接失败只记录告警，受影响的下游分支保持断开。
 */
@Slf4j
public class DynamicLinker implements PipelineEventHandler {

    private final Graph graph;
    private final MediaEngine engine;
    private final PipelineMetrics metrics;

    public DynamicLinker(Graph graph, MediaEngine engine, PipelineMetrics metrics) {
        this.graph = graph;
        this.engine = engine;
        this.metrics = metrics;
    }

    @Override
    public void handle(PipelineEvent event) {
        if (!(event instanceof PortAnnouncedEvent)) {
            log.warn("DynamicLinker 收到非 PortAnnouncedEvent 事件: {}", event.getType());
            return;
        }
        onPortAnnounced((PortAnnouncedEvent) event);
    }

    /**
     * @return 本次新建立的连接；重复宣告或失败时为 empty
     */
    public Optional<LinkHandle> onPortAnnounced(PortAnnouncedEvent event) {
        String nodeName = event.getNodeName();
        String portName = event.getPortName();
        Optional<LinkHandle> resolved;
        try {
            resolved = graph.resolvePendingOutput(nodeName, portName, event.getShape());
        } catch (LinkException e) {
            log.warn("DynamicLinker: 端口 {}.{} ({}) 未能连接: {}", nodeName, portName, event.getShape(),
                    e.getMessage());
            countFailure();
            return Optional.empty();
        }
        if (resolved.isEmpty()) {
            return Optional.empty();
        }

        LinkHandle link = resolved.get();
        if (!engine.linkPorts(link.getSource(), link.getDestination())) {
            log.warn("DynamicLinker: 引擎拒绝连接 {}，下游分支保持断开", link);
            graph.unlink(link);
            countFailure();
            return Optional.empty();
        }
        log.info("DynamicLinker: 动态端口已连接 {}", link);
        return resolved;
    }

    private void countFailure() {
        if (metrics != null) {
            metrics.getLinkFailures().inc();
        }
    }
}
