package com.smartpole.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.smartpole.core.exception.ConfigurationException;
import com.smartpole.core.exception.DuplicateNodeException;
import com.smartpole.core.exception.IncompatibleShapeException;
import com.smartpole.core.exception.UnclaimedPortException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 处理节点与连接组成的有向无环图。
 * 除构建阶段外，只允许在控制线程上访问，因此内部不加锁。
 */
@Slf4j
public class Graph {

    @Getter
    private final String name;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<LinkHandle> links = new ArrayList<>();
    private final List<DeferredLinkHandle> deferredLinks = new ArrayList<>();

    public Graph(String name) {
        this.name = name;
    }

    /**
     * 注册节点。
     *
     * @throws DuplicateNodeException 名称已存在
     * @throws ConfigurationException  名称、类型或端口格式非法
     */
    public NodeHandle addNode(NodeSpec spec) {
        if (spec == null || spec.getName() == null || spec.getName().isBlank()) {
            throw new ConfigurationException("节点名称不能为空");
        }
        if (spec.getKind() == null || spec.getKind().isBlank()) {
            throw new ConfigurationException("节点类型不能为空: " + spec.getName());
        }
        if (nodes.containsKey(spec.getName())) {
            throw new DuplicateNodeException(spec.getName());
        }
        Node node;
        try {
            node = new Node(spec);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("节点 %s 的端口声明非法: %s".formatted(spec.getName(), e.getMessage()), e);
        }
        nodes.put(node.getName(), node);
        log.debug("Graph {}: 节点已注册 name={}, kind={}, dynamicOutputs={}", name, node.getName(), node.getKind(),
                node.isDynamicOutputs());
        return node.handle();
    }

    /**
     * 连接输出端口与输入端口。
     * 输出端口已确定时立即建立连接；输出属于尚未宣告端口的动态节点时登记为延迟连接。
     *
     * @throws IncompatibleShapeException 两端数据格式不兼容
     * @throws ConfigurationException     方向错误、端口不存在、端口已占用或形成环
     */
    public GraphLink link(PortRef output, PortRef input) {
        if (output.getDirection() != PortDirection.OUTPUT || input.getDirection() != PortDirection.INPUT) {
            throw new ConfigurationException("连接方向必须是 输出 -> 输入: %s -> %s".formatted(output, input));
        }
        Node source = requireNode(output.getNodeName());
        Node destination = requireNode(input.getNodeName());
        Port inPort = destination.findInput(input.getPortName())
                .orElseThrow(() -> new ConfigurationException("输入端口不存在: " + input));
        if (inPort.isLinked()) {
            throw new ConfigurationException("输入端口已被连接: " + input);
        }
        if (source == destination || reachable(destination.getName(), source.getName())) {
            throw new ConfigurationException("连接会形成环: %s -> %s".formatted(output, input));
        }

        Port outPort = output.getPortName() == null ? null : source.findOutput(output.getPortName()).orElse(null);
        if (outPort != null && outPort.isResolved()) {
            if (outPort.isLinked()) {
                throw new ConfigurationException("输出端口已被连接: " + output);
            }
            return connect(outPort, inPort, false);
        }

        if (source.isDynamicOutputs()) {
            DeferredLinkHandle deferred = new DeferredLinkHandle(source.getName(), output.getPortName(), inPort.ref());
            inPort.attach(deferred);
            deferredLinks.add(deferred);
            log.debug("Graph {}: 登记延迟连接 {}", name, deferred);
            return deferred;
        }
        throw new ConfigurationException("输出端口不存在: " + output);
    }

    /**
     * 动态输出节点在运行时宣告了新端口，补全第一个可认领该端口的延迟连接。
     * 对已确定的端口重复调用是无操作。
     *
     * @return 新建立的连接；端口已确定时返回 empty
     * @throws UnclaimedPortException      没有待补全的延迟连接认领该端口
     * @throws IncompatibleShapeException 存在候选延迟连接但格式都不兼容
     */
    public Optional<LinkHandle> resolvePendingOutput(String nodeName, String portName, PortShape shape) {
        Node node = requireNode(nodeName);
        Port existing = node.findOutput(portName).orElse(null);
        if (existing != null && existing.isResolved()) {
            log.debug("Graph {}: 端口 {}.{} 已确定，忽略重复宣告", name, nodeName, portName);
            return Optional.empty();
        }
        if (!node.isDynamicOutputs() && existing == null) {
            throw new UnclaimedPortException(nodeName, portName);
        }
        Port port = existing != null ? existing : node.addOutput(portName);
        port.resolve(shape);

        List<DeferredLinkHandle> candidates = deferredLinks.stream()
                .filter(DeferredLinkHandle::isPending)
                .filter(d -> d.getSourceNode().equals(nodeName))
                .filter(d -> d.accepts(portName))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new UnclaimedPortException(nodeName, portName);
        }

        IncompatibleShapeException mismatch = null;
        for (DeferredLinkHandle deferred : candidates) {
            Port inPort = port(deferred.getDestination());
            if (!port.getShape().isCompatibleWith(inPort.getShape())) {
                mismatch = new IncompatibleShapeException(port.toString(), port.getShape(), inPort.toString(),
                        inPort.getShape());
                continue;
            }
            inPort.detach();
            LinkHandle link = connect(port, inPort, true);
            deferred.complete(link);
            log.info("Graph {}: 延迟连接已补全 {}", name, link);
            return Optional.of(link);
        }
        // 所有候选格式都不兼容：这些分支保持断开，不再阻塞 READY
        for (DeferredLinkHandle deferred : candidates) {
            port(deferred.getDestination()).detach();
            deferred.fail();
            log.warn("Graph {}: 延迟连接因格式不兼容而放弃 {}", name, deferred);
        }
        throw mismatch;
    }

    /**
     * 拆除一个已建立的连接。若它来自延迟连接，该延迟连接标记为失败。
     */
    public void unlink(LinkHandle link) {
        if (!links.remove(link)) {
            return;
        }
        port(link.getSource()).detach();
        port(link.getDestination()).detach();
        deferredLinks.stream()
                .filter(d -> d.getResolvedLink().map(link::equals).orElse(false))
                .forEach(DeferredLinkHandle::fail);
        log.warn("Graph {}: 连接已断开 {}", name, link);
    }

    /**
     * 生命周期到达 READY 时调用：仍未补全的延迟连接属于致命配置错误。
     */
    public void validateForReady() {
        List<DeferredLinkHandle> pending = deferredLinks.stream()
                .filter(DeferredLinkHandle::isPending)
                .collect(Collectors.toList());
        if (!pending.isEmpty()) {
            throw new ConfigurationException("到达 READY 时仍有未补全的延迟连接: " + pending);
        }
    }

    public boolean hasPendingDeferredLinks() {
        return deferredLinks.stream().anyMatch(DeferredLinkHandle::isPending);
    }

    public Optional<Node> findNode(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName));
    }

    public Node requireNode(String nodeName) {
        Node node = nodes.get(nodeName);
        if (node == null) {
            throw new ConfigurationException("节点不存在: " + nodeName);
        }
        return node;
    }

    /**
     * 更新节点的运行时参数，仅供参数注册表调用。
     */
    public void updateParameter(String nodeName, String key, Object value) {
        requireNode(nodeName).putParameter(key, value);
    }

    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<LinkHandle> getLinks() {
        return Collections.unmodifiableList(links);
    }

    public List<DeferredLinkHandle> getDeferredLinks() {
        return Collections.unmodifiableList(deferredLinks);
    }

    /**
     * 以 DOT 格式输出当前拓扑，延迟连接用虚线表示。
     */
    public String toDot(String title) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(title).append("\" {\n");
        sb.append("  rankdir=LR;\n");
        for (Node node : nodes.values()) {
            sb.append("  \"").append(node.getName()).append("\" [label=\"")
                    .append(node.getName()).append("\\n").append(node.getKind()).append("\"];\n");
        }
        for (LinkHandle link : links) {
            sb.append("  \"").append(link.getSource().getNodeName()).append("\" -> \"")
                    .append(link.getDestination().getNodeName()).append("\" [label=\"")
                    .append(link.getSource().getPortName()).append("->")
                    .append(link.getDestination().getPortName()).append("\"];\n");
        }
        for (DeferredLinkHandle deferred : deferredLinks) {
            if (deferred.isActive()) {
                continue;
            }
            sb.append("  \"").append(deferred.getSourceNode()).append("\" -> \"")
                    .append(deferred.getDestination().getNodeName()).append("\" [style=dashed, label=\"")
                    .append(deferred.getStatus()).append("\"];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private LinkHandle connect(Port outPort, Port inPort, boolean fromDeferred) {
        if (!outPort.getShape().isCompatibleWith(inPort.getShape())) {
            throw new IncompatibleShapeException(outPort.toString(), outPort.getShape(), inPort.toString(),
                    inPort.getShape());
        }
        LinkHandle link = new LinkHandle(outPort.ref(), inPort.ref(), fromDeferred);
        outPort.attach(link);
        inPort.attach(link);
        links.add(link);
        return link;
    }

    private Port port(PortRef ref) {
        Node node = requireNode(ref.getNodeName());
        Optional<Port> port = ref.getDirection() == PortDirection.INPUT
                ? node.findInput(ref.getPortName())
                : node.findOutput(ref.getPortName());
        return port.orElseThrow(() -> new ConfigurationException("端口不存在: " + ref));
    }

    // from 是否能沿已有连接（含延迟连接）到达 to
    private boolean reachable(String from, String to) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(to)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (LinkHandle link : links) {
                if (link.getSource().getNodeName().equals(current)) {
                    stack.push(link.getDestination().getNodeName());
                }
            }
            for (DeferredLinkHandle deferred : deferredLinks) {
                if (deferred.isPending() && deferred.getSourceNode().equals(current)) {
                    stack.push(deferred.getDestination().getNodeName());
                }
            }
        }
        return false;
    }
}
