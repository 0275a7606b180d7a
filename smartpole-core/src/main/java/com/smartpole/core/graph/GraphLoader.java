package com.smartpole.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartpole.core.exception.ConfigurationException;
import com.smartpole.core.exception.LinkException;
import lombok.extern.slf4j.Slf4j;

/**
 * 从 {@link GraphDefinition} 构建 {@link Graph}。这是唯一的建图路径。
 */
@Slf4j
public final class GraphLoader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GraphLoader() {
    }

    /**
     * 从JSON字符串加载图定义。
     *
     * @throws ConfigurationException JSON 解析失败
     */
    public static GraphDefinition loadDefinition(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("解析 Graph JSON 定义失败: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 按声明顺序注册节点并建立连接。
     */
    public static Graph build(GraphDefinition definition) {
        if (definition == null) {
            throw new ConfigurationException("图定义不能为空");
        }
        String graphName = definition.getGraphName() == null ? "pipeline" : definition.getGraphName();
        Graph graph = new Graph(graphName);
        if (definition.getNodes() != null) {
            definition.getNodes().forEach(graph::addNode);
        }
        if (definition.getConnections() != null) {
            for (ConnectionConfig connection : definition.getConnections()) {
                PortRef source = PortRef.parse(connection.getSource(), PortDirection.OUTPUT);
                PortRef destination = PortRef.parse(connection.getDestination(), PortDirection.INPUT);
                if (destination.getPortName() == null) {
                    throw new ConfigurationException("目标必须指定输入端口: " + connection.getDestination());
                }
                try {
                    graph.link(source, destination);
                } catch (LinkException e) {
                    throw new ConfigurationException("构建期连接失败: " + e.getMessage(), e);
                }
            }
        }
        log.info("Graph {}: 构建完成 nodes={}, links={}, deferred={}", graphName, graph.getNodes().size(),
                graph.getLinks().size(), graph.getDeferredLinks().size());
        return graph;
    }
}
