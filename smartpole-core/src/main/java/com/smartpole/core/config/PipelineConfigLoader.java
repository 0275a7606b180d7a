package com.smartpole.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartpole.core.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 从类路径或文件读取 {@link PipelineConfig}。
 */
@Slf4j
public final class PipelineConfigLoader {

    public static final String DEFAULT_RESOURCE = "pipeline.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PipelineConfigLoader() {
    }

    public static PipelineConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static PipelineConfig loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = PipelineConfigLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("类路径上找不到配置: " + resource);
            }
            PipelineConfig config = validate(OBJECT_MAPPER.readValue(in, PipelineConfig.class), resource);
            log.info("已加载配置 {} (session={})", resource, config.getSessionName());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("读取配置失败: " + resource, e);
        }
    }

    public static PipelineConfig loadFile(Path file) {
        try {
            PipelineConfig config = parse(Files.readString(file));
            log.info("已加载配置 {} (session={})", file, config.getSessionName());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("读取配置文件失败: " + file, e);
        }
    }

    public static PipelineConfig parse(String json) {
        try {
            return validate(OBJECT_MAPPER.readValue(json, PipelineConfig.class), "<json>");
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("解析配置失败: " + e.getOriginalMessage(), e);
        }
    }

    private static PipelineConfig validate(PipelineConfig config, String origin) {
        if (config.getGraph() == null) {
            throw new ConfigurationException("配置缺少 graph: " + origin);
        }
        if (config.getPollIntervalMs() <= 0 || config.getQueryTimeoutMs() <= 0) {
            throw new ConfigurationException("poll_interval_ms 与 query_timeout_ms 必须为正数: " + origin);
        }
        if (config.getEventQueueCapacity() < 2) {
            throw new ConfigurationException("event_queue_capacity 至少为 2: " + origin);
        }
        return config;
    }
}
