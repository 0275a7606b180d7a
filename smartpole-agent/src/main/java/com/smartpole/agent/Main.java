package com.smartpole.agent;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.smartpole.core.config.PipelineConfig;
import com.smartpole.core.config.PipelineConfigLoader;
import com.smartpole.core.demo.SimulatedMediaEngine;
import com.smartpole.core.pipeline.PipelineSession;
import lombok.extern.slf4j.Slf4j;

/**
 * 控制台入口。参数为可选的配置文件路径，缺省读取类路径上的 pipeline.json。
 * 命令：play | pause | stop | seek 秒 | toggle 节点 参数 | set 节点 参数 值 | state | position | dot | quit
 */
@Slf4j
public class Main {

    private static final long COMMAND_TIMEOUT_SECONDS = 3;

    public static void main(String[] args) throws Exception {
        PipelineConfig config = args.length > 0
                ? PipelineConfigLoader.loadFile(Path.of(args[0]))
                : PipelineConfigLoader.loadDefault();

        ConsoleObserver console = new ConsoleObserver();
        SimulatedMediaEngine engine = new SimulatedMediaEngine().withDuration(Duration.ofSeconds(30));
        try (PipelineSession session = new PipelineSession(config, engine, console, console)) {
            session.start();
            System.out.println("Session " + session.getSessionName() + " started. 输入 help 查看命令。");

            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String[] parts = line.trim().split("\\s+");
                if (parts[0].isEmpty()) {
                    continue;
                }
                if ("quit".equals(parts[0]) || "exit".equals(parts[0])) {
                    break;
                }
                try {
                    execute(session, parts);
                } catch (IllegalArgumentException e) {
                    System.out.println("无效命令: " + e.getMessage());
                }
            }
        }
        System.out.println("Bye.");
    }

    private static void execute(PipelineSession session, String[] parts) throws InterruptedException {
        switch (parts[0]) {
            case "play":
                print(session.play());
                break;
            case "pause":
                print(session.pause());
                break;
            case "stop":
                print(session.stop());
                break;
            case "seek":
                requireArgs(parts, 2);
                long nanos = TimeUnit.SECONDS.toNanos(Long.parseLong(parts[1]));
                print(session.seek(nanos));
                break;
            case "toggle":
                requireArgs(parts, 3);
                print(session.toggleParameter(parts[1], parts[2]));
                break;
            case "set":
                requireArgs(parts, 4);
                print(session.setParameter(parts[1], parts[2], parts[3]));
                break;
            case "state":
                print(session.state());
                break;
            case "position":
                print(session.queryPosition());
                break;
            case "dot":
                print(session.topology());
                break;
            case "help":
                System.out.println("play | pause | stop | seek 秒 | toggle 节点 参数 | set 节点 参数 值 | state | position | dot | quit");
                break;
            default:
                throw new IllegalArgumentException(parts[0]);
        }
    }

    private static void requireArgs(String[] parts, int count) {
        if (parts.length < count) {
            throw new IllegalArgumentException("%s 需要 %d 个参数".formatted(parts[0], count - 1));
        }
    }

    private static void print(CompletableFuture<?> future) throws InterruptedException {
        try {
            System.out.println("-> " + future.get(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        } catch (ExecutionException e) {
            System.out.println("失败: " + e.getCause().getMessage());
            log.debug("命令执行失败", e.getCause());
        } catch (TimeoutException e) {
            System.out.println("超时");
        }
    }
}
