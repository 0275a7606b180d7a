package com.smartpole.core.runloop;

import java.time.Duration;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;

/**
 * 控制线程的单线程事件循环。
 * 基于 Agrona AgentRunner，每轮依次处理：到期定时器、内部任务、外部事件源（事件总线）。
 *
 * 1. 批量消费内部任务，避免每次只处理一个任务造成延迟。
 * 2. 空闲时 park，不做忙等；提交任务或外部事件入队时 unpark 唤醒。
 * 3. 定时器只在本线程上维护，周期任务到期后重新排期，属于协作式挂起点。
 */
@Slf4j
public class Runloop {

    private static final int DEFAULT_INTERNAL_QUEUE_CAPACITY = 1024;
    private static final int DEFAULT_INTERNAL_TASK_BATCH = 64;
    // 最长 park 时间，也决定了定时器的精度
    private static final long MAX_PARK_NS = TimeUnit.MILLISECONDS.toNanos(5);

    private final ManyToOneConcurrentArrayQueue<Runnable> taskQueue;
    private final RunloopAgent coreAgent;
    private final int internalTaskBatchSize;
    // 仅在 runloop 线程上访问
    private final PriorityQueue<ScheduledTask> timers = new PriorityQueue<>();
    private final AtomicLong timerSequence = new AtomicLong();
    private AgentRunner agentRunner;
    private volatile boolean running = false;
    @Getter
    private volatile Thread coreThread;
    private volatile IntSupplier externalEventDrainSupplier;

    public Runloop(String name) {
        this(name, DEFAULT_INTERNAL_QUEUE_CAPACITY, DEFAULT_INTERNAL_TASK_BATCH);
    }

    /**
     * @param name                  名称（用于线程名）
     * @param requestedCapacity     任务队列初始容量（调整为 2 的幂）
     * @param internalTaskBatchSize 每轮最多处理多少个内部任务
     */
    public Runloop(String name, int requestedCapacity, int internalTaskBatchSize) {
        Objects.requireNonNull(name, "name");

        int capacity = Math.max(2, Integer.highestOneBit(requestedCapacity));
        if (capacity < requestedCapacity) {
            capacity <<= 1;
        }
        taskQueue = new ManyToOneConcurrentArrayQueue<>(capacity);
        this.internalTaskBatchSize = Math.max(1, internalTaskBatchSize);
        coreAgent = new RunloopAgent(name);
    }

    /**
     * 注册外部事件源，例如事件总线。
     *
     * @param drainSupplier 每轮调用一次，返回处理的事件数量
     */
    public void registerExternalEventSource(IntSupplier drainSupplier) {
        externalEventDrainSupplier = drainSupplier;
        log.info("Runloop {}: 外部事件源已注册。", coreAgent.name);
    }

    public void start() {
        if (running) {
            log.warn("Runloop already started.");
            return;
        }
        running = true;

        // 自旋 -> yield -> park，park 时长上限 MAX_PARK_NS
        IdleStrategy idleStrategy = new BackoffIdleStrategy(
                1,
                1,
                TimeUnit.MICROSECONDS.toNanos(50),
                MAX_PARK_NS);

        agentRunner = new AgentRunner(
                idleStrategy,
                throwable -> log.error("Runloop AgentRunner 发生未捕获异常", throwable),
                null,
                coreAgent);

        Thread agentThread = new Thread(agentRunner, coreAgent.roleName() + "-Runner");
        agentThread.setDaemon(true);
        agentThread.setUncaughtExceptionHandler((thread, ex) -> log.error("Runloop AgentRunner 线程发生未捕获异常", ex));
        coreThread = agentThread;
        agentThread.start();

        log.info("Runloop started. Thread: {}", agentThread.getName());
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == coreThread;
    }

    /**
     * 提交一个任务到 Runloop 内部队列中（会在 Runloop 专属线程上执行）。
     *
     * @return 成功入队返回 true，队列满或未运行返回 false
     */
    public boolean postTask(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (!running) {
            log.warn("Runloop is not running, task will not be executed.");
            return false;
        }
        if (!taskQueue.offer(task)) {
            log.warn("Runloop 内部任务队列已满，任务被丢弃。");
            return false;
        }
        wakeup();
        return true;
    }

    /**
     * 在控制线程上执行并返回结果。任务异常以异常完成的 future 返回。
     */
    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        boolean posted = postTask(() -> {
            try {
                future.complete(task.get());
            } catch (Throwable e) {
                future.completeExceptionally(e);
            }
        });
        if (!posted) {
            future.completeExceptionally(new IllegalStateException("Runloop 未运行或任务队列已满"));
        }
        return future;
    }

    /**
     * 注册周期任务，首次在一个周期后执行。
     *
     * @return 可用于取消的句柄
     */
    public TimerHandle schedulePeriodic(Runnable task, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        ScheduledTask scheduled = new ScheduledTask(task, period.toNanos(), timerSequence.incrementAndGet());
        scheduled.deadline = System.nanoTime() + scheduled.periodNanos;
        if (!postTask(() -> timers.add(scheduled))) {
            scheduled.cancelled = true;
        }
        return scheduled;
    }

    public void wakeup() {
        Thread t = coreThread;
        if (t != null) {
            LockSupport.unpark(t);
        }
    }

    /**
     * 安全关闭 Runloop。不能在 Runloop 线程上调用。
     */
    public void shutdown() {
        if (!running) {
            log.warn("Runloop is not running, no need to shut down.");
            return;
        }
        if (isLoopThread()) {
            throw new IllegalStateException("Runloop 不能在自身线程上关闭");
        }
        running = false;

        try {
            if (agentRunner != null) {
                agentRunner.close();
            }
        } catch (Exception e) {
            log.error("Runloop AgentRunner close error", e);
        }

        wakeup();
        try {
            Thread t = coreThread;
            if (t != null && t.isAlive()) {
                t.join(TimeUnit.SECONDS.toMillis(3));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Runloop shutdown interrupted.");
        }

        log.info("Runloop shutdown completed.");
    }

    private int runDueTimers() {
        int fired = 0;
        long now = System.nanoTime();
        while (!timers.isEmpty() && timers.peek().deadline - now <= 0) {
            ScheduledTask due = timers.poll();
            if (due.cancelled) {
                continue;
            }
            try {
                due.task.run();
            } catch (Throwable e) {
                log.error("RunloopAgent: 执行定时任务发生异常", e);
            }
            fired++;
            if (!due.cancelled) {
                // 固定延迟重新排期，错过的周期不补偿
                due.deadline = System.nanoTime() + due.periodNanos;
                timers.add(due);
            }
        }
        return fired;
    }

    /**
     * 周期任务的取消句柄。
     */
    public interface TimerHandle {

        void cancel();

        boolean isCancelled();
    }

    private static final class ScheduledTask implements TimerHandle, Comparable<ScheduledTask> {
        private final Runnable task;
        private final long periodNanos;
        private final long sequence;
        private long deadline;
        private volatile boolean cancelled;

        private ScheduledTask(Runnable task, long periodNanos, long sequence) {
            this.task = task;
            this.periodNanos = periodNanos;
            this.sequence = sequence;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public int compareTo(ScheduledTask other) {
            int byDeadline = Long.compare(deadline - other.deadline, 0);
            return byDeadline != 0 ? byDeadline : Long.compare(sequence, other.sequence);
        }
    }

    /**
     * Runloop 的核心 Agent 实现。
     */
    private class RunloopAgent implements Agent {
        private final String name;

        RunloopAgent(String name) {
            this.name = name;
        }

        @Override
        public String roleName() {
            return "Runloop-%s".formatted(name);
        }

        @Override
        public int doWork() {
            int workDone = runDueTimers();

            int processed = 0;
            Runnable r;
            while (processed < internalTaskBatchSize && (r = taskQueue.poll()) != null) {
                try {
                    r.run();
                } catch (Throwable e) {
                    log.error("RunloopAgent: 执行内部任务发生异常", e);
                }
                processed++;
            }
            workDone += processed;

            IntSupplier drain = externalEventDrainSupplier;
            if (drain != null) {
                try {
                    workDone += Math.max(0, drain.getAsInt());
                } catch (Throwable e) {
                    log.error("RunloopAgent: 执行外部事件处理器发生异常", e);
                }
            }
            return workDone;
        }

        @Override
        public void onStart() {
            log.info("{} started.", roleName());
        }

        @Override
        public void onClose() {
            log.info("{} closed.", roleName());
            taskQueue.clear();
            timers.clear();
        }
    }
}
