package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.dispatch.CommandDispatcher;
import com.ryuqq.registry.application.runtime.CommandProcessor;
import com.ryuqq.registry.core.contract.Command;
import com.ryuqq.registry.core.contract.CommandId;
import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single Writer Runner 구현체.
 *
 * <p>호출자는 Envelope을 제출하고 {@link CompletableFuture}를 받습니다. 하나의 워커 스레드가
 * 큐를 FIFO 순서로 비우며 {@link CommandDispatcher}를 통해 Command를 적용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(envelope)
 *   ↓
 * queue.offer(task) → 가득 차면 IllegalStateException
 *   ↓
 * worker: queue.poll()
 *   ↓
 * dispatcher.execute(envelope) → Outcome (Ok, Fail)
 *   ↓
 * future.complete(outcome)
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>제출 순서 = 적용 순서 (단일 워커)</li>
 *   <li>내부 타임아웃, 취소, 자동 재시도 없음</li>
 *   <li>shutdown 이전에 수락된 Command는 shutdownTimeoutMs 안에서 모두 처리 시도</li>
 *   <li>수락된 Command의 Future는 반드시 완료됨 (처리 결과 또는 종료 예외)</li>
 * </ul>
 *
 * <p>제출은 admission 읽기 락 안에서 running 확인과 큐 삽입을 함께 수행하고, shutdown은 쓰기 락으로
 * running을 내립니다. 따라서 running이 내려간 뒤에는 어떤 Command도 큐에 들어오지 않습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class SingleWriterRunner implements CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(SingleWriterRunner.class);

    private static final long POLL_TIMEOUT_MS = 50;

    private final CommandDispatcher dispatcher;
    private final SingleWriterConfig config;
    private final BlockingQueue<PendingCommand> queue;
    private final ExecutorService workerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final ReadWriteLock admission = new ReentrantReadWriteLock();

    /**
     * 생성자 (기본 설정).
     *
     * @param dispatcher Command 디스패처
     */
    public SingleWriterRunner(CommandDispatcher dispatcher) {
        this(dispatcher, new SingleWriterConfig());
    }

    /**
     * 생성자. 워커 스레드를 즉시 시작합니다.
     *
     * @param dispatcher Command 디스패처
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SingleWriterRunner(CommandDispatcher dispatcher, SingleWriterConfig config) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.dispatcher = dispatcher;
        this.config = config;
        this.queue = new LinkedBlockingQueue<>(config.queueCapacity());
        this.workerExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "registry-single-writer");
            thread.setDaemon(true);
            return thread;
        });
        this.workerExecutor.execute(this::drain);
    }

    @Override
    public CompletableFuture<Outcome> submit(Address caller, Command command) {
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return submit(Envelope.now(CommandId.random(), caller, command));
    }

    @Override
    public CompletableFuture<Outcome> submit(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        PendingCommand pending = new PendingCommand(envelope, new CompletableFuture<>());
        admission.readLock().lock();
        try {
            if (!running.get()) {
                throw new IllegalStateException("SingleWriterRunner has been shut down");
            }
            if (!queue.offer(pending)) {
                throw new IllegalStateException("Command queue is full (capacity: " + config.queueCapacity() + ")");
            }
        } finally {
            admission.readLock().unlock();
        }
        return pending.future();
    }

    /**
     * 대기 중인 Command 수.
     *
     * @return 큐 크기
     */
    public int pendingCount() {
        return queue.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runner 종료.
     *
     * <p>새 제출을 막고, 이미 수락된 Command를 shutdownTimeoutMs 동안 처리한 뒤 워커를 멈춥니다.
     * 시간 안에 처리되지 못한 Command의 Future는 IllegalStateException으로 완료됩니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        admission.writeLock().lock();
        try {
            if (!running.compareAndSet(true, false)) {
                return;
            }
        } finally {
            admission.writeLock().unlock();
        }
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("SingleWriterRunner did not drain within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
        List<PendingCommand> abandoned = new ArrayList<>();
        queue.drainTo(abandoned);
        for (PendingCommand pending : abandoned) {
            pending.future().completeExceptionally(
                new IllegalStateException("SingleWriterRunner shut down before executing "
                    + pending.envelope().commandId().getValue()));
        }
        log.info("SingleWriterRunner stopped ({} commands abandoned)", abandoned.size());
    }

    /**
     * 워커 루프: running이거나 큐가 비어있지 않은 동안 FIFO로 처리.
     */
    private void drain() {
        log.info("SingleWriterRunner worker started");
        while (running.get() || !queue.isEmpty()) {
            PendingCommand pending;
            try {
                pending = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("SingleWriterRunner worker interrupted");
                return;
            }
            if (pending != null) {
                process(pending);
            }
        }
    }

    private void process(PendingCommand pending) {
        Envelope envelope = pending.envelope();
        try {
            Outcome outcome = dispatcher.execute(envelope);
            pending.future().complete(outcome);
        } catch (RuntimeException e) {
            log.error("Failed to process envelope {}", envelope.commandId().getValue(), e);
            pending.future().completeExceptionally(e);
        }
    }

    private record PendingCommand(Envelope envelope, CompletableFuture<Outcome> future) {
    }
}
