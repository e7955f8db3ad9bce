package com.ryuqq.registry.adapter.runner;

import com.ryuqq.registry.application.dispatch.CommandDispatcher;
import com.ryuqq.registry.application.runtime.CommandProcessor;
import com.ryuqq.registry.core.contract.Command;
import com.ryuqq.registry.core.contract.CommandId;
import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.outcome.Outcome;

import java.util.concurrent.CompletableFuture;

/**
 * Inline Runner 구현체.
 *
 * <p>Command를 호출자 스레드에서 즉시 실행하고 이미 완료된 Future를 반환합니다.
 * 동시 호출자 간의 직렬화는 레지스트리의 writer 락이 담당합니다.</p>
 *
 * <p><strong>특성:</strong></p>
 * <ul>
 *   <li>Stateless 설계: 인스턴스 간 상태 공유 없음 (thread-safe)</li>
 *   <li>큐, 워커 스레드 없음</li>
 *   <li>반환된 Future는 항상 완료 상태</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class InlineRunner implements CommandProcessor {

    private final CommandDispatcher dispatcher;

    /**
     * 생성자.
     *
     * @param dispatcher Command 디스패처
     * @throws IllegalArgumentException dispatcher가 null인 경우
     */
    public InlineRunner(CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.dispatcher = dispatcher;
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
        return CompletableFuture.completedFuture(dispatcher.execute(envelope));
    }
}
