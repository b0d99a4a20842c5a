package com.stablemint.engine;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs public operations one at a time. A failing operation is rolled back through its journal and emits nothing;
 * a committed one publishes its buffered events in order before the next operation may start.
 *
 * <p>The lock is reentrant so that a nested call from the same thread (a token callback) reaches the
 * entered-flag check and is rejected instead of deadlocking.</p>
 */
@Slf4j
public class EngineGuard {

    private final ReentrantLock lock = new ReentrantLock();
    private final ApplicationEventPublisher publisher;
    private boolean entered;

    public EngineGuard(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public <T> T execute(String operation, String actor, Function<OperationContext, T> body) {
        lock.lock();
        try {
            if (entered) {
                throw new EngineException(ErrorCode.REENTRANT_CALL, "Reentrant call to " + operation,
                        Map.of("operation", operation, "actor", actor));
            }
            T result;
            List<Object> events;
            entered = true;
            OperationContext ctx = new OperationContext();
            try {
                result = body.apply(ctx);
                events = ctx.pendingEvents();
            } catch (RuntimeException ex) {
                int undone = ctx.getJournal().size();
                ctx.rollback(ex);
                log.debug("[engine] {} by {} rolled back {} effects: {}", operation, actor, undone, ex.getMessage());
                throw ex;
            } finally {
                entered = false;
            }
            publish(operation, events);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Still under the lock, so listeners see events in commit order. The operation is already committed. */
    private void publish(String operation, List<Object> events) {
        for (Object event : events) {
            try {
                publisher.publishEvent(event);
            } catch (RuntimeException ex) {
                log.error("[engine] listener failed on {} after {} committed", event, operation, ex);
            }
        }
    }

    public void run(String operation, String actor, Consumer<OperationContext> body) {
        execute(operation, actor, ctx -> {
            body.accept(ctx);
            return null;
        });
    }

    /** Consistent read of committed state. */
    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }
}
