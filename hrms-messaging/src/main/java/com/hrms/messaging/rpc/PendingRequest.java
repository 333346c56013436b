package com.hrms.messaging.rpc;

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A request waiting for its reply. Owned by {@link CorrelatedRequestBridge}; whoever
 * removes the entry from the bridge's map is the only party allowed to complete it.
 */
@Getter
final class PendingRequest<T> {

    private final String correlationId;
    private final Instant createdAt;
    private final Instant deadline;
    private final CompletableFuture<List<T>> future;
    private volatile ScheduledFuture<?> timer;

    PendingRequest(String correlationId, Instant createdAt, Instant deadline) {
        this.correlationId = correlationId;
        this.createdAt = createdAt;
        this.deadline = deadline;
        this.future = new CompletableFuture<>();
    }

    void attachTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void resolve(List<T> items) {
        cancelTimer();
        future.complete(items);
    }

    void reject(RpcException error) {
        cancelTimer();
        future.completeExceptionally(error);
    }

    private void cancelTimer() {
        ScheduledFuture<?> current = timer;
        if (current != null) {
            current.cancel(false);
        }
    }
}
