package org.github.zzf.mqtt.bus.state;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Current status and last error of a connection.
 * <p>The last error sticks across later transitions without error and is only cleared by {@link #reset()}.</p>
 * <p>Not thread-safe, the owner serializes access.</p>
 */
@Slf4j
public class ConnectionStateMachine {

    private Status status;
    @Nullable
    private Throwable lastError;
    @Nullable
    private StatusListener observer;

    public ConnectionStateMachine() {
        reset();
    }

    public void transition(Status newStatus) {
        transition(newStatus, null);
    }

    /**
     * record the new status and notify the observer
     * <p>An exception thrown by the observer propagates to the caller.</p>
     *
     * @param newStatus the new status
     * @param error     overwrites the last error if not null
     */
    public void transition(Status newStatus, @Nullable Throwable error) {
        checkNotNull(newStatus, "newStatus");
        log.debug("status: {} -> {}", status, newStatus);
        this.status = newStatus;
        if (error != null) {
            this.lastError = error;
        }
        if (observer != null) {
            observer.onStatusChange(newStatus, error);
        }
    }

    public void reset() {
        this.status = Status.READY;
        this.lastError = null;
    }

    public Status status() {
        return status;
    }

    @Nullable
    public Throwable lastError() {
        return lastError;
    }

    /**
     * set the only observer, replacing the previous one. null removes it.
     */
    public void observer(@Nullable StatusListener observer) {
        this.observer = observer;
    }

}
