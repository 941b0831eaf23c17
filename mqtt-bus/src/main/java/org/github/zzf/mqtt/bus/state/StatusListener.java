package org.github.zzf.mqtt.bus.state;

import javax.annotation.Nullable;

@FunctionalInterface
public interface StatusListener {

    /**
     * @param status the new status
     * @param error  the error that caused the transition, null for a transition without error
     */
    void onStatusChange(Status status, @Nullable Throwable error);

}
