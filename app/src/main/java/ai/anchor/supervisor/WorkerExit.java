package ai.anchor.supervisor;

import org.jetbrains.annotations.Nullable;

/**
 * Exit notification from a worker to its group. {@code failure} is null for a requested stop.
 */
record WorkerExit(SessionWorker worker, @Nullable Throwable failure) {
    boolean abnormal() {
        return failure != null;
    }
}
