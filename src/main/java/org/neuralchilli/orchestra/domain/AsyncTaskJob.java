package org.neuralchilli.orchestra.domain;

import io.smallrye.mutiny.Uni;

/**
 * A job written as a Mutiny pipeline. The cooperative executor subscribes to
 * the returned {@link Uni} so the job only yields its carrier thread at stage
 * boundaries; the other executors simply await it.
 */
@FunctionalInterface
public interface AsyncTaskJob extends TaskJob {

    Uni<?> runAsync(TaskContext context);

    @Override
    default Object run(TaskContext context) {
        return runAsync(context).await().indefinitely();
    }
}
