package com.satoru.literature.infra;

import java.util.function.Supplier;

public interface RateGovernor {

    /**
     * Blocks until the minimum interval since the previously claimed slot has passed.
     *
     * @return the instant the caller was let through, on the {@link System#nanoTime()} scale
     */
    long acquire();

    default <T> T execute(Supplier<T> task) {
        acquire();
        return task.get();
    }
}
