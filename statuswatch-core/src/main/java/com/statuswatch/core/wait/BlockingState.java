package com.statuswatch.core.wait;

import java.util.Objects;

/**
 * One reason a wait condition is not yet satisfied.
 *
 * @param item  entity still blocking, e.g. a machine id or unit name
 * @param state reason it is blocking, e.g. {@code still-present}
 */
public record BlockingState(String item, String state) {

    public BlockingState {
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }
}
