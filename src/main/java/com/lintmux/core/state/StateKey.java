package com.lintmux.core.state;

/**
 * Typed name of an input or derived value held by a {@link ReactiveStore}.
 */
public record StateKey<T>(String name) {

    @Override
    public String toString() {
        return name;
    }
}
