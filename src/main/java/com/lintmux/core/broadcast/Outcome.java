package com.lintmux.core.broadcast;

import com.lintmux.child.ChildFailure;
import com.lintmux.child.ChildLink;

/**
 * Result of one child's part in a broadcast: its value, or the failure with
 * its trace. Failures travel as values so they never cross the asynchronous
 * boundary as exceptions.
 */
public sealed interface Outcome<T> {

    ChildLink link();

    static <T> Outcome<T> success(ChildLink link, T value) {
        return new Success<>(link, value);
    }

    static <T> Outcome<T> failure(ChildLink link, ChildFailure failure) {
        return new Failure<>(link, failure);
    }

    record Success<T>(ChildLink link, T value) implements Outcome<T> {}

    record Failure<T>(ChildLink link, ChildFailure failure) implements Outcome<T> {}
}
