package com.lintmux.core.state;

import com.lintmux.core.events.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A small dependency graph of named inputs and values derived from them.
 *
 * <p>Derived values may only depend on keys defined before them, so definition
 * order is a topological order. {@link #setInput} recomputes every affected
 * derived value synchronously, then notifies listeners of each key whose value
 * is no longer {@code equals} to the previous one, in registration order.
 *
 * <p>Not thread-safe: the store is owned by the orchestrator loop.
 */
public class ReactiveStore {

    private static final Logger log = LoggerFactory.getLogger(ReactiveStore.class);

    private final Map<StateKey<?>, Node<?>> nodes = new LinkedHashMap<>();
    private boolean disposed;

    /**
     * Defines an input with its initial value.
     */
    public <T> void defineInput(StateKey<T> key, T initial) {
        ensureUndefined(key);
        nodes.put(key, new Node<>(key, List.of(), null, initial));
    }

    /**
     * Defines a value computed from other keys. Computed once immediately.
     *
     * @param key     the derived key
     * @param compute reads its dependencies from the store and returns the value
     * @param deps    keys this value is recomputed on
     */
    @SafeVarargs
    public final <T> void defineDerived(StateKey<T> key, Function<ReactiveStore, T> compute, StateKey<?>... deps) {
        ensureUndefined(key);
        for (StateKey<?> dep : deps) {
            if (!nodes.containsKey(dep)) {
                throw new IllegalArgumentException("Derived value " + key + " depends on undefined key " + dep);
            }
        }
        nodes.put(key, new Node<>(key, Arrays.asList(deps), compute, compute.apply(this)));
    }

    public <T> T read(StateKey<T> key) {
        return node(key).value;
    }

    /**
     * Overwrites an input and recomputes everything depending on it.
     */
    public <T> void setInput(StateKey<T> key, T value) {
        if (disposed) {
            throw new IllegalStateException("Store disposed, cannot set " + key);
        }
        Node<T> input = node(key);
        if (input.isDerived()) {
            throw new IllegalArgumentException(key + " is a derived value, not an input");
        }

        var changes = new ArrayList<Change<?>>();
        Set<StateKey<?>> dirty = new HashSet<>();
        dirty.add(key);
        T previous = input.value;
        input.value = value;
        if (!Objects.equals(previous, value)) {
            changes.add(new Change<>(input, previous, value));
        }

        for (Node<?> node : nodes.values()) {
            if (node.isDerived() && node.dependsOnAny(dirty)) {
                recompute(node, dirty, changes);
            }
        }

        for (Change<?> change : changes) {
            change.deliver();
        }
    }

    /**
     * Listens to changes of a key. The listener receives {@code (previous, current)}.
     */
    public <T> Subscription listen(StateKey<T> key, BiConsumer<T, T> listener) {
        Node<T> node = node(key);
        node.listeners.add(listener);
        return () -> node.listeners.remove(listener);
    }

    /**
     * Drops every listener. Inputs can no longer be set afterwards.
     */
    public void dispose() {
        disposed = true;
        for (Node<?> node : nodes.values()) {
            node.listeners.clear();
        }
        log.debug("Store disposed");
    }

    public boolean isDisposed() {
        return disposed;
    }

    private <T> void recompute(Node<T> node, Set<StateKey<?>> dirty, List<Change<?>> changes) {
        T previous = node.value;
        T current = node.compute.apply(this);
        node.value = current;
        if (!Objects.equals(previous, current)) {
            dirty.add(node.key);
            changes.add(new Change<>(node, previous, current));
        }
    }

    @SuppressWarnings("unchecked")
    private <T> Node<T> node(StateKey<T> key) {
        Node<?> node = nodes.get(key);
        if (node == null) {
            throw new IllegalArgumentException("Unknown state key " + key);
        }
        return (Node<T>) node;
    }

    private void ensureUndefined(StateKey<?> key) {
        if (nodes.containsKey(key)) {
            throw new IllegalArgumentException("State key " + key + " already defined");
        }
    }

    private static final class Node<T> {
        private final StateKey<T> key;
        private final List<StateKey<?>> deps;
        private final Function<ReactiveStore, T> compute;
        private final CopyOnWriteArrayList<BiConsumer<T, T>> listeners = new CopyOnWriteArrayList<>();
        private T value;

        private Node(StateKey<T> key, List<StateKey<?>> deps, Function<ReactiveStore, T> compute, T value) {
            this.key = key;
            this.deps = deps;
            this.compute = compute;
            this.value = value;
        }

        boolean isDerived() {
            return compute != null;
        }

        boolean dependsOnAny(Set<StateKey<?>> keys) {
            for (StateKey<?> dep : deps) {
                if (keys.contains(dep)) return true;
            }
            return false;
        }
    }

    private record Change<T>(Node<T> node, T previous, T current) {
        void deliver() {
            for (BiConsumer<T, T> listener : node.listeners) {
                try {
                    listener.accept(previous, current);
                } catch (Exception e) {
                    log.warn("Listener of {} threw exception: {}", node.key, e.getMessage(), e);
                }
            }
        }
    }
}
