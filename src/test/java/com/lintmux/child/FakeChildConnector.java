package com.lintmux.child;

import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.ChildSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out {@link FakeChildConnection}s by child name and records every start.
 */
public class FakeChildConnector implements ChildConnector {

    private final Map<String, FakeChildConnection> prepared = new HashMap<>();
    private final Map<ChildIdentity, FakeChildConnection> connected = new HashMap<>();
    private final List<ChildIdentity> starts = new ArrayList<>();
    private final List<String> refused = new ArrayList<>();

    /** The next connection made to a child named {@code name}. */
    public FakeChildConnector prepare(String name, FakeChildConnection connection) {
        prepared.put(name, connection);
        return this;
    }

    public FakeChildConnector refuse(String name) {
        refused.add(name);
        return this;
    }

    @Override
    public ChildConnection connect(ChildSpec spec) {
        starts.add(spec.identity());
        if (refused.contains(spec.name())) {
            throw new ChildConnectionException("cannot start " + spec.name());
        }
        FakeChildConnection connection = prepared.remove(spec.name());
        if (connection == null) {
            connection = new FakeChildConnection();
        }
        connected.put(spec.identity(), connection);
        return connection;
    }

    public FakeChildConnection connection(ChildIdentity identity) {
        return connected.get(identity);
    }

    public List<ChildIdentity> starts() {
        return starts;
    }
}
