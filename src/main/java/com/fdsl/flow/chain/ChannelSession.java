package com.fdsl.flow.chain;

import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.fn.BuiltinRegistry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one client connection: its endpoint parameters and the latest raw
 * value received for each subscribe-bound entity. Not thread-safe; a
 * connection's messages are processed one at a time.
 */
public final class ChannelSession {
    private final Map<String, Value> params;
    private final Map<String, Value> received = new LinkedHashMap<>();

    public ChannelSession(Map<String, Value> params) {
        this.params = new LinkedHashMap<>(params);
    }

    public ChannelSession() {
        this(Map.of());
    }

    public void receive(String entity, Value raw) {
        received.put(entity, raw);
    }

    public Value received(String entity) {
        return received.get(entity);
    }

    public boolean hasAll(Collection<String> entities) {
        return received.keySet().containsAll(entities);
    }

    public Map<String, Value> params() {
        return Collections.unmodifiableMap(params);
    }

    /** Fresh per-message context seeded with the params and the latest received values. */
    public Context newContext(BuiltinRegistry builtins) {
        Context ctx = new Context(builtins);
        params.forEach(ctx::putParam);
        received.forEach(ctx::put);
        return ctx;
    }
}
