package com.fdsl.flow;

import com.fdsl.flow.api.Context;
import com.fdsl.flow.api.ExecutionListener;
import com.fdsl.flow.api.Value;
import com.fdsl.flow.chain.ChannelRunner;
import com.fdsl.flow.chain.DuplexChannel;
import com.fdsl.flow.engine.FetchFunction;
import com.fdsl.flow.engine.PlanExecutor;
import com.fdsl.flow.fn.BuiltinRegistry;
import com.fdsl.flow.graph.DependencyGraph;
import com.fdsl.flow.graph.EndpointBinding;
import com.fdsl.flow.graph.GraphBuilder;
import com.fdsl.flow.io.Direction;
import com.fdsl.flow.io.ModelDefinition;
import com.fdsl.flow.io.ModelJson;
import com.fdsl.flow.plan.ExecutionPlan;
import com.fdsl.flow.plan.ExecutionPlanner;
import com.fdsl.flow.plan.PlanMode;
import com.fdsl.flow.util.CompositeExecutionListener;
import com.fdsl.flow.util.GraphExplain;
import com.fdsl.flow.util.LoggingExecutionListener;
import com.fdsl.flow.wiring.MessageBus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * High-level entry point that wires the engine together.
 *
 * <p>
 * This class handles:
 * <ul>
 * <li>Building the {@link DependencyGraph} once from a metamodel</li>
 * <li>Planning targets through a caching {@link ExecutionPlanner}</li>
 * <li>Executing plans and REST endpoints with an injected
 * {@link FetchFunction}</li>
 * <li>Resolving and caching WebSocket {@link DuplexChannel}s</li>
 * <li>Creating {@link MessageBus} instances for shared external sources</li>
 * </ul>
 * Everything built here is immutable and shared; only the plan and channel
 * caches grow.
 */
@Log4j2
public class FlowEngine {
    private final EngineConfig config;
    private final DependencyGraph graph;
    private final ExecutionPlanner planner;
    private final PlanExecutor executor;
    private final CompositeExecutionListener listeners = new CompositeExecutionListener();
    private final LoggingExecutionListener stats;
    private final Map<String, DuplexChannel> channels = new ConcurrentHashMap<>();

    public FlowEngine(ModelDefinition model) {
        this(model, EngineConfig.load());
    }

    public FlowEngine(ModelDefinition model, EngineConfig config) {
        this(model, config, BuiltinRegistry.standard());
    }

    public FlowEngine(ModelDefinition model, EngineConfig config, BuiltinRegistry builtins) {
        config.validate();
        this.config = config;
        this.graph = new GraphBuilder(builtins).build(model);
        this.planner = new ExecutionPlanner(graph, config.isPlanCache());
        this.executor = new PlanExecutor(graph);
        this.executor.setListener(listeners);
        if (config.isExecutionLogging()) {
            this.stats = new LoggingExecutionListener(config.getErrorThrottleMillis());
            listeners.add(stats);
        } else {
            this.stats = null;
        }
        log.info("Flow engine ready: {}", graph);
        if (log.isDebugEnabled())
            log.debug("\n{}", new GraphExplain(graph).dumpTopology());
    }

    /** Loads a metamodel bundled as a classpath resource. */
    public static FlowEngine fromResource(String resource) {
        return new FlowEngine(ModelJson.parseResource(resource));
    }

    public static FlowEngine fromFile(Path path) {
        try {
            return new FlowEngine(ModelJson.parseFile(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load model from " + path, e);
        }
    }

    public DependencyGraph graph() {
        return graph;
    }

    public EngineConfig config() {
        return config;
    }

    public ExecutionPlanner planner() {
        return planner;
    }

    public ExecutionPlan plan(String target) {
        return planner.plan(target);
    }

    public ExecutionPlan plan(String target, PlanMode mode) {
        return planner.plan(target, mode);
    }

    public Context newContext() {
        return new Context(graph.builtins());
    }

    public Context newContext(Map<String, Value> params) {
        Context ctx = newContext();
        params.forEach(ctx::putParam);
        return ctx;
    }

    public Value execute(String target, Context context, FetchFunction fetchFn) {
        return execute(planner.plan(target), context, fetchFn);
    }

    public Value execute(ExecutionPlan plan, Context context, FetchFunction fetchFn) {
        return executor.execute(plan, context, fetchFn);
    }

    /**
     * Serves a REST endpoint: binds the request body to the request entity and
     * the params to the context, then materializes the response entity. Write
     * methods plan in {@link PlanMode#MUTATION}.
     */
    public Value executeEndpoint(String endpoint, Map<String, Value> params, Value body, FetchFunction fetchFn) {
        EndpointBinding ep = graph.endpoint(endpoint)
                .orElseThrow(() -> new IllegalArgumentException("Unknown endpoint: " + endpoint));
        if (ep.isDuplex())
            throw new IllegalArgumentException(endpoint + " is a WebSocket endpoint; use channel()");
        if (ep.response() == null)
            throw new IllegalArgumentException(endpoint + " declares no response entity");
        PlanMode mode = Direction.fromHttpMethod(ep.method()) == Direction.WRITE ? PlanMode.MUTATION : PlanMode.READ;
        Context ctx = newContext(params);
        if (ep.request() != null && body != null)
            ctx.put(ep.request(), body);
        return executor.execute(planner.plan(ep.response(), mode), ctx, fetchFn);
    }

    /** Resolved channel of a WebSocket endpoint, built on first use. */
    public DuplexChannel channel(String endpoint) {
        return channels.computeIfAbsent(endpoint, name -> {
            EndpointBinding ep = graph.endpoint(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown endpoint: " + name));
            DuplexChannel ch = DuplexChannel.of(graph, planner, ep);
            log.info("Channel {}: inbound {}, outbound {}", name, ch.inbound(), ch.outbound());
            return ch;
        });
    }

    public ChannelRunner channelRunner(String endpoint, FetchFunction fetchFn) {
        return new ChannelRunner(graph, channel(endpoint), executor, fetchFn);
    }

    /** New bus sized and configured from {@link EngineConfig}; the caller closes it. */
    public MessageBus newMessageBus() {
        return new MessageBus(config.getBusRingSize(), config.isBusKeepLast(), config.getErrorThrottleMillis());
    }

    public FlowEngine addListener(ExecutionListener listener) {
        listeners.add(listener);
        return this;
    }

    /** Execution statistics, or null when execution logging is disabled. */
    public LoggingExecutionListener stats() {
        return stats;
    }

    public GraphExplain explain() {
        return new GraphExplain(graph);
    }
}
