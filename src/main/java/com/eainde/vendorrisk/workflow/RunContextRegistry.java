package com.eainde.vendorrisk.workflow;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run id → {@link RunContext}. Graph nodes only see the serializable state, so they resolve the
 * run's live resources through this registry.
 */
@Component
public class RunContextRegistry {

    private final Map<String, RunContext> contexts = new ConcurrentHashMap<>();

    public void register(RunContext context) {
        if (contexts.putIfAbsent(context.runId(), context) != null) {
            throw new IllegalStateException("Run already registered: " + context.runId());
        }
    }

    public RunContext get(String runId) {
        RunContext context = runId == null ? null : contexts.get(runId);
        if (context == null) {
            throw new IllegalStateException("No active run with id " + runId);
        }
        return context;
    }

    public void remove(String runId) {
        RunContext context = contexts.remove(runId);
        if (context != null) {
            context.close();
        }
    }

    public int activeRuns() {
        return contexts.size();
    }
}
