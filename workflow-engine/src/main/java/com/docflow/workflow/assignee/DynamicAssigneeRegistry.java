package com.docflow.workflow.assignee;

import com.docflow.workflow.gateway.DocumentSnapshot;
import com.docflow.workflow.model.WorkflowStep;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of {@link DynamicAssigneeResolver}s.
 *
 * All resolver beans are collected at startup via constructor injection.
 * Every call is timed:
 * <pre>
 *   docflow.assignee.resolve{resolver, status="success|error|unknown"}
 * </pre>
 * A missing resolver or a failing one yields an empty assignee set.
 */
@Component
public class DynamicAssigneeRegistry {

    private static final Logger log = LoggerFactory.getLogger(DynamicAssigneeRegistry.class);

    private final Map<String, DynamicAssigneeResolver> resolvers = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public DynamicAssigneeRegistry(List<DynamicAssigneeResolver> allResolvers, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (DynamicAssigneeResolver resolver : allResolvers) {
            resolvers.put(resolver.name(), resolver);
            log.info("Registered dynamic assignee resolver '{}'", resolver.name());
        }
    }

    public Set<String> resolve(String name, WorkflowStep step, DocumentSnapshot document, String actor) {
        DynamicAssigneeResolver resolver = name == null ? null : resolvers.get(name);
        if (resolver == null) {
            log.warn("No dynamic assignee resolver named '{}' (step '{}')", name, step.getStepName());
            meterRegistry.counter("docflow.assignee.unknown", "resolver", String.valueOf(name)).increment();
            return Set.of();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            Set<String> result = resolver.resolve(step, document, actor);
            return result == null ? Set.of() : new LinkedHashSet<>(result);
        } catch (Exception e) {
            status = "error";
            log.warn("Dynamic assignee resolver '{}' failed for step '{}': {}",
                    name, step.getStepName(), e.getMessage());
            return Set.of();
        } finally {
            sample.stop(meterRegistry.timer("docflow.assignee.resolve", "resolver", name, "status", status));
        }
    }
}
