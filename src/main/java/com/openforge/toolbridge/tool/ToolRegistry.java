package com.openforge.toolbridge.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Catalogue of invocable tools, keyed by exact name.
 *
 * Registration happens once while the application context starts
 * (see ToolCatalogueConfig); afterwards the registry is only read and can be
 * shared freely between concurrent turns. Specs are immutable records.
 *
 * The registry is passed to the parser, the orchestrator and the controllers
 * as a normal bean; nothing looks it up statically.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolSpec> specs = new ConcurrentHashMap<>();
    private final List<ToolSpec> ordered = new CopyOnWriteArrayList<>();

    public synchronized void register(ToolSpec spec) {
        if (specs.putIfAbsent(spec.name(), spec) != null) {
            throw new DuplicateToolException(spec.name());
        }
        ordered.add(spec);
        log.info("[ToolRegistry] Registered tool '{}' args={}", spec.name(), spec.argumentShape());
    }

    /** Exact-match lookup; "Post_Call" does not find "post_call". */
    public ToolSpec lookup(String name) {
        ToolSpec spec = name == null ? null : specs.get(name);
        if (spec == null) {
            throw new UnknownToolException(name);
        }
        return spec;
    }

    public Map<String, ArgumentSpec> schemaFor(String name) {
        return lookup(name).argumentSchema();
    }

    public boolean contains(String name) {
        return name != null && specs.containsKey(name);
    }

    /** All specs in registration order. */
    public List<ToolSpec> catalogue() {
        return List.copyOf(ordered);
    }

    /** Every entity kind any tool argument refers to, e.g. ["post"]. */
    public Set<String> entityKinds() {
        Set<String> kinds = new LinkedHashSet<>();
        for (ToolSpec spec : ordered) {
            spec.argumentSchema().values().stream()
                    .filter(ArgumentSpec::isReference)
                    .forEach(a -> kinds.add(a.entityKind()));
        }
        return kinds;
    }
}
