package com.linlay.carassist.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<ToolName, BaseTool> toolsByName;

    public ToolRegistry(List<BaseTool> tools) {
        this.toolsByName = buildToolsByName(tools);
        for (ToolName name : ToolName.values()) {
            if (!toolsByName.containsKey(name)) {
                log.warn("No implementation registered for operation '{}'", name.wireName());
            }
        }
    }

    public Optional<BaseTool> find(String wireName) {
        return ToolName.fromWire(normalizeName(wireName)).map(toolsByName::get);
    }

    public List<BaseTool> list() {
        return List.copyOf(toolsByName.values());
    }

    public String description(String wireName) {
        return find(wireName).map(BaseTool::description).orElse("");
    }

    private String normalizeName(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private Map<ToolName, BaseTool> buildToolsByName(List<BaseTool> tools) {
        Map<ToolName, BaseTool> byName = new EnumMap<>(ToolName.class);
        for (BaseTool tool : tools) {
            BaseTool previous = byName.putIfAbsent(tool.name(), tool);
            if (previous != null) {
                log.warn("Duplicate implementation for '{}' ignored: {}", tool.name().wireName(), tool.getClass().getSimpleName());
            }
        }
        return byName;
    }
}
