package com.linlay.carassist.tool;

import com.linlay.carassist.resolve.ResolutionFamily;

import java.util.List;
import java.util.Optional;

public interface BaseTool {

    ToolName name();

    default String description() {
        return "";
    }

    default List<String> argumentNames() {
        return List.of();
    }

    default boolean mutating() {
        return false;
    }

    default Optional<ResolutionFamily> resolution() {
        return Optional.empty();
    }

    default boolean patch() {
        return false;
    }

    ToolResult invoke(ToolInvocation invocation);
}
