package com.linlay.carassist.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public sealed interface Plan permits Plan.Chat, Plan.Tool {

    record Chat(String answer) implements Plan {
    }

    record Tool(String name, Map<String, Object> args) implements Plan {

        public Tool {
            args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        }
    }
}
