package com.linlay.carassist.tool;

import com.linlay.carassist.resolve.Resolution;
import com.linlay.carassist.session.SessionContext;

import java.util.Map;

public record ToolInvocation(
        Map<String, Object> args,
        SessionContext session,
        Resolution resolution
) {

    public ToolInvocation {
        args = args == null ? Map.of() : args;
    }

    public Object arg(String key) {
        return args.get(key);
    }

    public String text(String key) {
        Object value = args.get(key);
        return value == null ? "" : String.valueOf(value).trim();
    }
}
