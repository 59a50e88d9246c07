package com.linlay.carassist.backend;

import java.util.LinkedHashMap;
import java.util.Map;

public enum PayloadShape {

    MINIMAL {
        @Override
        public Map<String, Object> build(String userId, String sessionId, String message) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("user_id", userId);
            payload.put("session_id", sessionId);
            payload.put("message", message);
            return payload;
        }
    },
    LEGACY {
        @Override
        public Map<String, Object> build(String userId, String sessionId, String message) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("action", "create");
            payload.put("message", message);
            payload.put("user_id", userId);
            payload.put("session_id", sessionId);
            payload.put("car", placeholderCar());
            return payload;
        }
    };

    public abstract Map<String, Object> build(String userId, String sessionId, String message);

    // the legacy endpoint insists on a vehicle object even when none is discussed
    private static Map<String, Object> placeholderCar() {
        Map<String, Object> car = new LinkedHashMap<>();
        car.put("vin", "");
        car.put("year", -1);
        car.put("make", "");
        car.put("model", "");
        car.put("trim", "");
        car.put("mileage", -1);
        car.put("condition", 0);
        car.put("color", "blue");
        car.put("region", "WC");
        return car;
    }
}
