package com.linlay.carassist.tool;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum ToolName {

    GET_BUYER_AVAILABILITY("get_buyer_availability"),
    ADD_BUYER_SCHEDULE("add_buyer_schedule"),
    CAR_RETRIEVE("car_retrieve"),
    CAR_UPDATE("car_update"),
    CAR_ADD("car_add"),
    GET_ALL_CARS("get_all_cars"),
    PICKUP_RETRIEVE("pickup_retrieve"),
    PICKUP_UPDATE("pickup_update"),
    PICKUP_ADD("pickup_add"),
    GET_ALL_PICKUPS("get_all_pickups"),
    GET_CLOSEST("get_closest"),
    SEND_ESCALATE_MESSAGE("send_escalate_message");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ToolName> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(value -> value.wireName.equals(name))
                .findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(ToolName::wireName).toList();
    }
}
