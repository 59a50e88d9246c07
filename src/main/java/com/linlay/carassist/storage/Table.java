package com.linlay.carassist.storage;

import java.util.Set;

public enum Table {

    CARS("cars", "id", Set.of(
            "vin", "year", "make", "model", "trim", "mileage",
            "interior_condition", "exterior_condition",
            "seller_ask_cents", "buyer_offer_cents",
            "created_at", "lead_id"
    )),
    PICKUP("pickup", "pick_up_id", Set.of(
            "car_id", "address", "contact_phone", "pick_up_info", "created_at", "dropoff_time"
    )),
    BUYERS("buyers", "id", Set.of()),
    BUYER_SCHEDULE("buyer_schedule", "id", Set.of(
            "buyer_id", "description", "schedule_time", "priority"
    ));

    private final String tableName;
    private final String idColumn;
    private final Set<String> writableColumns;

    Table(String tableName, String idColumn, Set<String> writableColumns) {
        this.tableName = tableName;
        this.idColumn = idColumn;
        this.writableColumns = writableColumns;
    }

    public String tableName() {
        return tableName;
    }

    public String idColumn() {
        return idColumn;
    }

    public Set<String> writableColumns() {
        return writableColumns;
    }

    public boolean isReadableColumn(String column) {
        return idColumn.equals(column) || writableColumns.contains(column);
    }
}
