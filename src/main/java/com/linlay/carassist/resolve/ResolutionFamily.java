package com.linlay.carassist.resolve;

import com.linlay.carassist.storage.Table;

import java.util.ArrayList;
import java.util.List;

public enum ResolutionFamily {

    VEHICLE(Table.CARS, "car_id", List.of(
            IdentifierField.VIN,
            IdentifierField.MODEL,
            IdentifierField.MAKE,
            IdentifierField.YEAR
    )),
    PICKUP(Table.PICKUP, "pick_up_id", List.of(
            IdentifierField.CAR_ID,
            IdentifierField.VIN,
            IdentifierField.MODEL,
            IdentifierField.MAKE,
            IdentifierField.YEAR
    ));

    private final Table table;
    private final String directKey;
    private final List<IdentifierField> vehicleChain;

    ResolutionFamily(Table table, String directKey, List<IdentifierField> vehicleChain) {
        this.table = table;
        this.directKey = directKey;
        this.vehicleChain = vehicleChain;
    }

    public Table table() {
        return table;
    }

    public String directKey() {
        return directKey;
    }

    public List<IdentifierField> vehicleChain() {
        return vehicleChain;
    }

    public List<String> acceptedFields() {
        ArrayList<String> fields = new ArrayList<>();
        fields.add(directKey);
        for (IdentifierField field : vehicleChain) {
            if (!fields.contains(field.argName())) {
                fields.add(field.argName());
            }
        }
        return List.copyOf(fields);
    }
}
