package com.linlay.carassist.resolve;

public record IdentifierField(
        String argName,
        String column,
        boolean fuzzy,
        boolean integer,
        boolean vehicleId
) {

    public static final IdentifierField CAR_ID = new IdentifierField("car_id", "id", false, true, true);
    public static final IdentifierField VIN = new IdentifierField("vin", "vin", false, false, false);
    public static final IdentifierField MODEL = new IdentifierField("model", "model", true, false, false);
    public static final IdentifierField MAKE = new IdentifierField("make", "make", true, false, false);
    public static final IdentifierField YEAR = new IdentifierField("year", "year", false, true, false);
}
