package com.phillippitts.cabinassist.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Vehicle command families understood by the command executor.
 */
public enum CommandType {
    CLIMATE_CONTROL("climate_control"),
    NAVIGATION("navigation"),
    MEDIA("media"),
    VEHICLE_SETTINGS("vehicle_settings");

    private final String wireName;

    CommandType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CommandType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
