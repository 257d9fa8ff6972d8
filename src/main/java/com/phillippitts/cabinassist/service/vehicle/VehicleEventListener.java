package com.phillippitts.cabinassist.service.vehicle;

import java.util.Map;

/**
 * Receives asynchronous events raised by the vehicle (fuel level, doors, maintenance...).
 */
@FunctionalInterface
public interface VehicleEventListener {

    void onVehicleEvent(String eventType, Map<String, Object> payload);
}
