package com.phillippitts.cabinassist.service.telemetry;

import com.phillippitts.cabinassist.domain.DialogueResponse;
import com.phillippitts.cabinassist.domain.NluResult;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;

import java.util.Map;

/**
 * Telemetry sink. Calls must never fail the caller; implementations log and drop on error.
 */
public interface Telemetry extends ManagedComponent {

    void logEvent(String name, Map<String, Object> payload);

    void logInteraction(String input, NluResult nluResult, DialogueResponse response);
}
