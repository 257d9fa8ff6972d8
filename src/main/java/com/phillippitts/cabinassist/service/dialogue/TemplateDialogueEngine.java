package com.phillippitts.cabinassist.service.dialogue;

import com.phillippitts.cabinassist.domain.CommandType;
import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.domain.DialogueResponse;
import com.phillippitts.cabinassist.domain.NluResult;
import com.phillippitts.cabinassist.domain.PendingCommand;
import com.phillippitts.cabinassist.domain.ProactiveNotification;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import com.phillippitts.cabinassist.service.nlu.KeywordLanguageUnderstanding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Template-based dialogue: one response template per intent, vehicle commands built from entities.
 *
 * <p>Proactive triggers:
 * <ul>
 *   <li>{@code low_fuel}: fuel level at or below {@value #LOW_FUEL_PERCENT}%</li>
 *   <li>{@code low_battery}: battery level at or below {@value #LOW_BATTERY_PERCENT}%</li>
 *   <li>{@code door_open}: a door is open while the vehicle moves</li>
 *   <li>{@code maintenance_due}: always announced</li>
 * </ul>
 * Events carrying no level are announced unconditionally.
 */
public class TemplateDialogueEngine implements DialogueEngine {

    private static final Logger LOG = LogManager.getLogger(TemplateDialogueEngine.class);

    static final int LOW_FUEL_PERCENT = 15;
    static final int LOW_BATTERY_PERCENT = 20;

    private volatile boolean running;

    @Override
    public DialogueResponse processTurn(NluResult nlu, ConversationContext context) {
        Map<String, Object> e = nlu.entities();
        DialogueResponse response = switch (nlu.intent()) {
            case KeywordLanguageUnderstanding.GREETING ->
                    DialogueResponse.speech("Hello! How can I help you?", false);
            case KeywordLanguageUnderstanding.FAREWELL ->
                    DialogueResponse.speech("Goodbye! Have a safe drive.", true);
            case KeywordLanguageUnderstanding.HELP -> DialogueResponse.speech(
                    "I can adjust the climate, navigate, control your media and check the vehicle status.", false);
            case KeywordLanguageUnderstanding.CLIMATE_CONTROL -> climate(e);
            case KeywordLanguageUnderstanding.NAVIGATION -> navigation(e);
            case KeywordLanguageUnderstanding.MEDIA_CONTROL -> media(e);
            case KeywordLanguageUnderstanding.VEHICLE_STATUS -> status(context);
            case KeywordLanguageUnderstanding.SETTINGS -> DialogueResponse.speech(
                    "Which setting would you like to change?", false);
            default -> DialogueResponse.speech("I'm not sure how to help with that. Could you rephrase?", false);
        };
        LOG.debug("Dialogue intent={} commands={} end={}", nlu.intent(), response.commands().size(),
                response.endConversation());
        return response;
    }

    @Override
    public Optional<ProactiveNotification> checkProactiveTrigger(String eventType,
                                                                 Map<String, Object> eventData,
                                                                 ConversationContext context) {
        return switch (eventType) {
            case "low_fuel" -> belowThreshold(eventData, "fuel_level", LOW_FUEL_PERCENT)
                    ? Optional.of(new ProactiveNotification(eventType,
                    "Your fuel is running low" + level(eventData, "fuel_level")
                            + ". Would you like me to find a gas station?", List.of()))
                    : Optional.empty();
            case "low_battery" -> belowThreshold(eventData, "battery_level", LOW_BATTERY_PERCENT)
                    ? Optional.of(new ProactiveNotification(eventType,
                    "Battery charge is low" + level(eventData, "battery_level")
                            + ". Consider charging soon.", List.of()))
                    : Optional.empty();
            case "door_open" -> moving(eventData, context)
                    ? Optional.of(new ProactiveNotification(eventType,
                    "Warning: a door is open.", List.of()))
                    : Optional.empty();
            case "maintenance_due" -> Optional.of(new ProactiveNotification(eventType,
                    "Your vehicle is due for maintenance.", List.of()));
            default -> Optional.empty();
        };
    }

    private static DialogueResponse climate(Map<String, Object> e) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (e.containsKey("temperature")) {
            params.put("temperature", e.get("temperature"));
        }
        if (e.containsKey("fan_speed")) {
            params.put("fan_speed", e.get("fan_speed"));
        }
        if (params.isEmpty()) {
            return DialogueResponse.speech("What temperature would you like?", false);
        }
        String speech = params.containsKey("temperature")
                ? "Setting the temperature to " + params.get("temperature") + " degrees."
                : "Setting the fan speed to " + params.get("fan_speed") + ".";
        return withCommand(speech, PendingCommand.of(CommandType.CLIMATE_CONTROL, params));
    }

    private static DialogueResponse navigation(Map<String, Object> e) {
        Object destination = e.get("destination");
        if (destination == null) {
            return DialogueResponse.speech("Where would you like to go?", false);
        }
        return withCommand("Starting navigation to " + destination + ".",
                PendingCommand.of(CommandType.NAVIGATION, Map.of("destination", destination)));
    }

    private static DialogueResponse media(Map<String, Object> e) {
        if (e.containsKey("volume")) {
            return withCommand("Setting the volume to " + e.get("volume") + ".",
                    PendingCommand.of(CommandType.MEDIA, Map.of("action", "volume", "content", e.get("volume"))));
        }
        String action = (String) e.getOrDefault("action", "play");
        return withCommand("OK, " + action + ".", PendingCommand.of(CommandType.MEDIA, Map.of("action", action)));
    }

    private static DialogueResponse status(ConversationContext context) {
        if (!(context.vehicleState().get("vehicle") instanceof Map<?, ?> v)) {
            return DialogueResponse.speech("I don't have the vehicle status right now.", false);
        }
        return DialogueResponse.speech("Fuel is at " + v.get("fuel_level") + " percent and the battery at "
                + v.get("battery_level") + " percent.", false);
    }

    private static DialogueResponse withCommand(String speech, PendingCommand command) {
        return new DialogueResponse(speech, List.of(command), Map.of("last_command", command.type()), false);
    }

    private static boolean belowThreshold(Map<String, Object> data, String key, int threshold) {
        Object value = data.get(key);
        return !(value instanceof Number n) || n.doubleValue() <= threshold;
    }

    private static String level(Map<String, Object> data, String key) {
        return data.get(key) instanceof Number n ? " at " + n.intValue() + " percent" : "";
    }

    private static boolean moving(Map<String, Object> data, ConversationContext context) {
        Object speed = data.get("speed");
        if (speed == null && context.vehicleState().get("vehicle") instanceof Map<?, ?> vehicle) {
            speed = vehicle.get("speed");
        }
        return !(speed instanceof Number n) || n.doubleValue() > 0;
    }

    @Override
    public String name() {
        return ComponentNames.DIALOGUE_MANAGER;
    }

    @Override
    public void start() {
        running = true;
        LOG.info("Template dialogue engine ready");
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean healthCheck() {
        return running;
    }
}
