package com.phillippitts.cabinassist.service.nlu;

import com.phillippitts.cabinassist.domain.NluResult;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-based intent classifier and regex entity extractor.
 *
 * <p>Each intent owns a keyword list; the intent with the most whole-word matches wins, ties going
 * to the intent listed first. Confidence grows with the number of matches: 0.8 for one, 0.95 for
 * two or more. No match yields {@code unknown} at 0.4.
 *
 * <p>Entities: {@code temperature}, {@code fan_speed}, {@code destination}, {@code volume} and the
 * media {@code action}.
 */
public class KeywordLanguageUnderstanding implements LanguageUnderstanding {

    private static final Logger LOG = LogManager.getLogger(KeywordLanguageUnderstanding.class);

    public static final String GREETING = "greeting";
    public static final String FAREWELL = "farewell";
    public static final String HELP = "help";
    public static final String CLIMATE_CONTROL = "climate_control";
    public static final String NAVIGATION = "navigation";
    public static final String MEDIA_CONTROL = "media_control";
    public static final String VEHICLE_STATUS = "vehicle_status";
    public static final String SETTINGS = "settings";

    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(FAREWELL, List.of("goodbye", "bye", "that's all", "never mind", "cancel"));
        KEYWORDS.put(GREETING, List.of("hello", "hi", "hey", "good morning", "good evening"));
        KEYWORDS.put(HELP, List.of("help", "what can you do"));
        KEYWORDS.put(CLIMATE_CONTROL, List.of("temperature", "temp", "degrees", "warmer", "cooler", "colder",
                "hotter", "heat", "heating", "air conditioning", "ac", "fan", "climate"));
        KEYWORDS.put(NAVIGATION, List.of("navigate", "directions", "take me", "route", "drive to", "go to"));
        KEYWORDS.put(MEDIA_CONTROL, List.of("play", "music", "radio", "volume", "pause", "next track", "skip",
                "song"));
        KEYWORDS.put(VEHICLE_STATUS, List.of("fuel", "battery", "range", "tire", "status", "gas"));
        KEYWORDS.put(SETTINGS, List.of("settings", "setting", "lights", "seat", "mirror", "lock"));
    }

    private static final Map<String, Pattern> KEYWORD_PATTERNS = new LinkedHashMap<>();

    static {
        KEYWORDS.forEach((intent, words) -> KEYWORD_PATTERNS.put(intent, Pattern.compile(
                "\\b(" + String.join("|", words.stream().map(Pattern::quote).toList()) + ")\\b")));
    }

    private static final Pattern TEMPERATURE = Pattern.compile(
            "(?:temperature|temp|degrees)\\D{0,12}?(\\d{1,2}(?:\\.\\d)?)|(\\d{1,2}(?:\\.\\d)?)\\s*(?:degrees|°)");
    private static final Pattern FAN_SPEED = Pattern.compile("fan(?: speed)?(?: to)? (\\d)");
    private static final Pattern DESTINATION = Pattern.compile(
            "(?:navigate|directions|take me|drive|go) to (?:the )?([\\p{L}0-9' ,.-]+?)[.!?]*$");
    private static final Pattern VOLUME = Pattern.compile("volume(?: to| at)? (\\d{1,3})");
    private static final Pattern MEDIA_ACTION = Pattern.compile("\\b(play|pause|skip|next|resume|stop)\\b");

    private volatile boolean running;

    @Override
    public NluResult process(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
        String bestIntent = NluResult.UNKNOWN_INTENT;
        int bestMatches = 0;
        for (Map.Entry<String, Pattern> entry : KEYWORD_PATTERNS.entrySet()) {
            int matches = countMatches(entry.getValue(), normalized);
            if (matches > bestMatches) {
                bestIntent = entry.getKey();
                bestMatches = matches;
            }
        }
        double confidence = bestMatches == 0 ? 0.4 : bestMatches == 1 ? 0.8 : 0.95;
        Map<String, Object> entities = extractEntities(normalized);
        LOG.debug("Classified intent={} confidence={} entities={}", bestIntent, confidence, entities.keySet());
        return new NluResult(bestIntent, entities, confidence);
    }

    static Map<String, Object> extractEntities(String normalized) {
        Map<String, Object> entities = new LinkedHashMap<>();
        Matcher temperature = TEMPERATURE.matcher(normalized);
        if (temperature.find()) {
            String raw = temperature.group(1) != null ? temperature.group(1) : temperature.group(2);
            entities.put("temperature", raw.contains(".") ? (Object) Double.valueOf(raw) : (Object) Integer.valueOf(raw));
        }
        Matcher fan = FAN_SPEED.matcher(normalized);
        if (fan.find()) {
            entities.put("fan_speed", Integer.valueOf(fan.group(1)));
        }
        Matcher destination = DESTINATION.matcher(normalized);
        if (destination.find()) {
            entities.put("destination", destination.group(1).trim());
        }
        Matcher volume = VOLUME.matcher(normalized);
        if (volume.find()) {
            entities.put("volume", Integer.valueOf(volume.group(1)));
        }
        Matcher action = MEDIA_ACTION.matcher(normalized);
        if (action.find()) {
            entities.put("action", action.group(1));
        }
        return entities;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    @Override
    public String name() {
        return ComponentNames.NLU;
    }

    @Override
    public void start() {
        running = true;
        LOG.info("Keyword language understanding ready ({} intents)", KEYWORDS.size());
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
