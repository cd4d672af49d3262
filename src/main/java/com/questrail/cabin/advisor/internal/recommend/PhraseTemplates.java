package com.questrail.cabin.advisor.internal.recommend;

import com.questrail.cabin.api.VehicleAction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Template pool for recommendation messages.
 *
 * <p>Suggestions are prefixed with a greeting. {@code {value}} is replaced by
 * the suggested setting. Lighting suggestions are fixed sentences.</p>
 */
final class PhraseTemplates
{
    static final List<String> GREETINGS = List.of(
            "Hello! Based on your preferences,",
            "Hi! I noticed you usually prefer this, so",
            "Hello! From your driving patterns,",
            "Hi again! Your typical routine suggests"
    );

    static final Map<VehicleAction, List<String>> SUGGESTIONS;

    static final Map<VehicleAction, String> STANDALONE = new EnumMap<>(Map.of(
            VehicleAction.LIGHTS_TURN_ON,
            "It's getting dark, would you like me to turn on the ambient lights for a cozy atmosphere?",
            VehicleAction.LIGHTS_TURN_OFF,
            "It's bright outside, would you like me to turn off the ambient lights to save energy?"
    ));

    static final List<String> BREAK_REMINDERS = List.of(
            "You've been driving for a while now. Would you like to take a break? Your safety is important!",
            "Time for a quick break! You've been on the road for a while. Shall we find a rest stop?",
            "Hey there! Consider taking a short break - you've been driving for quite some time now.",
            "Safety first! You've been driving continuously. Would you like to take a breather?"
    );

    static {
        Map<VehicleAction, List<String>> m = new EnumMap<>(VehicleAction.class);
        m.put(VehicleAction.CLIMATE_TURN_ON, List.of(
                "would you like me to turn on the climate control?",
                "should I start the climate system for you?",
                "shall we get the climate going?"));
        m.put(VehicleAction.CLIMATE_SET_TEMPERATURE, List.of(
                "would you like to set the temperature to {value}°C?",
                "should I adjust the temperature to your usual {value}°C?",
                "shall we set it to your preferred {value}°C?"));
        m.put(VehicleAction.INFOTAINMENT_PLAY, List.of(
                "would you like to listen to some music?",
                "should I start playing your music?",
                "shall we get some tunes going?"));
        m.put(VehicleAction.INFOTAINMENT_SET_VOLUME, List.of(
                "would you like to set the volume to {value}%?",
                "should I adjust the volume to your usual {value}%?",
                "shall we set the volume to {value}%?"));
        m.put(VehicleAction.SEATS_HEAT_ON, List.of(
                "would you like me to warm up your seat?",
                "should I turn on the seat heating?",
                "shall we get your seat nice and warm?"));
        m.put(VehicleAction.SEATS_ADJUST, List.of(
                "would you like me to adjust your seat to position {value}?",
                "should I move your seat to your usual position {value}?",
                "shall we adjust the seat to your preferred setting?"));
        SUGGESTIONS = m;
    }

    private PhraseTemplates() {}
}
