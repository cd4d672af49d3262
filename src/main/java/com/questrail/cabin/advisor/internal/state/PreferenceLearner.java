package com.questrail.cabin.advisor.internal.state;

import com.questrail.cabin.api.ActionEvent;
import com.questrail.cabin.api.DriverPreferences;
import com.questrail.cabin.api.VehicleAction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PreferenceLearner
 * -----------------------------------------------------------------------------
 * Derives a {@link DriverPreferences} profile from the current history window.
 *
 * <h2>Recompute-from-window</h2>
 * Each call looks only at the events passed in; nothing is accumulated across
 * calls except the prior profile, which supplies the value of every field for
 * which the window holds no evidence:
 * <ul>
 *   <li>preferred temperature / volume / seat position: floor mean of the
 *       matching set actions that carry a value, else the prior value</li>
 *   <li>likes music / likes warm seats: {@code true} when the triggering
 *       action is present, else the prior value (never reset to false)</li>
 *   <li>common actions: names seen at least twice, replaced on every call</li>
 * </ul>
 *
 * <p>Below {@link #MIN_HISTORY} events the prior profile is returned untouched
 * so that one or two samples do not produce noisy means.</p>
 */
public final class PreferenceLearner
{
    public static final int MIN_HISTORY = 3;
    static final int COMMON_ACTION_THRESHOLD = 2;

    public DriverPreferences recompute(DriverPreferences prior, List<ActionEvent> history) {
        Objects.requireNonNull(prior, "prior");
        Objects.requireNonNull(history, "history");

        if (history.size() < MIN_HISTORY) {
            return prior;
        }

        int temperature = floorMean(history, VehicleAction.CLIMATE_SET_TEMPERATURE)
                .orElse(prior.preferredTemperature());
        int volume = floorMean(history, VehicleAction.INFOTAINMENT_SET_VOLUME)
                .orElse(prior.preferredVolume());
        int seatPosition = floorMean(history, VehicleAction.SEATS_ADJUST)
                .orElse(prior.preferredSeatPosition());

        boolean likesMusic = prior.likesMusic() || contains(history, VehicleAction.INFOTAINMENT_PLAY);
        boolean likesWarmSeats = prior.likesWarmSeats() || contains(history, VehicleAction.SEATS_HEAT_ON);

        return new DriverPreferences(temperature, volume, seatPosition,
                likesMusic, likesWarmSeats, commonActions(history));
    }

    private static OptionalInt floorMean(List<ActionEvent> history, VehicleAction action) {
        double sum = 0;
        int count = 0;
        for (ActionEvent e : history) {
            if (e.is(action) && e.value() != null) {
                sum += e.value();
                count++;
            }
        }
        if (count == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) Math.floor(sum / count));
    }

    private static boolean contains(List<ActionEvent> history, VehicleAction action) {
        return history.stream().anyMatch(e -> e.is(action));
    }

    private static Set<String> commonActions(List<ActionEvent> history) {
        Map<String, Long> counts = history.stream()
                .collect(Collectors.groupingBy(ActionEvent::action, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() >= COMMON_ACTION_THRESHOLD)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }
}
