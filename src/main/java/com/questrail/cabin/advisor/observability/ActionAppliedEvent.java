package com.questrail.cabin.advisor.observability;

import com.questrail.cabin.api.ActionEvent;
import com.questrail.cabin.api.CarState;

/**
 * Record representing one inbound action after it was applied.
 *
 * @param known        whether the action name is one the car state understands
 * @param stateChanged whether the car state differs from before the action
 */
public record ActionAppliedEvent(
    ActionEvent action,
    boolean known,
    boolean stateChanged,
    CarState carState,
    int historySize
) {
}
