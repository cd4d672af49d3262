package com.questrail.cabin.advisor.internal.recommend;

import com.questrail.cabin.api.VehicleAction;

/**
 * Turns an eligible suggestion into driver-facing text.
 */
public interface PhrasingStrategy
{
    /**
     * @param action suggested action
     * @param value  suggested setting, or {@code null}
     */
    String phrase(VehicleAction action, Integer value);

    String breakReminder();
}
