package com.questrail.cabin.advisor.internal.state;

import com.questrail.cabin.api.CarState;
import com.questrail.cabin.api.DriverPreferences;
import com.questrail.cabin.api.SessionPhase;

import java.util.List;
import java.util.Objects;

/**
 * Consistent read-only view of the whole session, taken under the
 * coordinator's state lock.
 *
 * @param session       session bookkeeping
 * @param carState      current car state
 * @param preferences   current preference profile
 * @param recentActions last five action names, oldest first
 * @param historySize   number of actions currently held in the history
 * @param actionsProcessed number of actions received since the session was created
 */
public record AdvisorSnapshot(
        SessionState session,
        CarState carState,
        DriverPreferences preferences,
        List<String> recentActions,
        int historySize,
        long actionsProcessed
) {
    public AdvisorSnapshot {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(carState, "carState");
        Objects.requireNonNull(preferences, "preferences");
        recentActions = List.copyOf(recentActions);
    }

    public SessionPhase phase() {
        return session.phase();
    }
}
