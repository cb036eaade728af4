package com.expertpanel.deliberation.session;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.model.RoundRecord;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable bookkeeping for one round. Only touched by {@link SessionStore} while holding the
 * owning session's lock; everything outside the package sees {@link RoundRecord} snapshots.
 */
@Data
@NoArgsConstructor
class RoundState {

    private int roundIndex;
    private Map<String, Opinion> opinions = new LinkedHashMap<>();
    private Decision decision;
    private boolean consensusReached;

    RoundState(int roundIndex) {
        this.roundIndex = roundIndex;
    }

    boolean isOpen() {
        return decision == null;
    }

    RoundRecord toRecord() {
        return new RoundRecord(roundIndex, opinions, decision, consensusReached);
    }
}
