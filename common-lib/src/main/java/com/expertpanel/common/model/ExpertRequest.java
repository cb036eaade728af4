package com.expertpanel.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything an expert receives for one round.
 *
 * <p>{@code priorOpinions} holds the full previous round, the receiving expert's own entry
 * included. Excluding self is left to prompt construction via {@link #peerOpinions(String)}.
 * {@code priorRationale} is empty in round 1.
 */
public record ExpertRequest(
    String sessionId,
    CaseContext caseContext,
    int roundIndex,
    Map<String, Opinion> priorOpinions,
    String priorRationale
) {
    public ExpertRequest {
        priorOpinions  = priorOpinions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(priorOpinions));
        priorRationale = priorRationale == null ? "" : priorRationale;
    }

    public boolean isInitialRound() {
        return roundIndex <= 1 || priorOpinions.isEmpty();
    }

    /** Previous-round opinions of everyone except {@code selfId}, in panel order. */
    public Map<String, Opinion> peerOpinions(String selfId) {
        Map<String, Opinion> peers = new LinkedHashMap<>(priorOpinions);
        peers.remove(selfId);
        return peers;
    }
}
