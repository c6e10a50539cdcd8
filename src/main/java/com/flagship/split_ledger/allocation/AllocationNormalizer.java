package com.flagship.split_ledger.allocation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Map;

/**
 * Turns raw, possibly inconsistent per-participant shares into a distribution
 * over the current participant set.
 *
 * Rules:
 * - Participants missing from the raw shares count as 0
 * - Names not in the participant set are ignored
 * - Negative, null and non-finite shares are clamped to 0
 * - If nothing positive remains, every participant gets an equal share
 *
 * The result is keyed in participant order, non-negative, and sums to 1
 * whenever the participant set is non-empty. Repeated and null participant
 * names are collapsed before shares are computed. Never throws.
 */
@Component
public class AllocationNormalizer {

    /**
     * Normalizes raw shares against the given participants.
     *
     * @param raw raw shares by participant name; may be null or empty
     * @param participants ordered participant set
     * @return unmodifiable distribution keyed in participant order
     */
    public Map<String, Double> normalize(Map<String, Double> raw, List<String> participants) {
        participants = distinct(participants);
        Map<String, Double> clamped = new LinkedHashMap<>();
        double total = 0.0;
        for (String participant : participants) {
            double share = clamp(raw == null ? null : raw.get(participant));
            clamped.put(participant, share);
            total += share;
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        if (total <= 0.0) {
            // Equal split; the floor of 1 keeps an empty set from dividing by zero
            double equalShare = 1.0 / Math.max(1, participants.size());
            for (String participant : participants) {
                normalized.put(participant, equalShare);
            }
        } else {
            for (Map.Entry<String, Double> entry : clamped.entrySet()) {
                normalized.put(entry.getKey(), entry.getValue() / total);
            }
        }
        return Collections.unmodifiableMap(normalized);
    }

    /**
     * Ordered participant set: first occurrence wins, null names are dropped.
     */
    public static List<String> distinct(List<String> participants) {
        if (participants == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>(new LinkedHashSet<>(participants));
        names.removeIf(Objects::isNull);
        return Collections.unmodifiableList(names);
    }

    private static double clamp(Double share) {
        if (share == null || !Double.isFinite(share)) {
            return 0.0;
        }
        return Math.max(0.0, share);
    }
}
