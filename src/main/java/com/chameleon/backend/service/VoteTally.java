package com.chameleon.backend.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Counts of votes per accused player. Ties have no winner.
 */
public final class VoteTally {

    private final Map<String, Long> counts;

    private VoteTally(Map<String, Long> counts) {
        this.counts = counts;
    }

    public static VoteTally of(Collection<String> accusedIds) {
        Map<String, Long> counts = new LinkedHashMap<>();
        accusedIds.forEach(id -> counts.merge(id, 1L, Long::sum));
        return new VoteTally(counts);
    }

    public long highest() {
        return counts.values().stream().mapToLong(Long::longValue).max().orElse(0L);
    }

    /**
     * Every player sharing the highest count.
     */
    public List<String> winners() {
        long highest = highest();
        if (highest == 0L) {
            return Collections.emptyList();
        }
        List<String> winners = new ArrayList<>();
        counts.forEach((id, count) -> {
            if (count == highest) {
                winners.add(id);
            }
        });
        return winners;
    }

    public Optional<String> consensus() {
        List<String> winners = winners();
        return winners.size() == 1 ? Optional.of(winners.get(0)) : Optional.empty();
    }
}
