package com.openforge.numen.memory;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Re-ranks similarity candidates by semantic fit, age and past usefulness.
 * See {@link MemoryScoringProperties} for the formula.
 */
@Component
@RequiredArgsConstructor
public class HybridMemoryScorer {

    static final Comparator<MemoryRecord> BY_SCORE = Comparator
            .comparingDouble(MemoryRecord::score).reversed()
            .thenComparing(MemoryRecord::createdAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private final MemoryScoringProperties props;

    /** Highest-scoring {@code limit} records, best first. */
    public List<MemoryRecord> rank(List<MemoryRecord> candidates, int limit, LocalDateTime now) {
        return candidates.stream()
                .map(r -> r.withScore(score(r, now)))
                .sorted(BY_SCORE)
                .limit(Math.max(limit, 0))
                .toList();
    }

    double score(MemoryRecord record, LocalDateTime now) {
        double semantic = Math.max(record.similarity(), 0.0);

        double recency = 0.0;
        if (record.createdAt() != null && props.recencyHalfLifeHours() > 0) {
            double ageHours = Math.max(Duration.between(record.createdAt(), now).toMinutes() / 60.0, 0.0);
            recency = Math.pow(0.5, ageHours / props.recencyHalfLifeHours());
        }

        double reinforcement = 0.0;
        if (props.reinforcementSaturation() > 0) {
            reinforcement = (double) Math.min(record.accessCount(), props.reinforcementSaturation())
                    / props.reinforcementSaturation();
        }

        return props.semantic() * semantic
                + props.recency() * recency
                + props.reinforcement() * reinforcement;
    }
}
