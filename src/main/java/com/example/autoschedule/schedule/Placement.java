package com.example.autoschedule.schedule;

import java.util.Objects;

/**
 * Where a task sits on the timeline.
 * <ul>
 *     <li>{@link Kind#UNSCHEDULED}: no interval</li>
 *     <li>{@link Kind#LOCKED}: fixed by the user, never rewritten by the engine or the break enforcer</li>
 *     <li>{@link Kind#AUTO_PLACED}: chosen by the engine, with the score it achieved</li>
 * </ul>
 */
public record Placement(Kind kind, TimeInterval interval, Double score) {

    public enum Kind { UNSCHEDULED, LOCKED, AUTO_PLACED }

    private static final Placement UNSCHEDULED = new Placement(Kind.UNSCHEDULED, null, null);

    public Placement {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.UNSCHEDULED && (interval != null || score != null)) {
            throw new IllegalArgumentException("An unscheduled placement has no interval or score");
        }
        if (kind != Kind.UNSCHEDULED && interval == null) {
            throw new IllegalArgumentException(kind + " placement requires an interval");
        }
    }

    public static Placement unscheduled() {
        return UNSCHEDULED;
    }

    public static Placement locked(TimeInterval interval) {
        return new Placement(Kind.LOCKED, interval, null);
    }

    public static Placement autoPlaced(TimeInterval interval, double score) {
        return new Placement(Kind.AUTO_PLACED, interval, score);
    }

    public boolean isScheduled() {
        return kind != Kind.UNSCHEDULED;
    }

    public boolean isLocked() {
        return kind == Kind.LOCKED;
    }

    public boolean isAutoPlaced() {
        return kind == Kind.AUTO_PLACED;
    }
}
