package com.example.autoschedule.task;

public enum Priority {
    NONE(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static int rankOf(Priority priority) {
        return priority == null ? NONE.rank : priority.rank;
    }
}
