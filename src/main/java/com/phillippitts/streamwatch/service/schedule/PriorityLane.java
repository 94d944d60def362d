package com.phillippitts.streamwatch.service.schedule;

/**
 * Priority tier of a due channel, chosen from its adjusted polling interval. Each lane has dedicated workers so
 * a slow-lane backlog never delays fast-lane channels.
 */
public enum PriorityLane {
    FAST("F", 1),
    MEDIUM("M", 2),
    SLOW("S", 1);

    private final String code;
    private final int workers;

    PriorityLane(String code, int workers) {
        this.code = code;
        this.workers = workers;
    }

    /**
     * @param intervalSeconds   adjusted polling interval of the channel
     * @param fastMaxSeconds    largest interval still routed to the fast lane
     * @param mediumMaxSeconds  largest interval still routed to the medium lane
     */
    public static PriorityLane forInterval(long intervalSeconds, long fastMaxSeconds, long mediumMaxSeconds) {
        if (intervalSeconds <= fastMaxSeconds) {
            return FAST;
        }
        if (intervalSeconds <= mediumMaxSeconds) {
            return MEDIUM;
        }
        return SLOW;
    }

    public static int totalWorkers() {
        int total = 0;
        for (PriorityLane lane : values()) {
            total += lane.workers;
        }
        return total;
    }

    public String code() {
        return code;
    }

    public int workers() {
        return workers;
    }
}
