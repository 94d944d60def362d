package com.phillippitts.streamwatch.service.schedule;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counts from one dispatch cycle.
 *
 * @param dispatched channels pushed onto each lane
 * @param busy       due channels skipped per lane because a probe was still in flight
 * @param waiting    monitored channels that were not due yet
 */
public record DispatchSummary(Map<PriorityLane, Integer> dispatched, Map<PriorityLane, Integer> busy, int waiting) {

    public DispatchSummary {
        dispatched = copy(dispatched);
        busy = copy(busy);
    }

    public int dispatched(PriorityLane lane) {
        return dispatched.getOrDefault(lane, 0);
    }

    public int busy(PriorityLane lane) {
        return busy.getOrDefault(lane, 0);
    }

    public int totalDispatched() {
        return dispatched.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalBusy() {
        return busy.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Renders e.g. {@code Disp(1F+0M+2S) | Busy(0F+1M+0S) | 5 waiting}. */
    public String format() {
        return "Disp(" + perLane(dispatched) + ") | Busy(" + perLane(busy) + ") | " + waiting + " waiting";
    }

    private static String perLane(Map<PriorityLane, Integer> counts) {
        StringBuilder sb = new StringBuilder();
        for (PriorityLane lane : PriorityLane.values()) {
            if (sb.length() > 0) {
                sb.append('+');
            }
            sb.append(counts.getOrDefault(lane, 0)).append(lane.code());
        }
        return sb.toString();
    }

    private static Map<PriorityLane, Integer> copy(Map<PriorityLane, Integer> counts) {
        Map<PriorityLane, Integer> copy = new EnumMap<>(PriorityLane.class);
        if (counts != null) {
            copy.putAll(counts);
        }
        return Map.copyOf(copy);
    }
}
