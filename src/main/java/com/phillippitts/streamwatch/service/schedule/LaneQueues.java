package com.phillippitts.streamwatch.service.schedule;

import com.phillippitts.streamwatch.domain.ChannelState;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * One unbounded FIFO queue per {@link PriorityLane}. The dispatcher offers claimed channels; lane workers take
 * them.
 */
public class LaneQueues {

    private final Map<PriorityLane, BlockingQueue<ChannelState>> queues = new EnumMap<>(PriorityLane.class);

    public LaneQueues() {
        for (PriorityLane lane : PriorityLane.values()) {
            queues.put(lane, new LinkedBlockingQueue<>());
        }
    }

    public void offer(PriorityLane lane, ChannelState channel) {
        queues.get(lane).add(channel);
    }

    /** Blocks until a channel is available in the lane. */
    public ChannelState take(PriorityLane lane) throws InterruptedException {
        return queues.get(lane).take();
    }

    public int size(PriorityLane lane) {
        return queues.get(lane).size();
    }

    public boolean contains(PriorityLane lane, ChannelState channel) {
        return queues.get(lane).contains(channel);
    }

    public int totalSize() {
        int total = 0;
        for (BlockingQueue<ChannelState> queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }
}
