package com.phillippitts.streamwatch.service.probe.event;

import com.phillippitts.streamwatch.domain.ChannelStatus;

import java.time.Instant;

/** Published after every probe so that views can refresh the channel. */
public record ChannelUpdatedEvent(String channelId, ChannelStatus status, boolean live, boolean recording,
                                  Instant at) { }
