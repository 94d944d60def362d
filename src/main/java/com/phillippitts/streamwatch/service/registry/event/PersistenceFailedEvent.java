package com.phillippitts.streamwatch.service.registry.event;

import java.time.Instant;

/**
 * Published when a debounced channel save fails. In-memory state stays authoritative; the next save retries.
 */
public record PersistenceFailedEvent(String path, String reason, Instant at) { }
