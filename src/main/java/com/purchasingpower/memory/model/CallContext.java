package com.purchasingpower.memory.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One logged call against a backing store.
 *
 * Request lines are tagged {@code [<TAG> REQUEST]}, responses {@code [<TAG> RESPONSE]}
 * with elapsed milliseconds. Per-call details go to DEBUG so store traffic can be traced
 * without flooding INFO.
 *
 * @see ServiceType
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(Object... details) {
        logger.debug("{} [{} REQUEST] {} [{}]", service.getEmoji(), service.getTag(), operation, callId);
        logDetails(details);
    }

    public void logResponse(Object... details) {
        logger.debug("{} [{} RESPONSE] {} [{}] ({}ms)",
                service.getEmoji(), service.getTag(), operation, callId, getElapsedMs());
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} [{} ERROR] {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getTag(), operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }

    private void logDetails(Object... details) {
        if (details == null || !logger.isDebugEnabled()) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }
}
