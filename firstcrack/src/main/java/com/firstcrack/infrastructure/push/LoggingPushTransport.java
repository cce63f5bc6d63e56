package com.firstcrack.infrastructure.push;

import com.firstcrack.domain.notification.StagePayloadSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Dry-run transport: logs each message instead of delivering it.
 */
public class LoggingPushTransport implements PushTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingPushTransport.class);

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String send(StagePayloadSet payload) {
        String messageId = "dry-run/" + sequence.incrementAndGet();
        log.info("[PUSH] {} {} ({})", payload.brewId(), payload.stage().wireValue(), messageId);
        log.debug("[PUSH] {}", payload.toJson());
        return messageId;
    }

    @Override
    public String name() {
        return "log";
    }
}
