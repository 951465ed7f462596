package dev.ticketing.ticket.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Engine settings read from the environment.
 *
 * <ul>
 *   <li>{@code TICKET_ID_START} - first ticket id handed out (default 1)
 *   <li>{@code COMMENT_ID_START} - first comment id handed out (default 1)
 * </ul>
 */
public record TicketEngineConfig(long firstTicketId, long firstCommentId) {
    private static final Logger logger = LoggerFactory.getLogger(TicketEngineConfig.class);

    public static final String TICKET_ID_START = "TICKET_ID_START";
    public static final String COMMENT_ID_START = "COMMENT_ID_START";
    public static final long DEFAULT_FIRST_ID = 1L;

    public static TicketEngineConfig defaults() {
        return new TicketEngineConfig(DEFAULT_FIRST_ID, DEFAULT_FIRST_ID);
    }

    public static TicketEngineConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Read settings from {@code values}. Blank entries fall back to the default;
     * unparsable entries are logged and fall back as well.
     */
    public static TicketEngineConfig fromMap(Map<String, String> values) {
        return new TicketEngineConfig(
            readLong(values, TICKET_ID_START),
            readLong(values, COMMENT_ID_START));
    }

    private static long readLong(Map<String, String> values, String name) {
        String raw = values.get(name);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_FIRST_ID;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} env var '{}', using default {}", name, raw, DEFAULT_FIRST_ID);
            return DEFAULT_FIRST_ID;
        }
    }
}
