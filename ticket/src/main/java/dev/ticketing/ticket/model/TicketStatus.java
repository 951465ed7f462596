package dev.ticketing.ticket.model;

/**
 * Lifecycle status of a ticket.
 */
public enum TicketStatus {
    NEW("new"),
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    PENDING_CUSTOMER("pending_customer"),
    CLOSED("closed");

    private final String wireName;

    TicketStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Look up a status by its wire name.
     *
     * @throws IllegalArgumentException if no status has that name
     */
    public static TicketStatus fromWireName(String wireName) {
        for (TicketStatus status : values()) {
            if (status.wireName.equals(wireName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ticket status: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
