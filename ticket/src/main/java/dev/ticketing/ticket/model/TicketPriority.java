package dev.ticketing.ticket.model;

/**
 * Ticket priority, declared in escalation order.
 */
public enum TicketPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    URGENT("urgent");

    private final String wireName;

    TicketPriority(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Escalation rank, 0 for {@link #LOW}.
     */
    public int rank() {
        return ordinal();
    }

    public boolean isHigherThan(TicketPriority other) {
        return rank() > other.rank();
    }

    public static TicketPriority fromWireName(String wireName) {
        for (TicketPriority priority : values()) {
            if (priority.wireName.equals(wireName)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown ticket priority: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
