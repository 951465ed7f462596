package dev.ticketing.ticket.state;

import dev.ticketing.ticket.model.TicketStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Legal status moves between two distinct statuses.
 *
 * <p>A closed ticket can only be reopened; every open-ish status can reach any
 * other open-ish status or be closed. Nothing returns to {@link TicketStatus#NEW}.
 */
public final class StatusTransitions {

    private static final Map<TicketStatus, Set<TicketStatus>> GRAPH = new EnumMap<>(TicketStatus.class);

    static {
        GRAPH.put(TicketStatus.NEW, Collections.unmodifiableSet(EnumSet.of(
            TicketStatus.OPEN, TicketStatus.IN_PROGRESS, TicketStatus.PENDING_CUSTOMER, TicketStatus.CLOSED)));
        GRAPH.put(TicketStatus.OPEN, Collections.unmodifiableSet(EnumSet.of(
            TicketStatus.IN_PROGRESS, TicketStatus.PENDING_CUSTOMER, TicketStatus.CLOSED)));
        GRAPH.put(TicketStatus.IN_PROGRESS, Collections.unmodifiableSet(EnumSet.of(
            TicketStatus.OPEN, TicketStatus.PENDING_CUSTOMER, TicketStatus.CLOSED)));
        GRAPH.put(TicketStatus.PENDING_CUSTOMER, Collections.unmodifiableSet(EnumSet.of(
            TicketStatus.OPEN, TicketStatus.IN_PROGRESS, TicketStatus.CLOSED)));
        GRAPH.put(TicketStatus.CLOSED, Collections.unmodifiableSet(EnumSet.of(
            TicketStatus.OPEN)));
    }

    private StatusTransitions() {}

    public static boolean canTransition(TicketStatus from, TicketStatus to) {
        return GRAPH.get(from).contains(to);
    }

    /**
     * Statuses reachable from {@code from} in one move, in declaration order.
     */
    public static Set<TicketStatus> legalTargets(TicketStatus from) {
        return GRAPH.get(from);
    }

    /**
     * Comma-separated wire names of the legal targets, e.g. {@code "in_progress, pending_customer, closed"}.
     */
    public static String describeTargets(TicketStatus from) {
        List<String> names = legalTargets(from).stream()
            .map(TicketStatus::wireName)
            .collect(Collectors.toList());
        return names.isEmpty() ? "none" : String.join(", ", names);
    }
}
