package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.LinkToCustomer;
import dev.ticketing.ticket.command.TicketCommand.UnlinkFromCustomer;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.CustomerLinked;
import dev.ticketing.ticket.event.TicketEvent.CustomerUnlinked;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Functional handlers for LinkToCustomer and UnlinkFromCustomer commands.
 */
public final class CustomerLinkHandler {

    private CustomerLinkHandler() {}

    public static Result<DomainError, List<TicketEvent>> link(LinkToCustomer cmd, TicketState state) {
        if (cmd.customerId().equals(state.customerId())) {
            return Result.err(DomainError.alreadyLinkedToCustomer());
        }

        return Result.ok(List.of(new CustomerLinked(
            cmd.ticketId(), cmd.customerId(), state.customerId(), cmd.actorId(), cmd.timestamp())));
    }

    public static Result<DomainError, List<TicketEvent>> unlink(UnlinkFromCustomer cmd, TicketState state) {
        if (state.customerId() == null) {
            return Result.err(DomainError.noCustomerLinked());
        }

        return Result.ok(List.of(new CustomerUnlinked(
            cmd.ticketId(), state.customerId(), cmd.actorId(), cmd.timestamp())));
    }
}
