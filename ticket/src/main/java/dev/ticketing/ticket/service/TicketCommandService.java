package dev.ticketing.ticket.service;

import dev.ticketing.EventBook;
import dev.ticketing.client.Errors;
import dev.ticketing.client.EventStore;
import dev.ticketing.client.Helpers;
import dev.ticketing.client.Result;
import dev.ticketing.ticket.DecideContext;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.TicketAggregate;
import dev.ticketing.ticket.codec.TicketEventCodec;
import dev.ticketing.ticket.command.TicketCommand;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.handlers.StateBuilder;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.state.TicketState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Runs commands against stored tickets: load the history, rebuild state, decide,
 * append the new events and return the evolved state.
 *
 * <p>Appends are guarded by the sequence seen at load time, so a concurrent writer
 * surfaces as {@link Errors.ConcurrencyError} and nothing is written.
 */
public class TicketCommandService {
    private static final Logger logger = LoggerFactory.getLogger(TicketCommandService.class);

    private final EventStore store;
    private final DecideContext context;

    public TicketCommandService(EventStore store, DecideContext context) {
        this.store = store;
        this.context = context;
    }

    /**
     * Execute a command.
     *
     * @return the outcome, or the domain rejection; {@code TICKET_NOT_FOUND} when a
     *     command targets a ticket with no history
     * @throws Errors.ConcurrencyError if the stream changed between load and append
     */
    public Result<DomainError, CommandOutcome> execute(TicketCommand command) {
        Optional<TicketId> target = command.aggregateId();
        TicketState state = TicketState.empty();
        int expectedSequence = 0;

        if (target.isPresent()) {
            EventBook history = store.load(TicketAggregate.DOMAIN, target.get().asRoot());
            if (history.getPagesCount() == 0) {
                DomainError notFound = DomainError.ticketNotFound(target.get());
                logRejected(command, notFound);
                return Result.err(notFound);
            }
            state = StateBuilder.fromEventBook(history);
            expectedSequence = Helpers.nextSequence(history);
        }

        TicketState current = state;
        int expected = expectedSequence;
        return TicketAggregate.decide(command, current, context)
            .tapErr(error -> logRejected(command, error))
            .map(events -> commit(command, target, current, expected, events));
    }

    /**
     * Execute a command, throwing on rejection.
     *
     * @throws Errors.CommandRejectedError if the command was rejected
     */
    public CommandOutcome executeOrThrow(TicketCommand command) {
        Result<DomainError, CommandOutcome> result = execute(command);
        if (result.isErr()) {
            throw result.unwrapErr().toException();
        }
        return result.unwrap();
    }

    /**
     * Current state of a ticket, {@link TicketState#empty()} if it has no history.
     */
    public TicketState load(TicketId ticketId) {
        return StateBuilder.fromEventBook(store.load(TicketAggregate.DOMAIN, ticketId.asRoot()));
    }

    /**
     * Every event recorded for a ticket, oldest first.
     */
    public List<TicketEvent> history(TicketId ticketId) {
        return TicketEventCodec.decodeAll(store.load(TicketAggregate.DOMAIN, ticketId.asRoot()));
    }

    private CommandOutcome commit(
            TicketCommand command, Optional<TicketId> target, TicketState state, int expectedSequence,
            List<TicketEvent> events) {
        if (events.isEmpty()) {
            logger.debug("ticket_command_noop",
                kv("command", command.kind()), kv("ticket_id", target.map(TicketId::value).orElse(null)));
            return new CommandOutcome(target.orElse(state.id()), events, state, expectedSequence);
        }

        TicketId ticketId = target.orElseGet(() -> events.get(0).ticketId());
        store.append(TicketAggregate.DOMAIN, ticketId.asRoot(), expectedSequence,
            TicketEventCodec.encodeAll(events), Helpers.toTimestamp(command.timestamp()));

        TicketState next = TicketAggregate.evolveAll(state, events);
        int version = expectedSequence + events.size();
        logger.info("ticket_command_applied",
            kv("command", command.kind()), kv("ticket_id", ticketId.value()),
            kv("events", events.size()), kv("version", version));
        return new CommandOutcome(ticketId, events, next, version);
    }

    private static void logRejected(TicketCommand command, DomainError error) {
        logger.info("ticket_command_rejected",
            kv("command", command.kind()),
            kv("ticket_id", command.aggregateId().map(TicketId::value).orElse(null)),
            kv("code", error.code()), kv("message", error.message()));
    }
}
