package dev.ticketing.ticket;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.command.FieldUpdate;
import dev.ticketing.ticket.command.TicketCommand;
import dev.ticketing.ticket.command.TicketCommand.AddComment;
import dev.ticketing.ticket.command.TicketCommand.AddEmailReply;
import dev.ticketing.ticket.command.TicketCommand.AssignTicket;
import dev.ticketing.ticket.command.TicketCommand.ChangePriority;
import dev.ticketing.ticket.command.TicketCommand.CloseTicket;
import dev.ticketing.ticket.command.TicketCommand.EscalatePriority;
import dev.ticketing.ticket.command.TicketCommand.LinkToCustomer;
import dev.ticketing.ticket.command.TicketCommand.MergeTicket;
import dev.ticketing.ticket.command.TicketCommand.RecordFirstResponse;
import dev.ticketing.ticket.command.TicketCommand.ReopenTicket;
import dev.ticketing.ticket.command.TicketCommand.TransitionStatus;
import dev.ticketing.ticket.command.TicketCommand.UnassignTicket;
import dev.ticketing.ticket.command.TicketCommand.UnlinkFromCustomer;
import dev.ticketing.ticket.command.TicketCommand.UpdateTicket;
import dev.ticketing.ticket.event.EventKind;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.model.TicketPriority;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.model.UserId;
import dev.ticketing.ticket.state.StatusTransitions;
import dev.ticketing.ticket.state.TicketState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static dev.ticketing.ticket.TicketFixtures.AGENT;
import static dev.ticketing.ticket.TicketFixtures.CUSTOMER;
import static dev.ticketing.ticket.TicketFixtures.OTHER_AGENT;
import static dev.ticketing.ticket.TicketFixtures.OTHER_TICKET;
import static dev.ticketing.ticket.TicketFixtures.REPORTER;
import static dev.ticketing.ticket.TicketFixtures.T0;
import static dev.ticketing.ticket.TicketFixtures.T1;
import static dev.ticketing.ticket.TicketFixtures.TICKET;
import static dev.ticketing.ticket.TicketFixtures.context;
import static dev.ticketing.ticket.TicketFixtures.createTicket;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for decide/evolve as a whole: dispatch, full lifecycles and the properties
 * that must hold for any command sequence.
 */
class TicketAggregateTest {

    /**
     * Decide and fold, failing the test if the command is rejected.
     */
    private static TicketState accept(TicketState state, TicketCommand command, DecideContext context) {
        List<TicketEvent> events = TicketAggregate.decide(command, state, context).unwrap();
        return TicketAggregate.evolveAll(state, events);
    }

    // =========================================================================
    // Scenarios
    // =========================================================================

    @Test
    void create_without_assignee_yields_new_unassigned_ticket() {
        Result<DomainError, List<TicketEvent>> result =
            TicketAggregate.decide(createTicket().build(), TicketAggregate.emptyState(), context());

        List<TicketEvent> events = result.unwrap();
        assertThat(events).extracting(TicketEvent::kind).containsExactly(EventKind.TICKET_CREATED);

        TicketState state = TicketAggregate.replay(events);
        assertThat(state.status()).isEqualTo(TicketStatus.NEW);
        assertThat(state.assigneeId()).isNull();
        assertThat(state.title()).isEqualTo("Leaky valve");
    }

    @Test
    void create_with_assignee_stays_new() {
        TicketState state = accept(TicketState.empty(), createTicket().assigneeId(AGENT).build(), context());

        assertThat(state.assigneeId()).isEqualTo(AGENT);
        assertThat(state.status()).isEqualTo(TicketStatus.NEW);
    }

    @Test
    void full_support_conversation() {
        DecideContext context = context();
        TicketState state = accept(TicketState.empty(), createTicket().build(), context);

        state = accept(state, new AssignTicket(TICKET, AGENT, AGENT, T1), context);
        assertThat(state.status()).isEqualTo(TicketStatus.IN_PROGRESS);

        state = accept(state, new AddEmailReply(TICKET, "Send a photo", "buyer@example.com", null, AGENT, T1),
            context);
        assertThat(state.status()).isEqualTo(TicketStatus.PENDING_CUSTOMER);
        assertThat(state.commentCount()).isEqualTo(1);
        assertThat(state.hasFirstResponse()).isTrue();

        state = accept(state, new AddComment(TICKET, "Here it is", false, true, "msg-2", List.of(9L), null, T1),
            context);
        assertThat(state.status()).isEqualTo(TicketStatus.OPEN);
        assertThat(state.commentCount()).isEqualTo(2);

        state = accept(state, new EscalatePriority(TICKET, "Broken on arrival", AGENT, T1), context);
        assertThat(state.priority()).isEqualTo(TicketPriority.URGENT);

        state = accept(state, new LinkToCustomer(TICKET, CUSTOMER, AGENT, T1), context);
        state = accept(state, new CloseTicket(TICKET, "Replacement shipped", AGENT, T1), context);
        assertThat(state.status()).isEqualTo(TicketStatus.CLOSED);
        assertThat(state.closedAt()).isEqualTo(T1);

        state = accept(state, new ReopenTicket(TICKET, "Replacement also broken", AGENT, T1), context);
        assertThat(state.status()).isEqualTo(TicketStatus.OPEN);
        assertThat(state.closedAt()).isNull();
        assertThat(state.reopenCount()).isEqualTo(1);
        assertThat(state.customerId()).isEqualTo(CUSTOMER);
    }

    @Test
    void merged_ticket_is_closed_for_good() {
        DecideContext context = context();
        TicketState state = accept(TicketState.empty(), createTicket().build(), context);
        state = accept(state, new MergeTicket(TICKET, OTHER_TICKET, "Duplicate", AGENT, T1), context);

        assertThat(state.status()).isEqualTo(TicketStatus.CLOSED);
        assertThat(state.mergedIntoTicketId()).isEqualTo(OTHER_TICKET);
        assertThat(state.closedAt()).isEqualTo(T1);

        TicketState merged = state;
        assertThat(TicketAggregate.decide(new ReopenTicket(TICKET, "oops", AGENT, T1), merged, context)
            .unwrapErr().code()).isEqualTo(DomainErrorCode.TICKET_ALREADY_MERGED);
        assertThat(TicketAggregate.decide(new TransitionStatus(TICKET, TicketStatus.OPEN, null, AGENT, T1), merged,
            context).unwrapErr().code()).isEqualTo(DomainErrorCode.TICKET_ALREADY_MERGED);
        assertThat(TicketAggregate.decide(new MergeTicket(TICKET, OTHER_TICKET, null, AGENT, T1), merged, context)
            .unwrapErr().code()).isEqualTo(DomainErrorCode.TICKET_ALREADY_MERGED);
    }

    @Test
    void rejection_leaves_nothing_to_apply() {
        TicketState state = accept(TicketState.empty(), createTicket().build(), context());

        Result<DomainError, List<TicketEvent>> result = TicketAggregate.decide(
            new ChangePriority(TICKET, TicketPriority.MEDIUM, null, AGENT, T1), state, context());

        assertThat(result.isErr()).isTrue();
        TicketState after = result.match(events -> TicketAggregate.evolveAll(state, events), error -> state);
        assertThat(after).isEqualTo(state);
    }

    // =========================================================================
    // Properties
    // =========================================================================

    @Test
    void decide_is_deterministic_for_equal_inputs() {
        TicketState state = accept(TicketState.empty(), createTicket().build(), context());
        TicketCommand command = new AddComment(TICKET, "hello", false, true, null, List.of(), null, T1);

        assertThat(TicketAggregate.decide(command, state, context()))
            .isEqualTo(TicketAggregate.decide(command, state, context()));
    }

    @Test
    void decide_and_evolve_do_not_mutate_state() {
        TicketState state = accept(TicketState.empty(), createTicket().assigneeId(AGENT).build(), context());
        TicketState snapshot = state.toBuilder().build();

        List<TicketEvent> events = TicketAggregate.decide(
            new CloseTicket(TICKET, "done", AGENT, T1), state, context()).unwrap();
        TicketAggregate.evolveAll(state, events);

        assertThat(state).isEqualTo(snapshot);
    }

    @Test
    void folding_in_pieces_equals_folding_at_once() {
        List<TicketEvent> history = randomHistory(new Random(7), 60);

        TicketState whole = TicketAggregate.replay(history);
        for (int split = 0; split <= history.size(); split++) {
            TicketState prefix = TicketAggregate.evolveAll(TicketState.empty(), history.subList(0, split));
            TicketState pieces = TicketAggregate.evolveAll(prefix, history.subList(split, history.size()));

            assertThat(pieces).as("split at %d", split).isEqualTo(whole);
        }
    }

    @Test
    void random_command_sequences_keep_invariants() {
        for (long seed = 1; seed <= 25; seed++) {
            Random random = new Random(seed);
            DecideContext context = context();
            TicketState state = accept(TicketState.empty(), createTicket().build(), context);

            for (int step = 0; step < 40; step++) {
                TicketCommand command = randomCommand(random, Instant.ofEpochSecond(1_700_000_000L + step));
                TicketState before = state;
                Result<DomainError, List<TicketEvent>> decided = TicketAggregate.decide(command, before, context);
                if (decided.isErr()) {
                    continue;
                }

                for (TicketEvent event : decided.unwrap()) {
                    if (event instanceof StatusTransitioned transitioned) {
                        assertThat(StatusTransitions.canTransition(transitioned.fromStatus(), transitioned.toStatus()))
                            .as("seed %d step %d: %s", seed, step, transitioned)
                            .isTrue();
                    }
                }
                state = TicketAggregate.evolveAll(before, decided.unwrap());

                assertThat(state.commentCount()).isGreaterThanOrEqualTo(before.commentCount());
                if (before.hasFirstResponse()) {
                    assertThat(state.hasFirstResponse()).isTrue();
                }
                if (before.isMerged()) {
                    assertThat(state.mergedIntoTicketId()).isEqualTo(before.mergedIntoTicketId());
                }
                if (state.isMerged()) {
                    assertThat(state.status()).isEqualTo(TicketStatus.CLOSED);
                }
            }
        }
    }

    private static List<TicketEvent> randomHistory(Random random, int commands) {
        DecideContext context = context();
        List<TicketEvent> history = new ArrayList<>(
            TicketAggregate.decide(createTicket().build(), TicketState.empty(), context).unwrap());
        TicketState state = TicketAggregate.replay(history);
        for (int i = 0; i < commands; i++) {
            Result<DomainError, List<TicketEvent>> decided =
                TicketAggregate.decide(randomCommand(random, T0.plusSeconds(i)), state, context);
            if (decided.isOk()) {
                history.addAll(decided.unwrap());
                state = TicketAggregate.evolveAll(state, decided.unwrap());
            }
        }
        return history;
    }

    private static TicketCommand randomCommand(Random random, Instant at) {
        TicketStatus[] statuses = TicketStatus.values();
        TicketPriority[] priorities = TicketPriority.values();
        UserId agent = random.nextBoolean() ? AGENT : OTHER_AGENT;
        switch (random.nextInt(14)) {
            case 0:
                return new TransitionStatus(TICKET, statuses[random.nextInt(statuses.length)], null, agent, at);
            case 1:
                return new AssignTicket(TICKET, agent, agent, at);
            case 2:
                return new UnassignTicket(TICKET, agent, at);
            case 3:
                return new AddComment(TICKET, "note", random.nextBoolean(), random.nextBoolean(), null, List.of(),
                    agent, at);
            case 4:
                return new AddEmailReply(TICKET, "reply", "buyer@example.com", List.of(), agent, at);
            case 5:
                return new CloseTicket(TICKET, null, agent, at);
            case 6:
                return new ReopenTicket(TICKET, "again", agent, at);
            case 7:
                return new ChangePriority(TICKET, priorities[random.nextInt(priorities.length)], null, agent, at);
            case 8:
                return new EscalatePriority(TICKET, "hot", agent, at);
            case 9:
                // Rarely merge so most sequences keep going.
                return random.nextInt(5) == 0
                    ? new MergeTicket(TICKET, OTHER_TICKET, null, agent, at)
                    : new AddComment(TICKET, "internal", true, false, null, List.of(), REPORTER, at);
            case 10:
                return new LinkToCustomer(TICKET, CUSTOMER, null, at);
            case 11:
                return UpdateTicket.builder(TICKET)
                    .title(random.nextBoolean() ? "Leaky valve" : "Burst pipe")
                    .orderNumber(random.nextBoolean() ? FieldUpdate.to("SO-" + random.nextInt(3)) : FieldUpdate.clear())
                    .actorId(agent)
                    .timestamp(at)
                    .build();
            case 12:
                return new RecordFirstResponse(TICKET, null, agent, at);
            default:
                return new UnlinkFromCustomer(TICKET, null, at);
        }
    }
}
