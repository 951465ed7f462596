package dev.ticketing.ticket.codec;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import dev.ticketing.EventBook;
import dev.ticketing.EventPage;
import dev.ticketing.client.Errors;
import dev.ticketing.client.Helpers;
import dev.ticketing.ticket.event.FieldChange;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.model.CommentId;
import dev.ticketing.ticket.model.CustomerId;
import dev.ticketing.ticket.model.SenderInfo;
import dev.ticketing.ticket.model.ShippingAddress;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.model.TicketPriority;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.model.TicketType;
import dev.ticketing.ticket.model.UserId;
import dev.ticketing.ticket.proto.Address;
import dev.ticketing.ticket.proto.CommentAdded;
import dev.ticketing.ticket.proto.CustomerLinked;
import dev.ticketing.ticket.proto.CustomerUnlinked;
import dev.ticketing.ticket.proto.EmailReplyQueued;
import dev.ticketing.ticket.proto.FirstResponseRecorded;
import dev.ticketing.ticket.proto.PriorityChanged;
import dev.ticketing.ticket.proto.Sender;
import dev.ticketing.ticket.proto.StatusTransitioned;
import dev.ticketing.ticket.proto.TicketAssigned;
import dev.ticketing.ticket.proto.TicketClosed;
import dev.ticketing.ticket.proto.TicketCreated;
import dev.ticketing.ticket.proto.TicketMerged;
import dev.ticketing.ticket.proto.TicketReopened;
import dev.ticketing.ticket.proto.TicketUnassigned;
import dev.ticketing.ticket.proto.TicketUpdated;
import dev.ticketing.ticket.proto.ValueChange;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts ticket events to and from their protobuf form packed in {@link Any}.
 */
public final class TicketEventCodec {

    private TicketEventCodec() {}

    // =========================================================================
    // Encoding
    // =========================================================================

    public static Any encode(TicketEvent event) {
        return Helpers.packAny(toMessage(event));
    }

    public static List<Any> encodeAll(List<? extends TicketEvent> events) {
        List<Any> packed = new ArrayList<>(events.size());
        for (TicketEvent event : events) {
            packed.add(encode(event));
        }
        return packed;
    }

    static Message toMessage(TicketEvent event) {
        return switch (event.kind()) {
            case TICKET_CREATED -> createdMessage((TicketEvent.TicketCreated) event);
            case STATUS_TRANSITIONED -> {
                TicketEvent.StatusTransitioned e = (TicketEvent.StatusTransitioned) event;
                StatusTransitioned.Builder b = StatusTransitioned.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setFromStatus(e.fromStatus().wireName())
                    .setToStatus(e.toStatus().wireName())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.reason() != null) {
                    b.setReason(e.reason());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case TICKET_ASSIGNED -> {
                TicketEvent.TicketAssigned e = (TicketEvent.TicketAssigned) event;
                TicketAssigned.Builder b = TicketAssigned.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setNewAssigneeId(e.newAssigneeId().value())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.previousAssigneeId() != null) {
                    b.setPreviousAssigneeId(e.previousAssigneeId().value());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case TICKET_UNASSIGNED -> {
                TicketEvent.TicketUnassigned e = (TicketEvent.TicketUnassigned) event;
                TicketUnassigned.Builder b = TicketUnassigned.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setPreviousAssigneeId(e.previousAssigneeId().value())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case COMMENT_ADDED -> {
                TicketEvent.CommentAdded e = (TicketEvent.CommentAdded) event;
                CommentAdded.Builder b = CommentAdded.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setCommentId(e.commentId().value())
                    .setText(e.text())
                    .setIsInternalNote(e.isInternalNote())
                    .setIsFromCustomer(e.isFromCustomer())
                    .setIsOutgoingReply(e.isOutgoingReply())
                    .addAllAttachmentIds(e.attachmentIds())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.externalMessageId() != null) {
                    b.setExternalMessageId(e.externalMessageId());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case EMAIL_REPLY_QUEUED -> {
                TicketEvent.EmailReplyQueued e = (TicketEvent.EmailReplyQueued) event;
                EmailReplyQueued.Builder b = EmailReplyQueued.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setCommentId(e.commentId().value())
                    .setText(e.text())
                    .addAllAttachmentIds(e.attachmentIds())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.toEmail() != null) {
                    b.setToEmail(e.toEmail());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case TICKET_CLOSED -> {
                TicketEvent.TicketClosed e = (TicketEvent.TicketClosed) event;
                TicketClosed.Builder b = TicketClosed.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setPreviousStatus(e.previousStatus().wireName())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.resolution() != null) {
                    b.setResolution(e.resolution());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case TICKET_REOPENED -> {
                TicketEvent.TicketReopened e = (TicketEvent.TicketReopened) event;
                TicketReopened.Builder b = TicketReopened.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.reason() != null) {
                    b.setReason(e.reason());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case PRIORITY_CHANGED -> {
                TicketEvent.PriorityChanged e = (TicketEvent.PriorityChanged) event;
                PriorityChanged.Builder b = PriorityChanged.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setFromPriority(e.fromPriority().wireName())
                    .setToPriority(e.toPriority().wireName())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.reason() != null) {
                    b.setReason(e.reason());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case TICKET_MERGED -> {
                TicketEvent.TicketMerged e = (TicketEvent.TicketMerged) event;
                TicketMerged.Builder b = TicketMerged.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setTargetTicketId(e.targetTicketId().value())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.reason() != null) {
                    b.setReason(e.reason());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case CUSTOMER_LINKED -> {
                TicketEvent.CustomerLinked e = (TicketEvent.CustomerLinked) event;
                CustomerLinked.Builder b = CustomerLinked.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setCustomerId(e.customerId().value())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.previousCustomerId() != null) {
                    b.setPreviousCustomerId(e.previousCustomerId().value());
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case CUSTOMER_UNLINKED -> {
                TicketEvent.CustomerUnlinked e = (TicketEvent.CustomerUnlinked) event;
                CustomerUnlinked.Builder b = CustomerUnlinked.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setPreviousCustomerId(e.previousCustomerId().value())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case TICKET_UPDATED -> {
                TicketEvent.TicketUpdated e = (TicketEvent.TicketUpdated) event;
                TicketUpdated.Builder b = TicketUpdated.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.title() != null) {
                    b.setTitle(valueChange(e.title(), Function.identity()));
                }
                if (e.description() != null) {
                    b.setDescription(valueChange(e.description(), Function.identity()));
                }
                if (e.type() != null) {
                    b.setType(valueChange(e.type(), TicketType::label));
                }
                if (e.orderNumber() != null) {
                    b.setOrderNumber(valueChange(e.orderNumber(), Function.identity()));
                }
                if (e.trackingNumber() != null) {
                    b.setTrackingNumber(valueChange(e.trackingNumber(), Function.identity()));
                }
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
            case FIRST_RESPONSE_RECORDED -> {
                TicketEvent.FirstResponseRecorded e = (TicketEvent.FirstResponseRecorded) event;
                FirstResponseRecorded.Builder b = FirstResponseRecorded.newBuilder()
                    .setTicketId(e.ticketId().value())
                    .setRespondedAt(Helpers.toTimestamp(e.respondedAt()))
                    .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
                if (e.causedBy() != null) {
                    b.setCausedBy(e.causedBy().value());
                }
                yield b.build();
            }
        };
    }

    private static <T> ValueChange valueChange(FieldChange<T> change, Function<T, String> toWire) {
        ValueChange.Builder b = ValueChange.newBuilder();
        if (change.from() != null) {
            b.setFrom(toWire.apply(change.from()));
        }
        if (change.to() != null) {
            b.setTo(toWire.apply(change.to()));
        }
        return b.build();
    }

    private static TicketCreated createdMessage(TicketEvent.TicketCreated e) {
        TicketCreated.Builder b = TicketCreated.newBuilder()
            .setTicketId(e.ticketId().value())
            .setPriority(e.priority().wireName())
            .setSender(sender(e.sender()))
            .setOccurredAt(Helpers.toTimestamp(e.occurredAt()));
        if (e.title() != null) {
            b.setTitle(e.title());
        }
        if (e.description() != null) {
            b.setDescription(e.description());
        }
        if (e.type() != null) {
            b.setType(e.type().label());
        }
        if (e.reporterId() != null) {
            b.setReporterId(e.reporterId().value());
        }
        if (e.assigneeId() != null) {
            b.setAssigneeId(e.assigneeId().value());
        }
        if (e.orderNumber() != null) {
            b.setOrderNumber(e.orderNumber());
        }
        if (e.trackingNumber() != null) {
            b.setTrackingNumber(e.trackingNumber());
        }
        if (e.externalMessageId() != null) {
            b.setExternalMessageId(e.externalMessageId());
        }
        if (e.conversationId() != null) {
            b.setConversationId(e.conversationId());
        }
        if (e.shippingAddress() != null) {
            b.setShippingAddress(address(e.shippingAddress()));
        }
        if (e.customerId() != null) {
            b.setCustomerId(e.customerId().value());
        }
        if (e.causedBy() != null) {
            b.setCausedBy(e.causedBy().value());
        }
        return b.build();
    }

    private static Sender sender(SenderInfo sender) {
        Sender.Builder b = Sender.newBuilder();
        if (sender.email() != null) {
            b.setEmail(sender.email());
        }
        if (sender.name() != null) {
            b.setName(sender.name());
        }
        if (sender.phone() != null) {
            b.setPhone(sender.phone());
        }
        if (sender.company() != null) {
            b.setCompany(sender.company());
        }
        return b.build();
    }

    private static Address address(ShippingAddress address) {
        Address.Builder b = Address.newBuilder();
        if (address.name() != null) {
            b.setName(address.name());
        }
        if (address.company() != null) {
            b.setCompany(address.company());
        }
        if (address.country() != null) {
            b.setCountry(address.country());
        }
        if (address.addressLine1() != null) {
            b.setAddressLine1(address.addressLine1());
        }
        if (address.addressLine2() != null) {
            b.setAddressLine2(address.addressLine2());
        }
        if (address.addressLine3() != null) {
            b.setAddressLine3(address.addressLine3());
        }
        if (address.city() != null) {
            b.setCity(address.city());
        }
        if (address.state() != null) {
            b.setState(address.state());
        }
        if (address.postalCode() != null) {
            b.setPostalCode(address.postalCode());
        }
        if (address.phone() != null) {
            b.setPhone(address.phone());
        }
        if (address.email() != null) {
            b.setEmail(address.email());
        }
        return b.build();
    }

    // =========================================================================
    // Decoding
    // =========================================================================

    /**
     * Decode every page of a ticket's event book, in sequence order.
     */
    public static List<TicketEvent> decodeAll(EventBook book) {
        List<TicketEvent> events = new ArrayList<>(book.getPagesCount());
        for (EventPage page : book.getPagesList()) {
            events.add(decode(page.getEvent()));
        }
        return events;
    }

    /**
     * Decode a single packed event.
     *
     * @throws Errors.InvalidArgumentError if the type URL is not a ticket event
     * @throws Errors.CodecError if the payload cannot be parsed
     */
    public static TicketEvent decode(Any any) {
        try {
            if (any.is(TicketCreated.class)) {
                return createdEvent(any.unpack(TicketCreated.class));
            } else if (any.is(StatusTransitioned.class)) {
                StatusTransitioned e = any.unpack(StatusTransitioned.class);
                return new TicketEvent.StatusTransitioned(
                    TicketId.of(e.getTicketId()),
                    TicketStatus.fromWireName(e.getFromStatus()),
                    TicketStatus.fromWireName(e.getToStatus()),
                    e.hasReason() ? e.getReason() : null,
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(TicketAssigned.class)) {
                TicketAssigned e = any.unpack(TicketAssigned.class);
                return new TicketEvent.TicketAssigned(
                    TicketId.of(e.getTicketId()),
                    e.hasPreviousAssigneeId() ? UserId.of(e.getPreviousAssigneeId()) : null,
                    UserId.of(e.getNewAssigneeId()),
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(TicketUnassigned.class)) {
                TicketUnassigned e = any.unpack(TicketUnassigned.class);
                return new TicketEvent.TicketUnassigned(
                    TicketId.of(e.getTicketId()),
                    UserId.of(e.getPreviousAssigneeId()),
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(CommentAdded.class)) {
                CommentAdded e = any.unpack(CommentAdded.class);
                return new TicketEvent.CommentAdded(
                    TicketId.of(e.getTicketId()),
                    CommentId.of(e.getCommentId()),
                    e.getText(),
                    e.getIsInternalNote(),
                    e.getIsFromCustomer(),
                    e.getIsOutgoingReply(),
                    e.hasExternalMessageId() ? e.getExternalMessageId() : null,
                    e.getAttachmentIdsList(),
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(EmailReplyQueued.class)) {
                EmailReplyQueued e = any.unpack(EmailReplyQueued.class);
                return new TicketEvent.EmailReplyQueued(
                    TicketId.of(e.getTicketId()),
                    CommentId.of(e.getCommentId()),
                    e.hasToEmail() ? e.getToEmail() : null,
                    e.getText(),
                    e.getAttachmentIdsList(),
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(TicketClosed.class)) {
                TicketClosed e = any.unpack(TicketClosed.class);
                return new TicketEvent.TicketClosed(
                    TicketId.of(e.getTicketId()),
                    TicketStatus.fromWireName(e.getPreviousStatus()),
                    e.hasResolution() ? e.getResolution() : null,
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(TicketReopened.class)) {
                TicketReopened e = any.unpack(TicketReopened.class);
                return new TicketEvent.TicketReopened(
                    TicketId.of(e.getTicketId()),
                    e.hasReason() ? e.getReason() : null,
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(PriorityChanged.class)) {
                PriorityChanged e = any.unpack(PriorityChanged.class);
                return new TicketEvent.PriorityChanged(
                    TicketId.of(e.getTicketId()),
                    TicketPriority.fromWireName(e.getFromPriority()),
                    TicketPriority.fromWireName(e.getToPriority()),
                    e.hasReason() ? e.getReason() : null,
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(TicketMerged.class)) {
                TicketMerged e = any.unpack(TicketMerged.class);
                return new TicketEvent.TicketMerged(
                    TicketId.of(e.getTicketId()),
                    TicketId.of(e.getTargetTicketId()),
                    e.hasReason() ? e.getReason() : null,
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(CustomerLinked.class)) {
                CustomerLinked e = any.unpack(CustomerLinked.class);
                return new TicketEvent.CustomerLinked(
                    TicketId.of(e.getTicketId()),
                    CustomerId.of(e.getCustomerId()),
                    e.hasPreviousCustomerId() ? CustomerId.of(e.getPreviousCustomerId()) : null,
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(CustomerUnlinked.class)) {
                CustomerUnlinked e = any.unpack(CustomerUnlinked.class);
                return new TicketEvent.CustomerUnlinked(
                    TicketId.of(e.getTicketId()),
                    CustomerId.of(e.getPreviousCustomerId()),
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(TicketUpdated.class)) {
                TicketUpdated e = any.unpack(TicketUpdated.class);
                return new TicketEvent.TicketUpdated(
                    TicketId.of(e.getTicketId()),
                    e.hasTitle() ? fieldChange(e.getTitle()) : null,
                    e.hasDescription() ? fieldChange(e.getDescription()) : null,
                    e.hasType() ? fieldChange(e.getType(), TicketType::fromLabel) : null,
                    e.hasOrderNumber() ? fieldChange(e.getOrderNumber()) : null,
                    e.hasTrackingNumber() ? fieldChange(e.getTrackingNumber()) : null,
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            } else if (any.is(FirstResponseRecorded.class)) {
                FirstResponseRecorded e = any.unpack(FirstResponseRecorded.class);
                return new TicketEvent.FirstResponseRecorded(
                    TicketId.of(e.getTicketId()),
                    Helpers.toInstant(e.getRespondedAt()),
                    e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
                    Helpers.toInstant(e.getOccurredAt()));
            }
        } catch (InvalidProtocolBufferException e) {
            throw new Errors.CodecError("Failed to unpack event: " + any.getTypeUrl(), e);
        } catch (IllegalArgumentException e) {
            // Unknown enum wire names in an otherwise valid payload.
            throw new Errors.CodecError(
                "Malformed " + Helpers.typeNameFromUrl(any.getTypeUrl()) + " payload: " + e.getMessage(), e);
        }
        throw new Errors.InvalidArgumentError(
            "Unknown ticket event type: " + Helpers.typeNameFromUrl(any.getTypeUrl()));
    }

    private static FieldChange<String> fieldChange(ValueChange change) {
        return fieldChange(change, Function.identity());
    }

    private static <T> FieldChange<T> fieldChange(ValueChange change, Function<String, T> fromWire) {
        return new FieldChange<>(
            change.hasFrom() ? fromWire.apply(change.getFrom()) : null,
            change.hasTo() ? fromWire.apply(change.getTo()) : null);
    }

    private static TicketEvent.TicketCreated createdEvent(TicketCreated e) {
        return new TicketEvent.TicketCreated(
            TicketId.of(e.getTicketId()),
            e.hasTitle() ? e.getTitle() : null,
            e.hasDescription() ? e.getDescription() : null,
            TicketPriority.fromWireName(e.getPriority()),
            e.hasType() ? TicketType.fromLabel(e.getType()) : null,
            e.hasReporterId() ? UserId.of(e.getReporterId()) : null,
            e.hasAssigneeId() ? UserId.of(e.getAssigneeId()) : null,
            senderInfo(e.getSender()),
            e.hasOrderNumber() ? e.getOrderNumber() : null,
            e.hasTrackingNumber() ? e.getTrackingNumber() : null,
            e.hasExternalMessageId() ? e.getExternalMessageId() : null,
            e.hasConversationId() ? e.getConversationId() : null,
            e.hasShippingAddress() ? shippingAddress(e.getShippingAddress()) : null,
            e.hasCustomerId() ? CustomerId.of(e.getCustomerId()) : null,
            e.hasCausedBy() ? UserId.of(e.getCausedBy()) : null,
            Helpers.toInstant(e.getOccurredAt()));
    }

    private static SenderInfo senderInfo(Sender s) {
        return new SenderInfo(
            s.hasEmail() ? s.getEmail() : null,
            s.hasName() ? s.getName() : null,
            s.hasPhone() ? s.getPhone() : null,
            s.hasCompany() ? s.getCompany() : null);
    }

    private static ShippingAddress shippingAddress(Address a) {
        return new ShippingAddress(
            a.hasName() ? a.getName() : null,
            a.hasCompany() ? a.getCompany() : null,
            a.hasCountry() ? a.getCountry() : null,
            a.hasAddressLine1() ? a.getAddressLine1() : null,
            a.hasAddressLine2() ? a.getAddressLine2() : null,
            a.hasAddressLine3() ? a.getAddressLine3() : null,
            a.hasCity() ? a.getCity() : null,
            a.hasState() ? a.getState() : null,
            a.hasPostalCode() ? a.getPostalCode() : null,
            a.hasPhone() ? a.getPhone() : null,
            a.hasEmail() ? a.getEmail() : null);
    }
}
