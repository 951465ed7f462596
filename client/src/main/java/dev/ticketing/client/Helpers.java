package dev.ticketing.client;

import com.google.protobuf.Any;
import com.google.protobuf.Message;
import com.google.protobuf.Timestamp;
import dev.ticketing.Cover;
import dev.ticketing.EventBook;
import dev.ticketing.EventPage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Helper methods for working with event envelopes.
 */
public final class Helpers {

    private static final String TYPE_URL_PREFIX = "type.googleapis.com/";

    private Helpers() {}

    /**
     * Calculate the next sequence number from an EventBook.
     */
    public static int nextSequence(EventBook book) {
        if (book == null || book.getPagesList().isEmpty()) {
            return 0;
        }
        return book.getPagesCount();
    }

    /**
     * Extract the type name from a type URL.
     */
    public static String typeNameFromUrl(String typeUrl) {
        int idx = typeUrl.lastIndexOf('/');
        return idx >= 0 ? typeUrl.substring(idx + 1) : typeUrl;
    }

    /**
     * Pack a protobuf message into an Any.
     */
    public static Any packAny(Message message) {
        return Any.pack(message, TYPE_URL_PREFIX);
    }

    /**
     * Convert an instant to a protobuf Timestamp.
     */
    public static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
            .setSeconds(instant.getEpochSecond())
            .setNanos(instant.getNano())
            .build();
    }

    /**
     * Convert a protobuf Timestamp to an instant.
     */
    public static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    /**
     * Build the pages for a batch of events, numbered from {@code firstSequence}.
     */
    public static List<EventPage> pages(int firstSequence, List<Any> events, Timestamp recordedAt) {
        List<EventPage> pages = new ArrayList<>(events.size());
        int sequence = firstSequence;
        for (Any event : events) {
            pages.add(EventPage.newBuilder()
                .setSequence(sequence++)
                .setEvent(event)
                .setCreatedAt(recordedAt)
                .build());
        }
        return pages;
    }

    /**
     * Create an empty EventBook for an aggregate stream.
     */
    public static EventBook emptyBook(String domain, String root) {
        return EventBook.newBuilder()
            .setCover(Cover.newBuilder()
                .setDomain(domain)
                .setRoot(root))
            .build();
    }
}
