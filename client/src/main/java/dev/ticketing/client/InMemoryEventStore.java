package dev.ticketing.client;

import com.google.protobuf.Any;
import com.google.protobuf.Timestamp;
import dev.ticketing.EventBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Event store backed by a concurrent map, one EventBook per stream.
 *
 * <p>Appends are atomic per stream and guarded by an expected-sequence check.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<String, EventBook> books = new ConcurrentHashMap<>();

    @Override
    public EventBook load(String domain, String root) {
        EventBook book = books.get(key(domain, root));
        return book != null ? book : Helpers.emptyBook(domain, root);
    }

    @Override
    public EventBook append(String domain, String root, int expectedSequence, List<Any> events, Timestamp recordedAt) {
        if (events.isEmpty()) {
            throw new Errors.InvalidArgumentError("No events to append");
        }

        EventBook updated = books.compute(key(domain, root), (key, current) -> {
            EventBook book = current != null ? current : Helpers.emptyBook(domain, root);
            int actual = Helpers.nextSequence(book);
            if (actual != expectedSequence) {
                logger.warn("append_conflict",
                    kv("domain", domain), kv("root", root),
                    kv("expected_sequence", expectedSequence), kv("actual_sequence", actual));
                throw new Errors.ConcurrencyError(root, expectedSequence, actual);
            }
            return book.toBuilder()
                .addAllPages(Helpers.pages(actual, events, recordedAt))
                .build();
        });

        logger.debug("events_appended",
            kv("domain", domain), kv("root", root),
            kv("appended", events.size()), kv("next_sequence", updated.getPagesCount()));
        return updated;
    }

    /**
     * Number of streams currently held.
     */
    public int size() {
        return books.size();
    }

    private static String key(String domain, String root) {
        return domain + "/" + root;
    }
}
