package dev.ticketing.client;

import com.google.protobuf.Any;
import com.google.protobuf.Timestamp;
import dev.ticketing.EventBook;

import java.util.List;

/**
 * Append-only storage for aggregate event streams.
 *
 * <p>Implementations must keep per-stream ordering and append a whole batch atomically.
 */
public interface EventStore {

    /**
     * Load the full history of a stream.
     *
     * @param domain the aggregate domain (e.g. "ticket")
     * @param root the aggregate identifier
     * @return the stream, with no pages if nothing was ever appended
     */
    EventBook load(String domain, String root);

    /**
     * Append a batch of events to a stream.
     *
     * @param domain the aggregate domain
     * @param root the aggregate identifier
     * @param expectedSequence the sequence the first new page must receive, i.e. the
     *     number of pages the caller saw when it loaded the stream
     * @param events the events in decided order
     * @param recordedAt timestamp stamped on each new page
     * @return the stream after the append
     * @throws Errors.ConcurrencyError if another writer appended in between
     */
    EventBook append(String domain, String root, int expectedSequence, List<Any> events, Timestamp recordedAt);
}
