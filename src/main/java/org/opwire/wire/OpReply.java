package org.opwire.wire;

import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;

/**
 * A fully decoded OP_REPLY.
 *
 * <p>{@code cursorId} is kept for diagnostics only; follow-up batches are not fetched.
 */
public final class OpReply {
    private final int requestId;
    private final int responseTo;
    private final int responseFlags;
    private final long cursorId;
    private final int startingFrom;
    private final List<BsonDocument> documents;

    public OpReply(
            final int requestId,
            final int responseTo,
            final int responseFlags,
            final long cursorId,
            final int startingFrom,
            final List<BsonDocument> documents) {
        Objects.requireNonNull(documents, "documents");
        this.requestId = requestId;
        this.responseTo = responseTo;
        this.responseFlags = responseFlags;
        this.cursorId = cursorId;
        this.startingFrom = startingFrom;
        this.documents = List.copyOf(documents);
    }

    public int requestId() {
        return requestId;
    }

    public int responseTo() {
        return responseTo;
    }

    public int responseFlags() {
        return responseFlags;
    }

    public long cursorId() {
        return cursorId;
    }

    public int startingFrom() {
        return startingFrom;
    }

    public int numberReturned() {
        return documents.size();
    }

    public List<BsonDocument> documents() {
        return documents;
    }
}
