package org.opwire.wire;

import java.util.Objects;
import org.bson.BsonDocument;

/**
 * A document read from a byte region together with the number of bytes it occupied.
 */
public record DecodedDocument(BsonDocument document, int length) {
    public DecodedDocument {
        Objects.requireNonNull(document, "document");
        if (length < 5) {
            throw new IllegalArgumentException("document length must be at least 5: " + length);
        }
    }
}
