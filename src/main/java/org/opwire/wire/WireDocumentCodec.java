package org.opwire.wire;

import org.bson.BsonDocument;

/**
 * Document serialization used inside message bodies and reply payloads.
 */
public interface WireDocumentCodec {
    byte[] encode(BsonDocument document);

    /**
     * Reads one document starting at {@code offset}. The document must end at or before {@code limit} (exclusive).
     *
     * @throws IllegalArgumentException if no complete document is present
     */
    DecodedDocument decode(byte[] source, int offset, int limit);
}
