package org.opwire.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.bson.BsonDocument;
import org.bson.io.BasicOutputBuffer;

/**
 * Builds legacy request bodies and wraps them in the length-prefixed envelope.
 *
 * <p>Body layouts, all integers little-endian int32:
 * <pre>
 * OP_DELETE  0 | collection\0 | 0 | selector
 * OP_INSERT  0 | collection\0 | document...
 * OP_QUERY   flags | collection\0 | numberToSkip | numberToReturn | selector [| fieldSelector]
 * OP_UPDATE  0 | collection\0 | flags | selector | update
 * </pre>
 */
public final class LegacyMessageEncoder {
    private static final int RESERVED = 0;
    private static final int REQUEST_RESPONSE_TO = 0;

    private final WireDocumentCodec documentCodec;

    public LegacyMessageEncoder() {
        this(new BsonWireDocumentCodec());
    }

    public LegacyMessageEncoder(final WireDocumentCodec documentCodec) {
        this.documentCodec = Objects.requireNonNull(documentCodec, "documentCodec");
    }

    public byte[] deleteBody(final String collection, final BsonDocument selector) {
        final BasicOutputBuffer body = new BasicOutputBuffer();
        body.writeInt32(RESERVED);
        writeCollection(body, collection);
        body.writeInt32(RESERVED); // flags
        writeDocument(body, selector, "selector");
        return body.toByteArray();
    }

    public byte[] insertBody(final String collection, final BsonDocument document) {
        return insertManyBody(collection, List.of(Objects.requireNonNull(document, "document")));
    }

    /**
     * All documents travel in one body in input order. No size limit is enforced here.
     */
    public byte[] insertManyBody(final String collection, final List<BsonDocument> documents) {
        Objects.requireNonNull(documents, "documents");
        final BasicOutputBuffer body = new BasicOutputBuffer();
        body.writeInt32(RESERVED);
        writeCollection(body, collection);
        for (final BsonDocument document : documents) {
            writeDocument(body, document, "documents entries");
        }
        return body.toByteArray();
    }

    /**
     * @param fieldSelector may be {@code null}, in which case no bytes are written for it
     */
    public byte[] queryBody(
            final String collection,
            final Set<QueryOption> options,
            final int numberToSkip,
            final int numberToReturn,
            final BsonDocument selector,
            final BsonDocument fieldSelector) {
        final BasicOutputBuffer body = new BasicOutputBuffer();
        body.writeInt32(QueryOption.encode(options));
        writeCollection(body, collection);
        body.writeInt32(numberToSkip);
        body.writeInt32(numberToReturn);
        writeDocument(body, selector, "selector");
        if (fieldSelector != null) {
            writeDocument(body, fieldSelector, "fieldSelector");
        }
        return body.toByteArray();
    }

    public byte[] updateBody(
            final String collection,
            final Set<UpdateFlag> flags,
            final BsonDocument selector,
            final BsonDocument update) {
        final BasicOutputBuffer body = new BasicOutputBuffer();
        body.writeInt32(RESERVED);
        writeCollection(body, collection);
        body.writeInt32(UpdateFlag.encode(flags));
        writeDocument(body, selector, "selector");
        writeDocument(body, update, "update");
        return body.toByteArray();
    }

    /**
     * Wraps {@code body} in a request envelope: messageLength, requestId, responseTo (always 0), opcode, body.
     */
    public LegacyMessage frame(final int requestId, final Opcode opcode, final byte[] body) {
        Objects.requireNonNull(opcode, "opcode");
        Objects.requireNonNull(body, "body");
        final int messageLength = MessageHeader.LENGTH + body.length;
        final byte[] bytes = ByteBuffer.allocate(messageLength)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(messageLength)
                .putInt(requestId)
                .putInt(REQUEST_RESPONSE_TO)
                .putInt(opcode.wireValue())
                .put(body)
                .array();
        return new LegacyMessage(requestId, opcode, bytes);
    }

    /**
     * Encodes a collection name as its UTF-8 bytes followed by a single zero byte, with no length prefix.
     */
    public static byte[] encodeCollectionName(final String collection) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be blank");
        }
        if (collection.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("collection must not contain a NUL character: " + collection);
        }
        final byte[] nameBytes = collection.getBytes(StandardCharsets.UTF_8);
        final byte[] encoded = new byte[nameBytes.length + 1];
        System.arraycopy(nameBytes, 0, encoded, 0, nameBytes.length);
        return encoded;
    }

    private static void writeCollection(final BasicOutputBuffer body, final String collection) {
        body.writeBytes(encodeCollectionName(collection));
    }

    private void writeDocument(final BasicOutputBuffer body, final BsonDocument document, final String name) {
        if (document == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        body.writeBytes(documentCodec.encode(document));
    }
}
