package org.opwire.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.bson.BsonDocument;

/**
 * Hand-assembled OP_REPLY bytes, including malformed ones the codec refuses to produce.
 */
public final class ReplyFixtures {
    private static final BsonWireDocumentCodec DOCUMENTS = new BsonWireDocumentCodec();

    private ReplyFixtures() {}

    public static byte[] reply(final int responseTo, final BsonDocument... documents) {
        return reply(1, responseTo, 1, 0, documents.length, documents);
    }

    public static byte[] reply(
            final int requestId,
            final int responseTo,
            final int opcode,
            final int responseFlags,
            final int numberReturned,
            final BsonDocument... documents) {
        return replyWithTrailing(requestId, responseTo, opcode, responseFlags, numberReturned, new byte[0], documents);
    }

    public static byte[] replyWithTrailing(
            final int requestId,
            final int responseTo,
            final int opcode,
            final int responseFlags,
            final int numberReturned,
            final byte[] trailing,
            final BsonDocument... documents) {
        int documentsLength = 0;
        final byte[][] encoded = new byte[documents.length][];
        for (int index = 0; index < documents.length; index++) {
            encoded[index] = DOCUMENTS.encode(documents[index]);
            documentsLength += encoded[index].length;
        }

        final int messageLength = 16 + 20 + documentsLength + trailing.length;
        final ByteBuffer buffer = ByteBuffer.allocate(messageLength).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(messageLength);
        buffer.putInt(requestId);
        buffer.putInt(responseTo);
        buffer.putInt(opcode);
        buffer.putInt(responseFlags);
        buffer.putLong(0L); // cursorId
        buffer.putInt(0); // startingFrom
        buffer.putInt(numberReturned);
        for (final byte[] document : encoded) {
            buffer.put(document);
        }
        buffer.put(trailing);
        return buffer.array();
    }
}
