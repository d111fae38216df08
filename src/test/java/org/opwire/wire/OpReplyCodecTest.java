package org.opwire.wire;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

class OpReplyCodecTest {
    private static final BsonDocument FIRST = BsonDocument.parse("{\"_id\": 1, \"name\": \"alice\"}");
    private static final BsonDocument SECOND = BsonDocument.parse("{\"_id\": 2, \"name\": \"bob\"}");

    private final OpReplyCodec codec = new OpReplyCodec();

    @Test
    void decodesTwoDocumentsInWireOrder() {
        final byte[] message = ReplyFixtures.reply(77, FIRST, SECOND);
        final OpReply reply = codec.decode(message, 77);

        assertEquals(77, reply.responseTo());
        assertEquals(0, reply.responseFlags());
        assertEquals(2, reply.numberReturned());
        assertEquals(List.of(FIRST, SECOND), reply.documents());
    }

    @Test
    void roundTripsEncodedReply() {
        final OpReply original = new OpReply(9, -41, 0, 123456789012L, 40, List.of(FIRST, SECOND));

        final byte[] encoded = codec.encode(original);
        final OpReply decoded = codec.decode(encoded, -41);

        assertEquals(encoded.length, ByteBuffer.wrap(encoded).order(ByteOrder.LITTLE_ENDIAN).getInt());
        assertEquals(9, decoded.requestId());
        assertEquals(123456789012L, decoded.cursorId());
        assertEquals(40, decoded.startingFrom());
        assertEquals(original.documents(), decoded.documents());
    }

    @Test
    void decodesEmptyReply() {
        final OpReply reply = codec.decode(ReplyFixtures.reply(3));
        assertTrue(reply.documents().isEmpty());
    }

    @Test
    void rejectsNonReplyOpcode() {
        final byte[] message = ReplyFixtures.reply(1, 77, Opcode.QUERY.wireValue(), 0, 1, FIRST);
        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message, 77));

        assertEquals(ProtocolViolation.UNEXPECTED_OPCODE, failure.violation());
        assertEquals("REPLY", failure.expected());
        assertEquals("QUERY", failure.observed());
    }

    @Test
    void rejectsOpcodeOutsideTheTable() {
        final byte[] message = ReplyFixtures.reply(1, 77, 2013, 0, 1, FIRST);
        final UnrecognizedOpcodeException failure =
                assertThrows(UnrecognizedOpcodeException.class, () -> codec.decode(message, 77));
        assertEquals(2013, failure.wireValue());
    }

    @Test
    void rejectsMismatchedResponseTo() {
        final byte[] message = ReplyFixtures.reply(78, FIRST);
        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message, 77));

        assertEquals(ProtocolViolation.RESPONSE_TO_MISMATCH, failure.violation());
        assertEquals("77", failure.expected());
        assertEquals("78", failure.observed());
        assertTrue(failure.getMessage().contains("expected=77 observed=78"));
    }

    @Test
    void rejectsNonzeroResponseFlags() {
        final byte[] queryFailure = ReplyFixtures.reply(1, 77, 1, 2, 1, FIRST);
        final WireProtocolException failure =
                assertThrows(WireProtocolException.class, () -> codec.decode(queryFailure, 77));

        assertEquals(ProtocolViolation.NONZERO_RESPONSE_FLAGS, failure.violation());
        assertEquals("2", failure.observed());
    }

    @Test
    void rejectsDeclaredCountAboveDocumentsPresent() {
        final byte[] message = ReplyFixtures.reply(1, 77, 1, 0, 3, FIRST, SECOND);
        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message));

        assertEquals(ProtocolViolation.DOCUMENT_COUNT_MISMATCH, failure.violation());
        assertTrue(failure.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void rejectsDeclaredCountBelowDocumentsPresent() {
        final byte[] message = ReplyFixtures.reply(1, 77, 1, 0, 1, FIRST, SECOND);
        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message));

        assertEquals(ProtocolViolation.DOCUMENT_COUNT_MISMATCH, failure.violation());
    }

    @Test
    void rejectsNegativeDocumentCount() {
        final byte[] message = ReplyFixtures.reply(1, 77, 1, 0, -1);
        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message));

        assertEquals(ProtocolViolation.DOCUMENT_COUNT_MISMATCH, failure.violation());
    }

    @Test
    void rejectsTrailingGarbageAfterDeclaredDocuments() {
        final byte[] message =
                ReplyFixtures.replyWithTrailing(1, 77, 1, 0, 1, new byte[] {1, 2, 3}, FIRST);
        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message));

        assertEquals(ProtocolViolation.DOCUMENT_COUNT_MISMATCH, failure.violation());
        assertTrue(failure.observed().startsWith("3 trailing bytes"));
    }

    @Test
    void rejectsLengthShorterThanReplyPrefix() {
        final byte[] message = ReplyFixtures.reply(77);
        ByteBuffer.wrap(message).order(ByteOrder.LITTLE_ENDIAN).putInt(0, 20);

        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message));
        assertEquals(ProtocolViolation.INVALID_MESSAGE_LENGTH, failure.violation());
    }

    @Test
    void rejectsLengthThatDisagreesWithBuffer() {
        final byte[] message = ReplyFixtures.reply(77, FIRST);
        ByteBuffer.wrap(message).order(ByteOrder.LITTLE_ENDIAN).putInt(0, message.length + 4);

        final WireProtocolException failure = assertThrows(WireProtocolException.class, () -> codec.decode(message));
        assertEquals(ProtocolViolation.INVALID_MESSAGE_LENGTH, failure.violation());
    }
}
