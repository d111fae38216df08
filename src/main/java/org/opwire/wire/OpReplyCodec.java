package org.opwire.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;

/**
 * Encodes and validates OP_REPLY messages.
 *
 * <p>Decoding runs as separate stages (message header, reply block, document region) so that
 * {@link OpReplyReader} can apply each check as soon as its bytes arrive and a failure names the stage it came from.
 */
public final class OpReplyCodec {
    public static final int MAX_MESSAGE_LENGTH = 48_000_000;
    static final int PREFIX_LENGTH = MessageHeader.LENGTH + ReplyHeader.LENGTH;

    private final WireDocumentCodec documentCodec;

    public OpReplyCodec() {
        this(new BsonWireDocumentCodec());
    }

    public OpReplyCodec(final WireDocumentCodec documentCodec) {
        this.documentCodec = Objects.requireNonNull(documentCodec, "documentCodec");
    }

    public byte[] encode(final OpReply reply) {
        Objects.requireNonNull(reply, "reply");
        final List<byte[]> encodedDocuments = new ArrayList<>(reply.numberReturned());
        int documentsLength = 0;
        for (final BsonDocument document : reply.documents()) {
            final byte[] encoded = documentCodec.encode(document);
            encodedDocuments.add(encoded);
            documentsLength += encoded.length;
        }

        final int messageLength = PREFIX_LENGTH + documentsLength;
        final ByteBuffer buffer = ByteBuffer.allocate(messageLength).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(messageLength);
        buffer.putInt(reply.requestId());
        buffer.putInt(reply.responseTo());
        buffer.putInt(Opcode.REPLY.wireValue());
        buffer.putInt(reply.responseFlags());
        buffer.putLong(reply.cursorId());
        buffer.putInt(reply.startingFrom());
        buffer.putInt(reply.numberReturned());
        for (final byte[] encoded : encodedDocuments) {
            buffer.put(encoded);
        }
        return buffer.array();
    }

    /**
     * Decodes a complete in-memory reply without checking correlation.
     */
    public OpReply decode(final byte[] messageBytes) {
        return decode(messageBytes, null);
    }

    /**
     * Decodes a complete in-memory reply and requires its responseTo to equal {@code expectedResponseTo}.
     */
    public OpReply decode(final byte[] messageBytes, final int expectedResponseTo) {
        return decode(messageBytes, Integer.valueOf(expectedResponseTo));
    }

    private OpReply decode(final byte[] messageBytes, final Integer expectedResponseTo) {
        if (messageBytes == null || messageBytes.length < PREFIX_LENGTH) {
            throw new IllegalArgumentException("OP_REPLY bytes are too short.");
        }

        final MessageHeader header = MessageHeader.decode(messageBytes);
        validateHeader(header);
        if (expectedResponseTo != null) {
            validateCorrelation(header, expectedResponseTo);
        }
        if (header.messageLength() != messageBytes.length) {
            throw new WireProtocolException(
                    ProtocolViolation.INVALID_MESSAGE_LENGTH, messageBytes.length, header.messageLength());
        }

        final ReplyHeader replyHeader = decodeReplyHeader(
                Arrays.copyOfRange(messageBytes, MessageHeader.LENGTH, PREFIX_LENGTH));
        final List<BsonDocument> documents = decodeDocuments(
                Arrays.copyOfRange(messageBytes, PREFIX_LENGTH, messageBytes.length), replyHeader);
        return toReply(header, replyHeader, documents);
    }

    /**
     * Stage one: the header must announce an OP_REPLY whose length covers at least the reply block and stays below
     * {@link #MAX_MESSAGE_LENGTH}.
     */
    public void validateHeader(final MessageHeader header) {
        Objects.requireNonNull(header, "header");
        if (header.opcode() != Opcode.REPLY) {
            throw new WireProtocolException(ProtocolViolation.UNEXPECTED_OPCODE, Opcode.REPLY, header.opcode());
        }
        if (header.messageLength() < PREFIX_LENGTH || header.messageLength() > MAX_MESSAGE_LENGTH) {
            throw new WireProtocolException(
                    ProtocolViolation.INVALID_MESSAGE_LENGTH,
                    PREFIX_LENGTH + ".." + MAX_MESSAGE_LENGTH,
                    header.messageLength());
        }
    }

    public void validateCorrelation(final MessageHeader header, final int expectedResponseTo) {
        if (header.responseTo() != expectedResponseTo) {
            throw new WireProtocolException(
                    ProtocolViolation.RESPONSE_TO_MISMATCH, expectedResponseTo, header.responseTo());
        }
    }

    /**
     * Stage two: decodes the reply block and rejects any nonzero responseFlags.
     */
    public ReplyHeader decodeReplyHeader(final byte[] replyBlock) {
        final ReplyHeader replyHeader = ReplyHeader.decode(replyBlock);
        if (replyHeader.responseFlags() != 0) {
            throw new WireProtocolException(
                    ProtocolViolation.NONZERO_RESPONSE_FLAGS, 0, replyHeader.responseFlags());
        }
        return replyHeader;
    }

    public static int documentRegionLength(final MessageHeader header) {
        return header.messageLength() - PREFIX_LENGTH;
    }

    /**
     * Stage three: decodes exactly {@code numberReturned} documents, which together must fill {@code region}.
     */
    public List<BsonDocument> decodeDocuments(final byte[] region, final ReplyHeader replyHeader) {
        Objects.requireNonNull(region, "region");
        final int numberReturned = replyHeader.numberReturned();
        if (numberReturned < 0) {
            throw new WireProtocolException(
                    ProtocolViolation.DOCUMENT_COUNT_MISMATCH, "numberReturned >= 0", numberReturned);
        }

        final List<BsonDocument> documents = new ArrayList<>(Math.min(numberReturned, 1024));
        int offset = 0;
        for (int index = 0; index < numberReturned; index++) {
            final DecodedDocument decoded;
            try {
                decoded = documentCodec.decode(region, offset, region.length);
            } catch (final IllegalArgumentException invalidDocument) {
                throw new WireProtocolException(
                        ProtocolViolation.DOCUMENT_COUNT_MISMATCH,
                        numberReturned + " documents in " + region.length + " bytes",
                        index + " documents before offset " + offset,
                        invalidDocument);
            }
            documents.add(decoded.document());
            offset += decoded.length();
        }

        if (offset != region.length) {
            throw new WireProtocolException(
                    ProtocolViolation.DOCUMENT_COUNT_MISMATCH,
                    numberReturned + " documents in " + region.length + " bytes",
                    (region.length - offset) + " trailing bytes after " + numberReturned + " documents");
        }
        return documents;
    }

    static OpReply toReply(
            final MessageHeader header, final ReplyHeader replyHeader, final List<BsonDocument> documents) {
        return new OpReply(
                header.requestId(),
                header.responseTo(),
                replyHeader.responseFlags(),
                replyHeader.cursorId(),
                replyHeader.startingFrom(),
                documents);
    }
}
