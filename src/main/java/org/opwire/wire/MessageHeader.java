package org.opwire.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The 16-byte header shared by every legacy wire message.
 */
public final class MessageHeader {
    public static final int LENGTH = 16;

    private final int messageLength;
    private final int requestId;
    private final int responseTo;
    private final Opcode opcode;

    public MessageHeader(final int messageLength, final int requestId, final int responseTo, final Opcode opcode) {
        if (opcode == null) {
            throw new IllegalArgumentException("opcode must not be null");
        }
        this.messageLength = messageLength;
        this.requestId = requestId;
        this.responseTo = responseTo;
        this.opcode = opcode;
    }

    /**
     * Decodes the header from the first {@value #LENGTH} bytes of {@code bytes}.
     *
     * @throws UnrecognizedOpcodeException if the opcode field is outside the opcode table
     */
    public static MessageHeader decode(final byte[] bytes) {
        if (bytes == null || bytes.length < LENGTH) {
            throw new IllegalArgumentException("message header requires " + LENGTH + " bytes");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes, 0, LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        final int messageLength = buffer.getInt();
        final int requestId = buffer.getInt();
        final int responseTo = buffer.getInt();
        final Opcode opcode = Opcode.fromWireValue(buffer.getInt());
        return new MessageHeader(messageLength, requestId, responseTo, opcode);
    }

    public byte[] encode() {
        return ByteBuffer.allocate(LENGTH)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(messageLength)
                .putInt(requestId)
                .putInt(responseTo)
                .putInt(opcode.wireValue())
                .array();
    }

    public int messageLength() {
        return messageLength;
    }

    public int requestId() {
        return requestId;
    }

    public int responseTo() {
        return responseTo;
    }

    public Opcode opcode() {
        return opcode;
    }

    @Override
    public String toString() {
        return "MessageHeader{messageLength=" + messageLength
                + ", requestId=" + requestId
                + ", responseTo=" + responseTo
                + ", opcode=" + opcode + '}';
    }
}
