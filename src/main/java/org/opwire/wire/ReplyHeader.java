package org.opwire.wire;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The 20-byte OP_REPLY block that follows the message header.
 */
public final class ReplyHeader {
    public static final int LENGTH = 20;

    private final int responseFlags;
    private final long cursorId;
    private final int startingFrom;
    private final int numberReturned;

    public ReplyHeader(final int responseFlags, final long cursorId, final int startingFrom, final int numberReturned) {
        this.responseFlags = responseFlags;
        this.cursorId = cursorId;
        this.startingFrom = startingFrom;
        this.numberReturned = numberReturned;
    }

    public static ReplyHeader decode(final byte[] bytes) {
        if (bytes == null || bytes.length < LENGTH) {
            throw new IllegalArgumentException("reply header requires " + LENGTH + " bytes");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes, 0, LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        return new ReplyHeader(buffer.getInt(), buffer.getLong(), buffer.getInt(), buffer.getInt());
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
        return numberReturned;
    }

    @Override
    public String toString() {
        return "ReplyHeader{responseFlags=" + responseFlags
                + ", cursorId=" + cursorId
                + ", startingFrom=" + startingFrom
                + ", numberReturned=" + numberReturned + '}';
    }
}
