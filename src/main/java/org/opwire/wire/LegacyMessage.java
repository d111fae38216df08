package org.opwire.wire;

import java.util.Objects;

/**
 * A framed request ready to be written to the stream in one piece.
 */
public final class LegacyMessage {
    private final int requestId;
    private final Opcode opcode;
    private final byte[] bytes;

    LegacyMessage(final int requestId, final Opcode opcode, final byte[] bytes) {
        this.requestId = requestId;
        this.opcode = Objects.requireNonNull(opcode, "opcode");
        this.bytes = Objects.requireNonNull(bytes, "bytes");
    }

    public int requestId() {
        return requestId;
    }

    public Opcode opcode() {
        return opcode;
    }

    public int messageLength() {
        return bytes.length;
    }

    /**
     * Returns the backing array; callers must not modify it.
     */
    public byte[] bytes() {
        return bytes;
    }
}
