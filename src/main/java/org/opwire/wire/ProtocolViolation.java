package org.opwire.wire;

/**
 * Structural checks applied to a server reply.
 */
public enum ProtocolViolation {
    UNEXPECTED_OPCODE("reply header opcode is not OP_REPLY"),
    RESPONSE_TO_MISMATCH("reply responseTo does not match the request id"),
    NONZERO_RESPONSE_FLAGS("reply carries nonzero responseFlags"),
    INVALID_MESSAGE_LENGTH("reply messageLength is out of range"),
    DOCUMENT_COUNT_MISMATCH("reply documents do not match numberReturned and messageLength");

    private final String description;

    ProtocolViolation(final String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
