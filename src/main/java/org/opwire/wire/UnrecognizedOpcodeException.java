package org.opwire.wire;

/**
 * Thrown when a header carries an opcode value outside the legacy opcode table.
 */
public final class UnrecognizedOpcodeException extends IllegalArgumentException {
    private final int wireValue;

    public UnrecognizedOpcodeException(final int wireValue) {
        super("unrecognized opcode: " + wireValue);
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }
}
