package org.opwire.wire;

import java.util.HashMap;
import java.util.Map;

/**
 * Legacy wire protocol opcodes.
 *
 * <p>Only {@link #REPLY}, {@link #UPDATE}, {@link #INSERT}, {@link #QUERY} and {@link #DELETE} are produced or
 * consumed by the client; the remaining values are recognized so that a header carrying them decodes cleanly.
 */
public enum Opcode {
    REPLY(1),
    MSG(1000),
    UPDATE(2001),
    INSERT(2002),
    GET_BY_OID(2003),
    QUERY(2004),
    GET_MORE(2005),
    DELETE(2006),
    KILL_CURSORS(2007);

    private static final Map<Integer, Opcode> BY_WIRE_VALUE = new HashMap<>();

    static {
        for (final Opcode opcode : values()) {
            BY_WIRE_VALUE.put(opcode.wireValue, opcode);
        }
    }

    private final int wireValue;

    Opcode(final int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Opcode fromWireValue(final int wireValue) {
        final Opcode opcode = BY_WIRE_VALUE.get(wireValue);
        if (opcode == null) {
            throw new UnrecognizedOpcodeException(wireValue);
        }
        return opcode;
    }
}
