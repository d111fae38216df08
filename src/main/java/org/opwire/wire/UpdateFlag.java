package org.opwire.wire;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * OP_UPDATE flag bits. Bit values are fixed per constant and do not depend on declaration order.
 */
public enum UpdateFlag {
    UPSERT(1),
    MULTI_UPDATE(1 << 1);

    private final int bit;

    UpdateFlag(final int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public static int encode(final Set<UpdateFlag> flags) {
        Objects.requireNonNull(flags, "flags");
        int encoded = 0;
        for (final UpdateFlag flag : flags) {
            encoded |= flag.bit;
        }
        return encoded;
    }

    public static Set<UpdateFlag> decode(final int encoded) {
        final Set<UpdateFlag> flags = EnumSet.noneOf(UpdateFlag.class);
        for (final UpdateFlag flag : values()) {
            if ((encoded & flag.bit) == flag.bit) {
                flags.add(flag);
            }
        }
        return flags;
    }
}
