package org.opwire.wire;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * OP_QUERY flag bits.
 */
public enum QueryOption {
    TAILABLE_CURSOR(2),
    SLAVE_OK(4),
    OPLOG_REPLAY(8),
    NO_CURSOR_TIMEOUT(16);

    private final int bit;

    QueryOption(final int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public static int encode(final Set<QueryOption> options) {
        Objects.requireNonNull(options, "options");
        int flags = 0;
        for (final QueryOption option : options) {
            flags |= option.bit;
        }
        return flags;
    }

    /**
     * Returns the options whose bits are set in {@code flags}. Bits without a matching option are ignored.
     */
    public static Set<QueryOption> decode(final int flags) {
        final Set<QueryOption> options = EnumSet.noneOf(QueryOption.class);
        for (final QueryOption option : values()) {
            if ((flags & option.bit) == option.bit) {
                options.add(option);
            }
        }
        return options;
    }
}
