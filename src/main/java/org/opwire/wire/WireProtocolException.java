package org.opwire.wire;

import java.util.Objects;

/**
 * Signals a reply that breaks the legacy framing contract.
 *
 * <p>The stream position is unknown once this is thrown, so the connection that produced it must not be reused.
 */
public final class WireProtocolException extends RuntimeException {
    private final ProtocolViolation violation;
    private final String expected;
    private final String observed;

    public WireProtocolException(final ProtocolViolation violation, final Object expected, final Object observed) {
        this(violation, expected, observed, null);
    }

    public WireProtocolException(
            final ProtocolViolation violation,
            final Object expected,
            final Object observed,
            final Throwable cause) {
        super(message(violation, expected, observed), cause);
        this.violation = violation;
        this.expected = String.valueOf(expected);
        this.observed = String.valueOf(observed);
    }

    public ProtocolViolation violation() {
        return violation;
    }

    public String expected() {
        return expected;
    }

    public String observed() {
        return observed;
    }

    private static String message(final ProtocolViolation violation, final Object expected, final Object observed) {
        Objects.requireNonNull(violation, "violation");
        return violation.description() + " expected=" + expected + " observed=" + observed;
    }
}
