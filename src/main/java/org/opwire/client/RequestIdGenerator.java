package org.opwire.client;

import java.util.SplittableRandom;

/**
 * Pseudo-random stream of signed 32-bit request ids, uniform over the whole {@code int} range.
 *
 * <p>Ids are correlation tokens only. They are not guaranteed unique and carry no security meaning. Instances are not
 * thread-safe; a {@link Connection} draws from its own generator under its monitor.
 */
public final class RequestIdGenerator {
    private final SplittableRandom random;

    /**
     * Seeds from the runtime's default entropy source.
     */
    public RequestIdGenerator() {
        this(new SplittableRandom());
    }

    public RequestIdGenerator(final long seed) {
        this(new SplittableRandom(seed));
    }

    private RequestIdGenerator(final SplittableRandom random) {
        this.random = random;
    }

    public int next() {
        return random.nextInt();
    }
}
