package info.isaksson.erland.asn1sema.build;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates placeholder identifiers ({@code unnamed1}, {@code unnamed2}, ...) for anonymous
 * structural members.
 *
 * <p>{@link #shared()} is the process-wide default: every builder that does not get its own
 * sequence draws from it, so placeholders never repeat within a process, even across independent
 * builds or builds running on different threads. Builders that need reproducible names can be
 * given a {@link #create() fresh} sequence instead.</p>
 */
public final class UnnamedMemberSequence {

    static final String PREFIX = "unnamed";

    private static final UnnamedMemberSequence SHARED = new UnnamedMemberSequence();

    private final AtomicInteger counter = new AtomicInteger();

    private UnnamedMemberSequence() {}

    public static UnnamedMemberSequence shared() {
        return SHARED;
    }

    /** A new sequence starting at {@code unnamed1}, independent of all others. */
    public static UnnamedMemberSequence create() {
        return new UnnamedMemberSequence();
    }

    public String next() {
        return PREFIX + counter.incrementAndGet();
    }
}
