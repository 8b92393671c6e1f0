package info.isaksson.erland.asn1sema.core;

import info.isaksson.erland.asn1sema.build.UnnamedMemberSequence;

/**
 * Options for building and ordering semantic models.
 */
public final class Asn1SemaOptions {

    /**
     * Source of placeholder names for anonymous members. Defaults to the process-wide sequence;
     * set {@link UnnamedMemberSequence#create()} for names that only depend on this build.
     */
    public UnnamedMemberSequence unnamedMembers = UnnamedMemberSequence.shared();

    public OrderingMode ordering = OrderingMode.DEPENDENCY;
}
