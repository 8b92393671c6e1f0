package info.isaksson.erland.asn1sema.model;

/** {@code SIZE(min..max)}; same shape as a value range constraint. */
public final class SizeConstraint extends Constraint {

    public SizeConstraint(SemaNode minValue, SemaNode maxValue) {
        super(minValue, maxValue);
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.SIZE_CONSTRAINT;
    }

    @Override
    public String toString() {
        return "SIZE(" + minValue + ".." + maxValue + ")";
    }
}
