package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** Value range constraint {@code (min..max)}. Bounds are literals or value nodes. */
public class Constraint extends SemaNode {
    public final SemaNode minValue;
    public final SemaNode maxValue;

    public Constraint(SemaNode minValue, SemaNode maxValue) {
        if (minValue == null) throw new IllegalArgumentException("minValue must not be null");
        if (maxValue == null) throw new IllegalArgumentException("maxValue must not be null");
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.CONSTRAINT;
    }

    @Override
    public List<SemaNode> children() {
        return List.of(minValue, maxValue);
    }

    @Override
    public String toString() {
        return "(" + minValue + ".." + maxValue + ")";
    }
}
