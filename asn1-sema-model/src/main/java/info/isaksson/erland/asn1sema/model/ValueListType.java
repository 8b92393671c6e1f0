package info.isaksson.erland.asn1sema.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumeration-like type: {@code ENUMERATED { a, b(5), c }} or {@code INTEGER { one(1), two(2) }}.
 *
 * <p>Entries without an explicit value are numbered on construction: the first entry gets 0,
 * every later one the previous entry's value plus one. Extension markers are kept in place and
 * skipped when looking for the previous entry.</p>
 */
public final class ValueListType extends TypeDeclaration {
    public final String typeName;
    /** {@link NamedValue} and {@link ExtensionMarker} entries in source order; empty when none were given. */
    public final List<SemaNode> namedValues;

    public ValueListType(String typeName, List<? extends SemaNode> namedValues) {
        if (typeName == null) throw new IllegalArgumentException("typeName must not be null");
        this.typeName = typeName;
        this.namedValues = namedValues == null ? List.of() : List.copyOf(autoNumber(namedValues));
    }

    public ValueListType(String typeName) {
        this(typeName, null);
    }

    private static List<SemaNode> autoNumber(List<? extends SemaNode> in) {
        List<SemaNode> out = new ArrayList<>(in.size());
        NamedValue previous = null;
        for (SemaNode n : in) {
            if (!(n instanceof NamedValue)) {
                out.add(n);
                continue;
            }
            NamedValue nv = (NamedValue) n;
            if (!nv.hasValue()) {
                nv = nv.withValue(previous == null ? "0" : numericValue(previous).add(BigInteger.ONE).toString());
            }
            out.add(nv);
            previous = nv;
        }
        return out;
    }

    /** ASN.1 integers are unbounded. */
    private static BigInteger numericValue(NamedValue nv) {
        try {
            return new BigInteger(nv.value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot number entry after '" + nv.identifier
                    + "': value '" + nv.value + "' is not an integer", e);
        }
    }

    /** Only the {@link NamedValue} entries. */
    public List<NamedValue> values() {
        List<NamedValue> out = new ArrayList<>();
        for (SemaNode n : namedValues) {
            if (n instanceof NamedValue) out.add((NamedValue) n);
        }
        return out;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.VALUE_LIST_TYPE;
    }

    @Override
    public List<SemaNode> children() {
        return namedValues;
    }

    @Override
    public String toString() {
        if (namedValues.isEmpty()) return typeName;
        return typeName + " { " + join(namedValues, ", ") + " }";
    }
}
