package info.isaksson.erland.asn1sema.parsetree;

import java.util.List;
import java.util.Objects;

/** A nested, ordered list of parse nodes (e.g. the component list of a SEQUENCE). */
public final class ParseSequence extends ParseElement {
    public final List<ParseNode> nodes;

    public ParseSequence(List<ParseNode> nodes) {
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public static ParseSequence of(ParseNode... nodes) {
        return new ParseSequence(List.of(nodes));
    }

    @Override
    public boolean isSequence() {
        return true;
    }

    @Override
    public ParseSequence asSequence() {
        return this;
    }

    @Override
    String describe() {
        return "sequence of " + nodes.size() + " nodes";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseSequence)) return false;
        return nodes.equals(((ParseSequence) o).nodes);
    }

    @Override public int hashCode() {
        return Objects.hash(nodes);
    }

    @Override public String toString() {
        return nodes.toString();
    }
}
