package info.isaksson.erland.asn1sema.parsetree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An annotated parse node: a grammar production plus its ordered elements.
 *
 * <p>The tree is assumed to be grammar-valid. Accessors that expect a particular shape
 * throw {@link MalformedParseTreeException} when the expectation does not hold.</p>
 */
public final class ParseNode extends ParseElement {
    public final ProductionKind kind;
    public final List<ParseElement> elements;

    public ParseNode(ProductionKind kind, List<ParseElement> elements) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        this.kind = kind;
        this.elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static ParseNode of(ProductionKind kind, ParseElement... elements) {
        return new ParseNode(kind, Arrays.asList(elements));
    }

    /** Convenience for building nodes from parser tags. */
    public static ParseNode of(String tag, ParseElement... elements) {
        return of(ProductionKind.fromTag(tag), elements);
    }

    public int size() {
        return elements.size();
    }

    public ParseElement element(int index) {
        if (index < 0 || index >= elements.size()) {
            throw new MalformedParseTreeException(kind + " has " + elements.size()
                    + " elements, element " + index + " requested");
        }
        return elements.get(index);
    }

    /** Text of the token at {@code index}. */
    public String tokenText(int index) {
        return element(index).asToken().text;
    }

    /** Child node at {@code index}, which must be of the given production. */
    public ParseNode node(int index, ProductionKind expected) {
        ParseNode n = element(index).asNode();
        if (n.kind != expected) {
            throw new MalformedParseTreeException("Element " + index + " of " + kind
                    + " must be " + expected + " but was " + n.kind);
        }
        return n;
    }

    /** Nodes of the sequence at {@code index}. */
    public List<ParseNode> sequence(int index) {
        return element(index).asSequence().nodes;
    }

    /** All elements that are nodes, in order. */
    public List<ParseNode> childNodes() {
        List<ParseNode> out = new ArrayList<>();
        for (ParseElement e : elements) {
            if (e.isNode()) out.add(e.asNode());
        }
        return out;
    }

    /** Fails unless the node has between {@code min} and {@code max} elements. */
    public void requireArity(int min, int max) {
        int n = elements.size();
        if (n < min || n > max) {
            String expected = min == max ? Integer.toString(min) : min + ".." + max;
            throw new MalformedParseTreeException(kind + " expects " + expected
                    + " elements but has " + n + ": " + elements);
        }
    }

    @Override
    public boolean isNode() {
        return true;
    }

    @Override
    public boolean isNode(ProductionKind kind) {
        return this.kind == kind;
    }

    @Override
    public ParseNode asNode() {
        return this;
    }

    @Override
    String describe() {
        return kind + " node";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseNode)) return false;
        ParseNode that = (ParseNode) o;
        return kind == that.kind && elements.equals(that.elements);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, elements);
    }

    @Override public String toString() {
        return kind + elements.toString();
    }
}
