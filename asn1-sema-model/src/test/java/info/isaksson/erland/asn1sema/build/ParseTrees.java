package info.isaksson.erland.asn1sema.build;

import info.isaksson.erland.asn1sema.parsetree.ParseElement;
import info.isaksson.erland.asn1sema.parsetree.ParseNode;
import info.isaksson.erland.asn1sema.parsetree.ParseSequence;
import info.isaksson.erland.asn1sema.parsetree.ParseToken;
import info.isaksson.erland.asn1sema.parsetree.ProductionKind;

import java.util.ArrayList;
import java.util.List;

/** Compact parse-tree construction for builder tests. */
final class ParseTrees {

    private ParseTrees() {}

    /**
     * Strings and numbers become tokens, lists become node sequences and parse elements
     * are taken as they are.
     */
    static ParseNode node(String tag, Object... elements) {
        List<ParseElement> out = new ArrayList<>(elements.length);
        for (Object e : elements) {
            out.add(element(e));
        }
        return new ParseNode(ProductionKind.fromTag(tag), out);
    }

    private static ParseElement element(Object e) {
        if (e instanceof ParseElement) return (ParseElement) e;
        if (e instanceof String) return ParseToken.of((String) e);
        if (e instanceof Number) return ParseToken.of(((Number) e).longValue());
        if (e instanceof List<?>) {
            List<ParseNode> nodes = new ArrayList<>();
            for (Object n : (List<?>) e) {
                nodes.add((ParseNode) n);
            }
            return new ParseSequence(nodes);
        }
        throw new IllegalArgumentException("Unsupported element: " + e);
    }

    static ParseNode type(ParseNode inner) {
        return node("Type", inner);
    }

    static ParseNode simple(String name) {
        return type(node("SimpleType", name));
    }

    static ParseNode ref(String name) {
        return type(node("ReferencedType", name));
    }

    static ParseNode named(String identifier, ParseNode type) {
        return node("NamedType", node("Identifier", identifier), type);
    }

    static ParseNode component(String identifier, ParseNode type) {
        return node("ComponentType", named(identifier, type));
    }

    static ParseNode typeAssignment(String name, ParseNode type) {
        return node("TypeAssignment", name, "::=", type);
    }

    static ParseNode module(String name, ParseNode... assignments) {
        return node("ModuleDefinition",
                node("ModuleReference", name),
                "DEFINITIONS",
                "AUTOMATIC TAGS",
                "",
                "BEGIN",
                node("ModuleBody",
                        node("Exports"),
                        node("Imports"),
                        node("AssignmentList", (Object[]) assignments)),
                "END");
    }
}
