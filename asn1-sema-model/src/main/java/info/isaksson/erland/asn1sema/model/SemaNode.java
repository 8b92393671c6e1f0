package info.isaksson.erland.asn1sema.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for all semantic nodes.
 *
 * <p>Nodes form a tree: every node is owned by exactly one parent. The only non-tree relation is
 * the name-based reference edge exposed through {@link Reference}, which is resolved by lookup and
 * never by a direct link.</p>
 *
 * <p>{@link #toString()} renders the node back to ASN.1 notation.</p>
 */
public abstract class SemaNode {

    SemaNode() {}

    public abstract SemaNodeKind kind();

    /**
     * Directly owned nodes, in declaration order. Nodes held in owned lists are included;
     * lists of lists are not flattened.
     */
    public abstract List<SemaNode> children();

    /**
     * All recursively owned nodes, depth first and pre-order (a child precedes its own
     * descendants, siblings left to right). Never contains this node.
     */
    public List<SemaNode> descendants() {
        List<SemaNode> out = new ArrayList<>();
        collectDescendants(this, out);
        return out;
    }

    private static void collectDescendants(SemaNode node, List<SemaNode> out) {
        for (SemaNode child : node.children()) {
            out.add(child);
            collectDescendants(child, out);
        }
    }

    /** Children helper: skips absent optional members. */
    static List<SemaNode> nodes(SemaNode... candidates) {
        List<SemaNode> out = new ArrayList<>(candidates.length);
        for (SemaNode n : candidates) {
            if (n != null) out.add(n);
        }
        return List.copyOf(out);
    }

    static String join(List<? extends SemaNode> nodes, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(nodes.get(i));
        }
        return sb.toString();
    }
}
