package info.isaksson.erland.asn1sema.model;

import java.util.List;

/** The {@code ...} extensibility marker. */
public final class ExtensionMarker extends SemaNode {

    @Override
    public SemaNodeKind kind() {
        return SemaNodeKind.EXTENSION_MARKER;
    }

    @Override
    public List<SemaNode> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return "...";
    }
}
