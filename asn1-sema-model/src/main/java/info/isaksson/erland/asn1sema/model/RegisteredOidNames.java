package info.isaksson.erland.asn1sema.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Well-known object identifier arc names and their numbers (X.660 top-level arcs and their
 * standard second-level arcs).
 */
public final class RegisteredOidNames {

    private static final Map<String, Integer> NAMES = createNames();

    private RegisteredOidNames() {}

    /** Unmodifiable name -> number map in registration order. */
    public static Map<String, Integer> all() {
        return NAMES;
    }

    public static OptionalInt lookup(String name) {
        Integer n = name == null ? null : NAMES.get(name);
        return n == null ? OptionalInt.empty() : OptionalInt.of(n);
    }

    public static boolean isRegistered(String name) {
        return name != null && NAMES.containsKey(name);
    }

    private static Map<String, Integer> createNames() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("ccitt", 0);
        m.put("iso", 1);
        m.put("joint-iso-ccitt", 2);
        // ccitt
        m.put("recommendation", 0);
        m.put("question", 1);
        m.put("administration", 2);
        m.put("network-operator", 3);
        // iso
        m.put("standard", 0);
        m.put("registration-authority", 1);
        m.put("member-body", 2);
        m.put("identified-organization", 3);
        // joint-iso-ccitt
        m.put("country", 16);
        m.put("registration-procedures", 17);
        return Collections.unmodifiableMap(m);
    }
}
