package com.funcplan.export;

import com.funcplan.plan.NodeKind;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable fill colour per node kind, shared by every exporter so the same kind looks the same
 * in HTML and SVG output.
 */
public final class NodeColors {

    static final List<String> CRAYON_COLORS = List.of(
            "cornflowerblue",
            "lightcoral",
            "gold",
            "mediumseagreen",
            "orchid",
            "sandybrown",
            "plum",
            "turquoise",
            "khaki",
            "salmon");

    private NodeColors() {}

    /** SHA-256 of the name, modulo the palette size. */
    public static String colorFor(String name) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(name.getBytes(StandardCharsets.UTF_8));
            int index = new BigInteger(1, digest).mod(BigInteger.valueOf(CRAYON_COLORS.size())).intValue();
            return CRAYON_COLORS.get(index);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String colorFor(NodeKind kind) {
        return colorFor(kind.displayName());
    }

    /** Kind display name to colour, in enum order. */
    public static Map<String, String> colorMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            map.put(kind.displayName(), colorFor(kind));
        }
        return map;
    }
}
