package com.tallyInsight.reportChat.normalizer.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Read-only helpers for walking a raw export tree (maps, ordered lists and scalars).
 * Nothing here mutates the tree.
 */
public final class ExportTree {

    /**
     * Default depth bound for tree searches.
     */
    public static final int DEFAULT_MAX_DEPTH = 64;

    /**
     * Keys that carry a display name, in probe order.
     */
    public static final List<String> NAME_KEYS = List.of("DSPDISPNAME", "DSPACCNAME", "NAME", "LEDGERNAME", "ACCNAME");

    private static final String ENVELOPE = "ENVELOPE";

    private ExportTree() {}

    /**
     * Unwraps the {@code ENVELOPE} root if present.
     *
     * @param raw Deserialized export
     * @return The envelope map, the root map itself, or null when the root is not a map
     */
    public static Map<String, Object> envelope(Object raw) {
        Map<String, Object> root = asMap(raw);
        if (root == null) {
            return null;
        }
        Map<String, Object> envelope = asMap(root.get(ENVELOPE));
        return envelope != null ? envelope : root;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object node) {
        if (node instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    /**
     * Views a node as a list. The transport layer collapses a single repeated tag into a map,
     * so a lone map is treated as a one-element list.
     */
    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object node) {
        if (node instanceof List<?> list) {
            return (List<Object>) list;
        }
        if (node instanceof Map<?, ?>) {
            return List.of(node);
        }
        return Collections.emptyList();
    }

    /**
     * @return true if the node is a list (not a single collapsed map)
     */
    public static boolean isList(Object node) {
        return node instanceof List<?>;
    }

    public static boolean isScalar(Object node) {
        return node instanceof CharSequence || node instanceof Number;
    }

    /**
     * @return the element at {@code index} of a list node, or null when out of range
     */
    public static Object elementAt(Object listNode, int index) {
        if (listNode instanceof List<?> list && index >= 0 && index < list.size()) {
            return list.get(index);
        }
        return null;
    }

    /**
     * Reads a nested map path, e.g. {@code path(info, "DSPDRAMT", "DSPDRAMTA")}.
     *
     * @return The value at the end of the path, or null if any step is missing or not a map
     */
    public static Object path(Object node, String... keys) {
        Object current = node;
        for (String key : keys) {
            Map<String, Object> map = asMap(current);
            if (map == null) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    /**
     * Text of a scalar that is non-blank and not the literal {@code "null"}.
     */
    public static String nonBlankText(Object node) {
        if (!isScalar(node)) {
            return null;
        }
        String text = node.toString().trim();
        if (text.isEmpty() || "null".equalsIgnoreCase(text)) {
            return null;
        }
        return text;
    }

    /**
     * Finds the first map (pre-order, document order) that contains {@code key}.
     * Uses an explicit stack bounded by {@code maxDepth}, so deeply nested or cyclic input
     * cannot overflow the call stack.
     *
     * @param root Tree root
     * @param key Key to look for
     * @param maxDepth Maximum nesting depth to descend into
     * @return The first block containing the key, or null
     */
    public static Map<String, Object> findBlockWithKey(Object root, String key, int maxDepth) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Object node = frame.node();

            Collection<?> children;
            Map<String, Object> map = asMap(node);
            if (map != null) {
                if (map.containsKey(key)) {
                    return map;
                }
                children = map.values();
            } else if (node instanceof List<?> list) {
                children = list;
            } else {
                continue;
            }

            if (frame.depth() >= maxDepth) {
                continue;
            }

            // reversed so the first child is popped first
            List<Object> ordered = new ArrayList<>(children);
            for (int i = ordered.size() - 1; i >= 0; i--) {
                Object child = ordered.get(i);
                if (child instanceof Map<?, ?> || child instanceof List<?>) {
                    stack.push(new Frame(child, frame.depth() + 1));
                }
            }
        }
        return null;
    }

    /**
     * Extracts a human-readable label from a name node.
     * Scalars are returned as text; maps are probed for {@link #NAME_KEYS} first, then any
     * nested map or scalar in document order.
     *
     * @return Label text, or null if none found
     */
    public static String extractLabel(Object node) {
        return extractLabel(node, 0);
    }

    private static String extractLabel(Object node, int depth) {
        if (node == null || depth > DEFAULT_MAX_DEPTH) {
            return null;
        }
        if (isScalar(node)) {
            return nonBlankText(node);
        }

        Map<String, Object> map = asMap(node);
        if (map == null) {
            return null;
        }

        for (String nameKey : NAME_KEYS) {
            if (map.containsKey(nameKey)) {
                Object candidate = map.get(nameKey);
                if (candidate instanceof Map<?, ?>) {
                    return extractLabel(candidate, depth + 1);
                }
                if (isScalar(candidate)) {
                    return nonBlankText(candidate);
                }
            }
        }

        for (Object child : map.values()) {
            if (child instanceof Map<?, ?>) {
                String label = extractLabel(child, depth + 1);
                if (label != null) {
                    return label;
                }
            } else if (isScalar(child)) {
                String label = nonBlankText(child);
                if (label != null) {
                    return label;
                }
            }
        }
        return null;
    }

    private record Frame(Object node, int depth) {}
}
