package org.neuralchilli.juglans.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and rewrites {@code $path.to.value} references inside expressions.
 */
public final class VariableReferences {

    /**
     * {@code $root} followed by any number of {@code .segment}
     */
    public static final Pattern REFERENCE =
            Pattern.compile("\\$([a-zA-Z_][a-zA-Z0-9_]*)((?:\\.[a-zA-Z0-9_]+)*)");

    /**
     * Roots that are never namespace-prefixed and never looked up as node ids
     */
    public static final Set<String> RESERVED_ROOTS = Set.of("ctx", "input", "output", "reply", "loop", "error");

    private VariableReferences() {
    }

    public static boolean isReserved(String root) {
        return RESERVED_ROOTS.contains(root);
    }

    public static boolean containsReference(String text) {
        return text != null && REFERENCE.matcher(text).find();
    }

    /**
     * True when the whole (trimmed) text is exactly one reference
     */
    public static boolean isPureReference(String text) {
        return text != null && REFERENCE.matcher(text.trim()).matches();
    }

    /**
     * Paths (without the leading $) of every reference in order of appearance
     */
    public static List<String> references(String text) {
        List<String> paths = new ArrayList<>();
        if (text == null) {
            return paths;
        }
        Matcher matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            paths.add(matcher.group(1) + matcher.group(2));
        }
        return paths;
    }

    /**
     * Replace every reference with the text the function returns for its path
     */
    public static String replaceAll(String text, Function<String, String> replacement) {
        if (text == null) {
            return null;
        }
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String path = matcher.group(1) + matcher.group(2);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(path)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Prefix references whose first segment is one of {@code localRoots} with {@code alias}.
     * Reserved roots are left alone.
     */
    public static String prefix(String text, String alias, Set<String> localRoots) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String root = matcher.group(1);
            String rest = matcher.group(2);
            String rewritten;
            if (!isReserved(root) && localRoots.contains(root)) {
                rewritten = "$" + alias + "." + root + rest;
            } else {
                rewritten = matcher.group();
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(rewritten));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * First dotted segment of a node id: {@code payment.charge -> payment}
     */
    public static String rootOf(String id) {
        int dot = id.indexOf('.');
        return dot < 0 ? id : id.substring(0, dot);
    }
}
