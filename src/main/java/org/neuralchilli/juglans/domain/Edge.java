package org.neuralchilli.juglans.domain;

/**
 * Directed transition between two nodes.
 *
 * @param source     source node id
 * @param target     target node id
 * @param condition  boolean expression, null when unconditional
 * @param kind       followed on success ({@link EdgeKind#NORMAL}) or failure ({@link EdgeKind#ON_ERROR})
 * @param switchCase case literal when the source has a switch route, else null
 */
public record Edge(String source, String target, String condition, EdgeKind kind, String switchCase) {

    public Edge {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Edge source cannot be null or empty");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Edge target cannot be null or empty");
        }
        if (kind == null) {
            kind = EdgeKind.NORMAL;
        }
        if (condition != null && condition.isBlank()) {
            condition = null;
        }
        if (kind == EdgeKind.ON_ERROR && switchCase != null) {
            throw new IllegalArgumentException(
                    "Error edge " + source + " -> " + target + " cannot carry a switch case");
        }
    }

    public static Edge of(String source, String target) {
        return new Edge(source, target, null, EdgeKind.NORMAL, null);
    }

    public static Edge when(String source, String target, String condition) {
        return new Edge(source, target, condition, EdgeKind.NORMAL, null);
    }

    public static Edge onError(String source, String target) {
        return new Edge(source, target, null, EdgeKind.ON_ERROR, null);
    }

    public static Edge forCase(String source, String target, String switchCase) {
        return new Edge(source, target, null, EdgeKind.NORMAL, switchCase);
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean isErrorPath() {
        return kind == EdgeKind.ON_ERROR;
    }

    public boolean isSwitchCase() {
        return switchCase != null;
    }

    /**
     * A normal edge with neither a condition nor a switch case
     */
    public boolean isUnconditional() {
        return kind == EdgeKind.NORMAL && condition == null && switchCase == null;
    }

    public Edge withEndpoints(String newSource, String newTarget) {
        return new Edge(newSource, newTarget, condition, kind, switchCase);
    }

    public Edge withCondition(String newCondition) {
        return new Edge(source, target, newCondition, kind, switchCase);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(source).append(" -> ").append(target);
        if (kind == EdgeKind.ON_ERROR) {
            sb.append(" [on error]");
        }
        if (condition != null) {
            sb.append(" [if ").append(condition).append(']');
        }
        if (switchCase != null) {
            sb.append(" [case ").append(switchCase).append(']');
        }
        return sb.toString();
    }
}
