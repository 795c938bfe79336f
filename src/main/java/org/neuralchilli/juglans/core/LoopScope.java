package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Binding of one loop iteration: the iteration variable and {@code loop.index/first/last}.
 *
 * @param length number of iterations, or -1 for a while loop
 */
public record LoopScope(String variable, JsonNode item, int index, int length) {

    public LoopScope {
        if (index < 0) {
            throw new IllegalArgumentException("Loop index cannot be negative: " + index);
        }
        item = item != null ? item : NullNode.getInstance();
    }

    public static LoopScope forEach(String variable, JsonNode item, int index, int length) {
        return new LoopScope(variable, item, index, length);
    }

    public static LoopScope whileLoop(int index) {
        return new LoopScope(null, NullNode.getInstance(), index, -1);
    }

    public boolean first() {
        return index == 0;
    }

    /**
     * Always false for while loops, whose length is unknown
     */
    public boolean last() {
        return length > 0 && index == length - 1;
    }

    public boolean binds(String name) {
        return variable != null && variable.equals(name);
    }

    /**
     * Value of {@code $loop}
     */
    public ObjectNode toLoopObject() {
        ObjectNode loop = Values.object();
        loop.put("index", index);
        loop.put("first", first());
        loop.put("last", last());
        if (length >= 0) {
            loop.put("length", length);
        }
        return loop;
    }
}
