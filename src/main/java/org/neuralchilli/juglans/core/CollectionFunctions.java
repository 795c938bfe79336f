package org.neuralchilli.juglans.core;

import org.apache.commons.jexl3.JexlScript;
import org.apache.commons.jexl3.MapContext;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collection helpers exposed to expressions as {@code fn.*}.
 * Mapping and filtering accept either a field name or a JEXL lambda such as {@code x -> x.price > 10}.
 */
public class CollectionFunctions {

    /**
     * Length of a list, map, string or array; 0 for null
     */
    public int len(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        if (value instanceof CharSequence text) {
            return text.length();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value);
        }
        return 1;
    }

    /**
     * New list with {@code item} appended; a null list starts empty
     */
    public List<Object> append(Object list, Object item) {
        List<Object> result = toList(list);
        result.add(item);
        return result;
    }

    public boolean contains(Object container, Object item) {
        if (container == null) {
            return false;
        }
        if (container instanceof Map<?, ?> map) {
            return item != null && map.containsKey(item.toString());
        }
        if (container instanceof CharSequence text) {
            return item != null && text.toString().contains(item.toString());
        }
        for (Object element : toList(container)) {
            if (looselyEquals(element, item)) {
                return true;
            }
        }
        return false;
    }

    public List<Object> keys(Object map) {
        if (map instanceof Map<?, ?> m) {
            return new ArrayList<>(m.keySet());
        }
        return new ArrayList<>();
    }

    public String join(Object list, String separator) {
        List<String> parts = new ArrayList<>();
        for (Object element : toList(list)) {
            parts.add(element == null ? "" : element.toString());
        }
        return String.join(separator != null ? separator : "", parts);
    }

    /**
     * Map each element with a lambda, or pluck a field when given a field name
     */
    public List<Object> map(Object list, Object mapper) {
        List<Object> result = new ArrayList<>();
        for (Object element : toList(list)) {
            if (mapper instanceof JexlScript script) {
                result.add(script.execute(new MapContext(), element));
            } else if (mapper != null && element instanceof Map<?, ?> map) {
                result.add(map.get(mapper.toString()));
            } else {
                result.add(null);
            }
        }
        return result;
    }

    /**
     * Keep elements for which the lambda returns true
     */
    public List<Object> filter(Object list, Object predicate) {
        List<Object> result = new ArrayList<>();
        for (Object element : toList(list)) {
            boolean keep;
            if (predicate instanceof JexlScript script) {
                keep = Boolean.TRUE.equals(script.execute(new MapContext(), element));
            } else if (predicate != null && element instanceof Map<?, ?> map) {
                Object field = map.get(predicate.toString());
                keep = field != null && !Boolean.FALSE.equals(field);
            } else {
                keep = element != null;
            }
            if (keep) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Keep map elements whose {@code field} equals {@code value}
     */
    public List<Object> filter(Object list, String field, Object value) {
        List<Object> result = new ArrayList<>();
        for (Object element : toList(list)) {
            if (element instanceof Map<?, ?> map && looselyEquals(map.get(field), value)) {
                result.add(element);
            }
        }
        return result;
    }

    public Object first(Object list) {
        List<Object> elements = toList(list);
        return elements.isEmpty() ? null : elements.get(0);
    }

    public Object last(Object list) {
        List<Object> elements = toList(list);
        return elements.isEmpty() ? null : elements.get(elements.size() - 1);
    }

    /**
     * Serialize to compact JSON text
     */
    public String json(Object value) {
        return Values.toJson(Values.fromJava(value));
    }

    /**
     * Parse JSON text; non-JSON text is returned unchanged
     */
    public Object parse(String text) {
        return Values.toJava(Values.parseLenient(text));
    }

    private static List<Object> toList(Object value) {
        List<Object> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection<?> collection) {
            result.addAll(collection);
        } else if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                result.add(Array.get(value, i));
            }
        } else {
            result.add(value);
        }
        return result;
    }

    private static boolean looselyEquals(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }
}
