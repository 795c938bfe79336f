package org.neuralchilli.juglans.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlScript;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.neuralchilli.juglans.util.StringFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates argument and condition expressions with JEXL.
 *
 * {@code $path} references are resolved through the {@link VariableResolver} and bound to
 * generated variables before the expression is handed to JEXL. A text that is a single
 * reference yields the referenced value unchanged. {@code ${...}} templates are interpolated.
 * A text that is neither a reference nor a valid expression is taken as a literal string.
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final String BOUND_PREFIX = "_v";
    private static final Set<String> FUNCTION_NAMESPACES = Set.of("fn", "string", "Math");

    private final JexlEngine jexl;
    private final VariableResolver resolver;
    private final CollectionFunctions collectionFunctions;
    private final StringFunctions stringFunctions;

    public ExpressionEvaluator() {
        this(new VariableResolver());
    }

    @Inject
    public ExpressionEvaluator(VariableResolver resolver) {
        this.resolver = resolver;
        this.collectionFunctions = new CollectionFunctions();
        this.stringFunctions = new StringFunctions();

        this.jexl = new JexlBuilder()
                .cache(512)  // Cache up to 512 expressions
                .strict(false)  // Unknown variables and null navigation yield null
                .silent(false)  // Errors surface as exceptions
                .permissions(JexlPermissions.UNRESTRICTED)  // Allow method calls on values
                .create();
    }

    /**
     * Evaluate an expression to a value.
     */
    public JsonNode evaluate(String expression, ExecutionContext context) {
        if (expression == null) {
            return NullNode.getInstance();
        }

        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            return TextNode.valueOf(expression);
        }

        try {
            if (isTemplate(trimmed)) {
                if (isSingleTemplate(trimmed)) {
                    return evaluateCode(extractTemplate(trimmed), context, trimmed);
                }
                return TextNode.valueOf(interpolate(trimmed, context));
            }

            if (VariableReferences.isPureReference(trimmed)) {
                return resolver.resolve(trimmed.substring(1), context);
            }

            return evaluateCode(trimmed, context, expression);
        } catch (ExpressionException e) {
            throw e;
        } catch (JexlException e) {
            String msg = String.format(
                    "Failed to evaluate expression: %s - %s",
                    expression,
                    e.getMessage()
            );
            log.debug(msg, e);
            throw new ExpressionException(msg, e);
        }
    }

    /**
     * Evaluate an edge condition; see {@link Values#isTruthy} for the coercion
     */
    public boolean evaluateCondition(String condition, ExecutionContext context) {
        return Values.isTruthy(evaluate(condition, context));
    }

    /**
     * Evaluate and render the result as text
     */
    public String render(String expression, ExecutionContext context) {
        return Values.asText(evaluate(expression, context));
    }

    /**
     * Check if a string contains a ${...} template
     */
    public boolean isTemplate(String value) {
        return value != null && value.contains("${") && value.contains("}");
    }

    /**
     * Test if an expression is valid (can be compiled)
     */
    public boolean isValid(String expression) {
        return getValidationError(expression) == null;
    }

    /**
     * Get a detailed error message for an expression that cannot be compiled, or null.
     * Texts that would be taken as literal strings are considered valid.
     */
    public String getValidationError(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        String code = expression.trim();
        if (isSingleTemplate(code)) {
            code = extractTemplate(code);
        } else if (isTemplate(code)) {
            return findClosingBrace(code, code.indexOf("${") + 2) < 0 ? "Unclosed expression in: " + code : null;
        }
        if (!VariableReferences.containsReference(code)) {
            return null;
        }

        int[] counter = {0};
        String bound = VariableReferences.replaceAll(code, path -> BOUND_PREFIX + counter[0]++);
        try {
            jexl.createScript(wrap(bound));
            return null;
        } catch (JexlException e) {
            return e.getMessage();
        }
    }

    private JsonNode evaluateCode(String code, ExecutionContext context, String original) {
        boolean hasReferences = VariableReferences.containsReference(code);

        if (!hasReferences) {
            JsonNode json = tryParseJson(code);
            if (json != null) {
                return json;
            }
        }

        MapContext jexlContext = createJexlContext();
        List<String> paths = VariableReferences.references(code);
        int[] counter = {0};
        String bound = VariableReferences.replaceAll(code, path -> {
            String name = BOUND_PREFIX + counter[0]++;
            jexlContext.set(name, Values.toJava(resolver.resolve(path, context)));
            return name;
        });

        JexlScript script;
        try {
            script = jexl.createScript(wrap(bound));
        } catch (JexlException e) {
            // Not an expression: prose, possibly with embedded references
            log.trace("Taking '{}' as literal text: {}", original, e.getMessage());
            if (hasReferences) {
                return TextNode.valueOf(VariableReferences.replaceAll(code,
                        path -> Values.asText(resolver.resolve(path, context))));
            }
            return TextNode.valueOf(original);
        }

        Set<String> unknown = bindNamedRoots(script, jexlContext, context);
        if (!hasReferences && !unknown.isEmpty()) {
            log.trace("Taking '{}' as literal text, unknown names {}", original, unknown);
            return TextNode.valueOf(original);
        }

        log.trace("Evaluating {} with {} bound references", bound, paths.size());
        Object result = script.execute(jexlContext);
        return Values.fromJava(result);
    }

    /**
     * Bind roots and loop variables used without a leading $ ({@code input.name}, {@code item}).
     * Returns the names that could not be bound.
     */
    private Set<String> bindNamedRoots(JexlScript script, MapContext jexlContext, ExecutionContext context) {
        Set<String> unknown = new HashSet<>();
        for (List<String> variable : script.getVariables()) {
            String name = variable.get(0);
            if (name.startsWith(BOUND_PREFIX) || FUNCTION_NAMESPACES.contains(name) || jexlContext.has(name)) {
                continue;
            }
            if (isNamedRoot(name, context)) {
                jexlContext.set(name, Values.toJava(resolver.resolve(name, context)));
            } else {
                unknown.add(name);
            }
        }
        return unknown;
    }

    private boolean isNamedRoot(String name, ExecutionContext context) {
        if (VariableReferences.isReserved(name) && !"error".equals(name)) {
            return true;
        }
        return context.loopScopes().stream().anyMatch(scope -> scope.binds(name));
    }

    private String interpolate(String template, ExecutionContext context) {
        StringBuilder result = new StringBuilder();
        int pos = 0;

        while (pos < template.length()) {
            int start = template.indexOf("${", pos);
            if (start == -1) {
                result.append(template.substring(pos));
                break;
            }

            result.append(template, pos, start);

            int end = findClosingBrace(template, start + 2);
            if (end == -1) {
                throw new ExpressionException("Unclosed expression in: " + template);
            }

            String code = template.substring(start + 2, end);
            result.append(Values.asText(evaluateCode(code, context, code)));

            pos = end + 1;
        }

        return result.toString();
    }

    private boolean isSingleTemplate(String expression) {
        if (!expression.startsWith("${") || !expression.endsWith("}")) {
            return false;
        }
        return findClosingBrace(expression, 2) == expression.length() - 1;
    }

    private String extractTemplate(String expression) {
        return expression.substring(2, expression.length() - 1);
    }

    private int findClosingBrace(String str, int start) {
        int depth = 1;
        for (int i = start; i < str.length(); i++) {
            if (str.charAt(i) == '{') {
                depth++;
            } else if (str.charAt(i) == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * A leading brace would otherwise parse as a block instead of a map literal
     */
    private String wrap(String code) {
        String trimmed = code.trim();
        return trimmed.startsWith("{") ? "(" + trimmed + ")" : code;
    }

    private JsonNode tryParseJson(String code) {
        String trimmed = code.trim();
        if (trimmed.isEmpty() || (trimmed.charAt(0) != '{' && trimmed.charAt(0) != '[')) {
            return null;
        }
        try {
            return Values.mapper().readTree(trimmed);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private MapContext createJexlContext() {
        MapContext jexlContext = new MapContext();
        jexlContext.set("fn", collectionFunctions);
        jexlContext.set("string", stringFunctions);
        jexlContext.set("Math", Math.class);
        return jexlContext;
    }
}
