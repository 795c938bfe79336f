package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.juglans.config.WorkflowYamlParser;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.MissingArgumentException;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.domain.PromptTemplate;
import org.neuralchilli.juglans.service.ParseException;
import org.neuralchilli.juglans.service.PromptRegistry;
import org.neuralchilli.juglans.tools.BuiltinTool;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResolutionException;
import org.neuralchilli.juglans.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code p} tool: render a prompt template.
 *
 * Placeholders {@code {{name}}} take the call argument of that name, then the {@code ctx}
 * value, then the template's declared default. Unresolved placeholders are left as written.
 */
@ApplicationScoped
public class PromptTool implements BuiltinTool {

    private static final Logger log = LoggerFactory.getLogger(PromptTool.class);

    public static final String NAME = "p";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_.]+)\\s*}}");

    private final PromptRegistry prompts;
    private final WorkflowYamlParser parser;

    protected PromptTool() {
        this.prompts = null;
        this.parser = null;
    }

    @Inject
    public PromptTool(PromptRegistry prompts, WorkflowYamlParser parser) {
        this.prompts = prompts;
        this.parser = parser;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        PromptTemplate template = template(invocation);
        String rendered = render(template, invocation);
        log.debug("Rendered prompt '{}' ({} characters)", template.slug(), rendered.length());
        return CompletableFuture.completedFuture(ToolResult.of(TextNode.valueOf(rendered)));
    }

    private PromptTemplate template(ToolInvocation invocation) {
        if (invocation.has("slug")) {
            return prompts.get(invocation.requireText("slug"));
        }
        if (!invocation.has("file")) {
            throw new MissingArgumentException(NAME, "slug");
        }

        String file = invocation.requireText("file");
        return prompts.find(file).orElseGet(() -> load(Path.of(file)));
    }

    private PromptTemplate load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ToolResolutionException("Prompt file not found: " + file);
        }
        try {
            return parser.parsePrompt(Files.readString(file), file);
        } catch (IOException e) {
            throw new ParseException("Cannot read prompt file " + file + ": " + e.getMessage(), e);
        }
    }

    String render(PromptTemplate template, ToolInvocation invocation) {
        ExecutionContext context = invocation.context();
        Matcher matcher = PLACEHOLDER.matcher(template.body());
        StringBuilder out = new StringBuilder();

        while (matcher.find()) {
            String name = matcher.group(1);
            JsonNode value = invocation.arguments().get(name);
            if (Values.isNull(value)) {
                value = context.ctxValue(name);
            }
            if (Values.isNull(value)) {
                value = template.defaults().get(name);
            }
            String replacement = Values.isNull(value) ? matcher.group() : Values.asText(value);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
