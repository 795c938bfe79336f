package org.neuralchilli.juglans.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.juglans.config.EngineSettings;
import org.neuralchilli.juglans.core.ExecutionContext;
import org.neuralchilli.juglans.core.RunCancelledException;
import org.neuralchilli.juglans.core.Values;
import org.neuralchilli.juglans.tools.ToolInvocation;
import org.neuralchilli.juglans.tools.ToolResult;
import org.neuralchilli.juglans.worker.WorkerPool;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

class TimerToolTest {

    private WorkerPool workers;
    private TimerTool tool;

    @BeforeEach
    void setup() {
        workers = new WorkerPool(new EngineSettings(1, 20, 5, null, Duration.ofSeconds(5), 3));
        tool = new TimerTool(workers);
    }

    @AfterEach
    void teardown() {
        workers.close();
    }

    private static ToolInvocation invocation(Map<String, JsonNode> arguments, ExecutionContext context) {
        return new ToolInvocation(TimerTool.NAME, arguments, context, "wait", null);
    }

    @Test
    void shouldReadDuration() {
        ExecutionContext context = ExecutionContext.of(Values.object());

        assertThat(TimerTool.durationMillis(invocation(Map.of("ms", Values.fromJava(250)), context))).isEqualTo(250);
        assertThat(TimerTool.durationMillis(invocation(Map.of("seconds", TextNode.valueOf("1.5")), context))).isEqualTo(1500);
        assertThat(TimerTool.durationMillis(invocation(Map.of("ms", TextNode.valueOf("soon")), context)))
                .isEqualTo(TimerTool.DEFAULT_MILLIS);
        assertThat(TimerTool.durationMillis(invocation(Map.of(), context))).isEqualTo(TimerTool.DEFAULT_MILLIS);
    }

    @Test
    void shouldFinishAfterDelay() {
        ToolResult result = tool.execute(invocation(Map.of("ms", Values.fromJava(20)),
                ExecutionContext.of(Values.object()))).join();

        assertThat(result.value().get("status").asText()).isEqualTo("finished");
        assertThat(result.value().get("duration_ms").asLong()).isEqualTo(20);
    }

    @Test
    void shouldStopWhenRunIsCancelled() {
        ExecutionContext context = ExecutionContext.of(Values.object());
        CompletableFuture<ToolResult> waiting = tool.execute(invocation(Map.of("seconds", Values.fromJava(30)), context));

        context.cancel("stop");

        assertThatThrownBy(waiting::join).hasCauseInstanceOf(RunCancelledException.class);
    }
}
