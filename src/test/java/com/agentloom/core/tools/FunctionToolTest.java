package com.agentloom.core.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FunctionToolTest {

    @Test
    @DisplayName("declaration carries name, description and parameters")
    void declaration() {
        Map<String, Object> schema = Map.of("type", "object", "properties", Map.of("q", Map.of("type", "string")));
        var tool = FunctionTool.of("search", "Searches the catalogue", schema, (args, ctx) -> Map.of());

        FunctionDeclaration declaration = tool.declaration();

        assertEquals("search", declaration.name());
        assertEquals("Searches the catalogue", declaration.description());
        assertEquals(schema, declaration.parameters());
    }

    @Test
    @DisplayName("a null result becomes an empty response")
    void nullResult() throws Exception {
        var tool = FunctionTool.of("noop", "Does nothing", (args, ctx) -> null);

        assertEquals(Map.of(), tool.run(Map.of(), null));
    }

    @Test
    @DisplayName("passes arguments through to the function")
    void arguments() throws Exception {
        var tool = FunctionTool.of("echo", "Echoes", (args, ctx) -> Map.of("echo", args.get("text")));

        assertEquals(Map.of("echo", "hi"), tool.run(Map.of("text", "hi"), null));
    }

    @Test
    @DisplayName("exit_loop declares itself under its well-known name")
    void exitLoopName() {
        var tool = new ExitLoopTool();

        assertEquals(ExitLoopTool.NAME, tool.declaration().name());
    }
}
