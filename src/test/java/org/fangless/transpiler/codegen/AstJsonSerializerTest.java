package org.fangless.transpiler.codegen;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.fangless.transpiler.diagnostics.DiagnosticsEngine;
import org.fangless.transpiler.frontend.lexer.Lexer;
import org.fangless.transpiler.frontend.parser.Parser;
import org.fangless.transpiler.frontend.parser.ast.Module;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link AstJsonSerializer}.
 */
public class AstJsonSerializerTest {

    /**
     * Verifies node names, positions, enum operators, literal values and null components in the dump.
     */
    @Test
    @Tag("unit")
    void testDumpOfAssignment() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Module module = new Parser(new Lexer("x = 1\nreturn\n", diagnostics).scanTokens(), diagnostics).parse();

        // Act
        String json = new AstJsonSerializer().toJson(module);

        // Assert
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();
        assertThat(root.get("node").getAsString()).isEqualTo("Module");
        assertThat(root.has("sourceInfo")).isFalse();

        JsonObject assign = root.getAsJsonArray("body").get(0).getAsJsonObject();
        assertThat(assign.get("node").getAsString()).isEqualTo("Assign");
        assertThat(assign.get("op").getAsString()).isEqualTo("ASSIGN");
        assertThat(assign.get("line").getAsInt()).isEqualTo(1);
        assertThat(assign.getAsJsonObject("target").get("name").getAsString()).isEqualTo("x");
        assertThat(assign.getAsJsonObject("value").get("value").getAsLong()).isEqualTo(1L);

        JsonObject ret = root.getAsJsonArray("body").get(1).getAsJsonObject();
        assertThat(ret.get("node").getAsString()).isEqualTo("Return");
        assertThat(ret.get("value").isJsonNull()).isTrue();
        assertThat(ret.get("line").getAsInt()).isEqualTo(2);
    }
}
