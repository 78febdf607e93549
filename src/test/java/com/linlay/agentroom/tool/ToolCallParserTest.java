package com.linlay.agentroom.tool;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCallParserTest {

    @Test
    void shouldParseNameAndKeepBodyVerbatim() {
        List<ToolCall> calls = ToolCallParser.parse("Let me look.\n<tool_call name=\"shell\"> ls -la </tool_call>");

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).name()).isEqualTo("shell");
        assertThat(calls.get(0).body()).isEqualTo(" ls -la ");
        assertThat(calls.get(0).args()).isEmpty();
    }

    @Test
    void shouldKeepOtherAttributesAndMultilineBody() {
        String reply = """
                Writing the file now.
                <tool_call name="write_file" path="src/App.java">
                class App {
                }
                </tool_call>
                """;

        ToolCall call = ToolCallParser.parse(reply).get(0);

        assertThat(call.name()).isEqualTo("write_file");
        assertThat(call.args()).containsExactly(Map.entry("path", "src/App.java"));
        assertThat(call.body()).isEqualTo("\nclass App {\n}\n");
    }

    @Test
    void indentationAndTrailingNewlineShouldSurvive() {
        ToolCall call = ToolCallParser.parse(
                "<tool_call name=\"write_file\" path=\"a.yml\">  indented: yes\nnext: line\n</tool_call>").get(0);

        assertThat(call.body()).isEqualTo("  indented: yes\nnext: line\n");
    }

    @Test
    void closingBracketInsideAttributeValueShouldNotEndTheTag() {
        ToolCall call = ToolCallParser.parse("<tool_call name=\"shell\" command=\"ls > out.txt\"></tool_call>").get(0);

        assertThat(call.name()).isEqualTo("shell");
        assertThat(call.args()).containsExactly(Map.entry("command", "ls > out.txt"));
        assertThat(call.body()).isEmpty();
    }

    @Test
    void selfClosingTagShouldBeDroppedWithoutSwallowingTheNextCall() {
        String reply = "<tool_call name=\"write_file\" path=\"y\" />\n"
                + "<tool_call name=\"read_file\">a.txt</tool_call>";

        List<ToolCall> calls = ToolCallParser.parse(reply);

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).name()).isEqualTo("read_file");
        assertThat(calls.get(0).body()).isEqualTo("a.txt");
    }

    @Test
    void multipleCallsShouldComeBackInOrder() {
        String reply = "<tool_call name=\"read_file\">a.txt</tool_call> then "
                + "<tool_call name=\"search\" >needle</tool_call>";

        assertThat(ToolCallParser.parse(reply)).extracting(ToolCall::name).containsExactly("read_file", "search");
    }

    @Test
    void tagsWithoutNameOrUnclosedShouldBeIgnored() {
        assertThat(ToolCallParser.parse("<tool_call>ls</tool_call>")).isEmpty();
        assertThat(ToolCallParser.parse("<tool_call path=\"x\">ls</tool_call>")).isEmpty();
        assertThat(ToolCallParser.parse("<tool_call name=\"shell\">ls")).isEmpty();
        assertThat(ToolCallParser.parse("plain reply")).isEmpty();
        assertThat(ToolCallParser.parse(null)).isEmpty();
    }

    @Test
    void emptyBodyShouldBeAllowed() {
        ToolCall call = ToolCallParser.parse("<tool_call name=\"list_files\"></tool_call>").get(0);

        assertThat(call.body()).isEmpty();
    }
}
