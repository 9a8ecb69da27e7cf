package me.golemcore.taskengine.domain.parser;

import me.golemcore.taskengine.domain.exception.ActionParseException;
import me.golemcore.taskengine.domain.model.ModelOutput;
import me.golemcore.taskengine.domain.model.ParsedAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ThoughtActionParserTest {

    private static final List<String> COMMANDS = List.of("bash", "open", "submit");

    private final ThoughtActionParser parser = new ThoughtActionParser();

    @Test
    void shouldSplitThoughtAndFencedAction() {
        ParsedAction parsed = parser.parse(ModelOutput.ofMessage("Let me look around.\n```\nls -la\n```"), COMMANDS);

        assertEquals("Let me look around.", parsed.thought());
        assertEquals("ls -la", parsed.action());
    }

    @Test
    void shouldUseLastFencedBlock() {
        String message = "Earlier I ran:\n```bash\ncat a.txt\n```\nNow I will run:\n```bash\ncat b.txt\n```";

        ParsedAction parsed = parser.parse(ModelOutput.ofMessage(message), COMMANDS);

        assertEquals("cat b.txt", parsed.action());
        assertEquals("Earlier I ran:\n```bash\ncat a.txt\n```\nNow I will run:", parsed.thought());
    }

    @Test
    void shouldKeepMultilineActionBody() {
        String message = "Edit it.\n```\nedit 1:1\nx = 1\nend_of_edit\n```";

        ParsedAction parsed = parser.parse(ModelOutput.ofMessage(message), COMMANDS);

        assertEquals("edit 1:1\nx = 1\nend_of_edit", parsed.action());
    }

    @Test
    void shouldPreferStructuredFields() {
        ModelOutput output = ModelOutput.builder()
                .message("ignored\n```\nrm x\n```")
                .thought("structured thought")
                .action("ls")
                .build();

        ParsedAction parsed = parser.parse(output, COMMANDS);

        assertEquals("structured thought", parsed.thought());
        assertEquals("ls", parsed.action());
    }

    @Test
    void shouldAcceptBareKnownCommand() {
        ParsedAction parsed = parser.parse(ModelOutput.ofMessage("  submit result-42 "), COMMANDS);

        assertEquals("", parsed.thought());
        assertEquals("submit result-42", parsed.action());
    }

    @Test
    void shouldRejectProseWithoutAction() {
        assertThrows(ActionParseException.class,
                () -> parser.parse(ModelOutput.ofMessage("I am not sure what to do."), COMMANDS));
    }

    @Test
    void shouldRejectEmptyOutput() {
        assertThrows(ActionParseException.class, () -> parser.parse(ModelOutput.ofMessage("  "), COMMANDS));
        assertThrows(ActionParseException.class, () -> parser.parse(null, COMMANDS));
    }

    @Test
    void shouldRejectEmptyFencedBlock() {
        assertThrows(ActionParseException.class,
                () -> parser.parse(ModelOutput.ofMessage("Thinking\n```\n\n```"), COMMANDS));
    }
}
