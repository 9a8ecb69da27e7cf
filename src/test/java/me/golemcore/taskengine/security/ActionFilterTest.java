package me.golemcore.taskengine.security;

import me.golemcore.taskengine.domain.model.Command;
import me.golemcore.taskengine.domain.model.ToolFilterConfig;
import me.golemcore.taskengine.infrastructure.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionFilterTest {

    private ActionFilter filter;

    @BeforeEach
    void setUp() {
        EngineProperties.FilterProperties defaults = new EngineProperties.FilterProperties();
        ToolFilterConfig config = ToolFilterConfig.builder()
                .blocklist(defaults.getBlocklist())
                .blocklistStandalone(defaults.getBlocklistStandalone())
                .blockUnlessRegex(defaults.getBlockUnlessRegex())
                .blocklistErrorTemplate(defaults.getBlocklistErrorTemplate())
                .build();
        CommandRegistry registry = new CommandRegistry(List.of(), true, "submit", "");
        filter = new ActionFilter(config, registry);
    }

    // ==================== Prefix blocklist ====================

    @Test
    void shouldBlockInteractiveEditor() {
        assertTrue(filter.shouldBlockAction("vim file.txt"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "nano notes.md", "less /var/log/syslog", "tail -f app.log", "gdb ./a.out",
            "  emacs main.c", "python -m venv .venv" })
    void shouldBlockByPrefix(String action) {
        assertTrue(filter.shouldBlockAction(action));
    }

    // ==================== Standalone blocklist ====================

    @Test
    void shouldBlockBareShell() {
        assertTrue(filter.shouldBlockAction("bash"));
    }

    @Test
    void shouldAllowShellWithArguments() {
        assertFalse(filter.shouldBlockAction("bash -c ls"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "python", "python3", "ipython", "sh", "/bin/sh", "su", "  python3  " })
    void shouldBlockBareInterpreters(String action) {
        assertTrue(filter.shouldBlockAction(action));
    }

    @Test
    void shouldAllowInterpreterRunningScript() {
        assertFalse(filter.shouldBlockAction("python3 script.py"));
    }

    // ==================== Block unless regex ====================

    @Test
    void shouldBlockRadareWithoutCommandFlag() {
        assertTrue(filter.shouldBlockAction("radare2 ./binary"));
    }

    @Test
    void shouldAllowRadareWithCommandFlag() {
        assertFalse(filter.shouldBlockAction("radare2 ./binary -c 'pdf @ main'"));
    }

    @Test
    void shouldNotApplyRegexToOtherCommands() {
        assertFalse(filter.shouldBlockAction("objdump -d ./binary"));
    }

    // ==================== Defaults ====================

    @Test
    void shouldAllowOrdinaryCommand() {
        assertFalse(filter.shouldBlockAction("cat file.txt"));
    }

    @Test
    void shouldAllowBlankAndNullActions() {
        assertFalse(filter.shouldBlockAction(null));
        assertFalse(filter.shouldBlockAction("   "));
    }

    @Test
    void shouldAllowEverythingWithEmptyConfig() {
        ActionFilter permissive = new ActionFilter(ToolFilterConfig.builder().build(),
                new CommandRegistry(List.of(), false, "submit", ""));

        assertFalse(permissive.shouldBlockAction("vim file.txt"));
        assertFalse(permissive.shouldBlockAction("bash"));
    }

    @Test
    void shouldRenderBlockedMessageFromTemplate() {
        assertEquals("Operation 'vim file.txt' is not supported by this environment.",
                filter.blockedMessage("  vim file.txt\n"));
    }

    @Test
    void shouldUseCustomTemplateAndRules() {
        ToolFilterConfig config = ToolFilterConfig.builder()
                .blocklist(List.of("rm -rf"))
                .blockUnlessRegex(Map.of("curl", "--max-time\\s+\\d+"))
                .blocklistErrorTemplate("denied: {{action}}")
                .build();
        ActionFilter custom = new ActionFilter(config, new CommandRegistry(List.of(), true, "submit", ""));

        assertTrue(custom.shouldBlockAction("rm -rf /"));
        assertTrue(custom.shouldBlockAction("curl http://example.com"));
        assertFalse(custom.shouldBlockAction("curl --max-time 5 http://example.com"));
        assertEquals("denied: rm -rf /", custom.blockedMessage("rm -rf /"));
    }

    // ==================== Multi-line guard ====================

    @Test
    void shouldReturnMultilineActionUnchanged() {
        Command edit = Command.builder().name("edit").description("Edit a file").endName("end_of_edit").build();
        ActionFilter guarded = new ActionFilter(ToolFilterConfig.builder().build(),
                new CommandRegistry(List.of(edit), true, "submit", ""));
        String action = "edit 1:2\nnew line\nend_of_edit";

        assertEquals(action, guarded.guardMultilineInput(action));
        assertEquals("ls", guarded.guardMultilineInput("ls"));
    }
}
