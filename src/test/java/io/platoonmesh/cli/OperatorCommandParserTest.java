package io.platoonmesh.cli;

import io.platoonmesh.session.OperatorCommand;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OperatorCommandParserTest {
    @Test
    void parseTokensShouldSplitByWhitespace() {
        assertEquals(List.of("set-gap", "12.5"), OperatorCommandParser.parseTokens("  set-gap \t 12.5  "));
        assertTrue(OperatorCommandParser.parseTokens("   ").isEmpty());
        assertTrue(OperatorCommandParser.parseTokens(null).isEmpty());
    }

    @Test
    void parseShouldBuildSessionCommands() {
        assertEquals(OperatorCommand.join(), OperatorCommandParser.parse(List.of("JOIN")));
        assertEquals(OperatorCommand.leave(), OperatorCommandParser.parse(List.of("leave")));
        assertEquals(OperatorCommand.setGap(12.5), OperatorCommandParser.parse(List.of("set-gap", "12.5")));
        assertEquals(OperatorCommand.setSpeed(0.0), OperatorCommandParser.parse(List.of("set_speed", "0")));
        assertEquals(OperatorCommand.runScript(7), OperatorCommandParser.parse(List.of("run_script", "7")));
        assertEquals(OperatorCommand.stopScript(), OperatorCommandParser.parse(List.of("Stop-Script")));
    }

    @Test
    void parseShouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("warp")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("set-gap")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("set-gap", "abc")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("set-gap", "0")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("set-speed", "-1")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("set-speed", "NaN")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("join", "now")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of()));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("run-script", "0")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("run-script", "10")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("run-script", "2.5")));
        assertThrows(IllegalArgumentException.class, () -> OperatorCommandParser.parse(List.of("run-script")));
    }

    @Test
    void isLocalCommandShouldRecognizeConsoleQueries() {
        assertTrue(OperatorCommandParser.isLocalCommand("status"));
        assertTrue(OperatorCommandParser.isLocalCommand("HELP"));
        assertFalse(OperatorCommandParser.isLocalCommand("join"));
        assertFalse(OperatorCommandParser.isLocalCommand(null));
    }
}
