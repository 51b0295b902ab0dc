package com.boardhub.gameservice.games.board.interfaces.command;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandParserTest {

    private final CommandParser parser = new CommandParser("!");

    @Test
    void parsesVerbAndArguments() {
        GameCommand cmd = parser.parse("  !JOIN <@123> Dark Knight ").orElseThrow();

        assertThat(cmd.verb()).isEqualTo("join");
        assertThat(cmd.arg(0)).isEqualTo("123");
        assertThat(cmd.rest(1)).isEqualTo("Dark Knight");
        assertThat(cmd.arg(5)).isNull();
        assertThat(cmd.rest(3)).isNull();
    }

    @Test
    void nicknameMentionsAreUnwrapped() {
        assertThat(parser.parse("!swap <@!42> <@43>").orElseThrow().args()).containsExactly("42", "43");
    }

    @Test
    void plainChatIsNotACommand() {
        assertThat(parser.parse("hello there")).isEmpty();
        assertThat(parser.parse("!")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void requireExplainsUsage() {
        GameCommand cmd = parser.parse("!move 5").orElseThrow();

        assertThatThrownBy(() -> cmd.require(1, "!move <player> <coordinate>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Usage: !move <player> <coordinate>");
    }

    @Test
    void customPrefix() {
        CommandParser slash = new CommandParser(" /g ");

        assertThat(slash.parse("/groll 3").orElseThrow().verb()).isEqualTo("roll");
        assertThat(slash.parse("!roll")).isEmpty();
    }

    @Test
    void blankPrefixIsRefused() {
        assertThatThrownBy(() -> new CommandParser(" ")).isInstanceOf(IllegalStateException.class);
    }
}
