package com.hatcherdx.terminal.session;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TerminalOutputFilterTest {

  private final TerminalOutputFilter filter = new TerminalOutputFilter();

  @Test
  @DisplayName("Should strip NUL characters")
  void filter_Nul_Stripped() {
    assertThat(this.filter.filter("hello\0world")).isEqualTo("helloworld");
  }

  @Test
  @DisplayName("Should remove runs of ten or more identical characters and keep shorter runs")
  void filter_RepeatedRuns_RemovedFromTen() {
    assertThat(this.filter.filter("a----------b")).isEqualTo("ab");
    assertThat(this.filter.filter("a---------b")).isEqualTo("a---------b");
  }

  @Test
  @DisplayName("Should strip CSI and OSC sequences")
  void filter_EscapeSequences_Stripped() {
    assertThat(this.filter.filter("\u001b[1;31mred\u001b[0m text")).isEqualTo("red text");
    assertThat(this.filter.filter("\u001b]0;user@host: ~\u0007prompt$ ")).isEqualTo("prompt$ ");
    assertThat(this.filter.filter("\u001b]2;title\u001b\\after")).isEqualTo("after");
    assertThat(this.filter.filter("\u001b(Bplain\u001b=")).isEqualTo("plain");
  }

  @Test
  @DisplayName("Should strip control characters except newline")
  void filter_Controls_StrippedExceptNewline() {
    assertThat(this.filter.filter("a\rb\tc\u0007\nd")).isEqualTo("abc\nd");
  }

  @Test
  @DisplayName("Should collapse three or more newlines to two")
  void filter_NewlineRuns_CollapsedToTwo() {
    assertThat(this.filter.filter("a\n\n\n\nb")).isEqualTo("a\n\nb");
    assertThat(this.filter.filter("a\n\nb")).isEqualTo("a\n\nb");
  }

  @Test
  @DisplayName("Should filter whitespace-only output to empty")
  void filter_WhitespaceOnly_Empty() {
    assertThat(this.filter.filter("   \n\n   ")).isEmpty();
    assertThat(this.filter.filter(null)).isEmpty();
  }

  @Test
  @DisplayName("Should remove a run that only forms once an escape sequence is gone")
  void filter_RunJoinedByEscapeRemoval_Removed() {
    assertThat(this.filter.filter("xaaaaa\u001b[0maaaaay")).isEqualTo("xy");
  }

  @Test
  @DisplayName("Should be idempotent")
  void filter_AppliedTwice_SameResult() {
    final List<String> samples = List.of(
        "plain output\n",
        "\u001b[32m$ \u001b[0mls -la\r\n",
        "a\u0000\u0000b\n\n\n\nc",
        "==========\u001b[0m=====",
        "\u001b]0;t\u0007\u001b[2J\u001b[H",
        "tab\tseparated\r\nlines\n\n\n",
        "emoji 😀 survives");

    for (final String sample : samples) {
      final String once = this.filter.filter(sample);
      assertThat(this.filter.filter(once)).as("sample %s", sample).isEqualTo(once);
    }
  }
}
