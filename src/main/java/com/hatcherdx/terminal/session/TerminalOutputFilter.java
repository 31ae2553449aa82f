package com.hatcherdx.terminal.session;

import org.apache.commons.lang3.StringUtils;

/**
 * Default output pre-filter.
 *
 * <p>
 * Rules, applied in order:
 * <ul>
 * <li>strip NUL characters</li>
 * <li>remove any run of 10 or more identical characters</li>
 * <li>strip ANSI/VT escape sequences (CSI, OSC and string controls, short escapes)</li>
 * <li>strip remaining control characters except newline</li>
 * <li>collapse 3 or more consecutive newlines to exactly 2</li>
 * </ul>
 * The rule pass repeats until the text stops changing (removing a run or a sequence can join
 * its neighbours into a new one), and output that is only whitespace becomes empty. Both make
 * the filter idempotent.
 * </p>
 *
 * <p>
 * The repeated-character rule is a heuristic against runaway output. It also removes legitimate
 * repetition, such as a rule of dashes or a wide gap of spaces.
 * </p>
 *
 * <p>No regex is used.
 */
public final class TerminalOutputFilter implements OutputFilter {

  static final int REPEAT_RUN_LIMIT = 10;
  static final int NEWLINE_RUN_LIMIT = 2;

  private static final char ESC = 0x1B;
  private static final char BEL = 0x07;

  @Override
  public String filter(final String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }

    String current = text;
    while (true) {
      final String next = collapseNewlines(stripControls(stripEscapes(removeRepeats(stripNul(current)))));
      // Every rule only shortens, so the loop ends.
      if (next.equals(current)) {
        break;
      }
      current = next;
    }

    return StringUtils.isBlank(current) ? "" : current;
  }

  private static String stripNul(final String s) {
    if (s.indexOf('\0') < 0) {
      return s;
    }
    final StringBuilder out = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c != '\0') {
        out.append(c);
      }
    }
    return out.toString();
  }

  private static String removeRepeats(final String s) {
    final int n = s.length();
    final StringBuilder out = new StringBuilder(n);
    int i = 0;
    while (i < n) {
      final char c = s.charAt(i);
      int j = i + 1;
      while (j < n && s.charAt(j) == c) {
        j++;
      }
      if (j - i < REPEAT_RUN_LIMIT) {
        out.append(s, i, j);
      }
      i = j;
    }
    return out.toString();
  }

  private static String stripEscapes(final String s) {
    if (s.indexOf(ESC) < 0) {
      return s;
    }
    final int n = s.length();
    final StringBuilder out = new StringBuilder(n);
    int i = 0;
    while (i < n) {
      final char c = s.charAt(i);
      if (c != ESC) {
        out.append(c);
        i++;
        continue;
      }
      if (i + 1 >= n) {
        // Dangling ESC at the end of the chunk.
        break;
      }
      final char kind = s.charAt(i + 1);
      switch (kind) {
        case '[':
          i = skipCsi(s, i + 2);
          break;
        case ']':
        case 'P':
        case 'X':
        case '^':
        case '_':
          i = skipStringControl(s, i + 2);
          break;
        case '(':
        case ')':
        case '*':
        case '+':
        case '-':
        case '.':
        case '/':
        case '#':
        case '%':
          i = Math.min(i + 3, n);
          break;
        default:
          i += 2;
          break;
      }
    }
    return out.toString();
  }

  /** Skips CSI parameter and intermediate bytes plus the final byte. */
  private static int skipCsi(final String s, final int start) {
    int j = start;
    while (j < s.length() && s.charAt(j) >= 0x20 && s.charAt(j) <= 0x3F) {
      j++;
    }
    if (j < s.length() && s.charAt(j) >= 0x40 && s.charAt(j) <= 0x7E) {
      return j + 1;
    }
    return j;
  }

  /** Skips an OSC/DCS/SOS/PM/APC body terminated by BEL or ST (ESC \). */
  private static int skipStringControl(final String s, final int start) {
    for (int j = start; j < s.length(); j++) {
      final char c = s.charAt(j);
      if (c == BEL) {
        return j + 1;
      }
      if (c == ESC && j + 1 < s.length() && s.charAt(j + 1) == '\\') {
        return j + 2;
      }
    }
    return s.length();
  }

  private static String stripControls(final String s) {
    final StringBuilder out = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '\n' || !Character.isISOControl(c)) {
        out.append(c);
      }
    }
    return out.toString();
  }

  private static String collapseNewlines(final String s) {
    final int n = s.length();
    final StringBuilder out = new StringBuilder(n);
    int run = 0;
    for (int i = 0; i < n; i++) {
      final char c = s.charAt(i);
      if (c == '\n') {
        run++;
        if (run <= NEWLINE_RUN_LIMIT) {
          out.append(c);
        }
      } else {
        run = 0;
        out.append(c);
      }
    }
    return out.toString();
  }
}
