package com.hatcherdx.terminal.host;

import java.util.HashMap;
import java.util.Map;

/**
 * Suppresses runaway duplicate output.
 *
 * <p>Output identical to the previous delivery of the same terminal and arriving within
 * {@value #WINDOW_MILLIS} ms of it counts as a duplicate. The first {@value #MAX_DUPLICATES}
 * duplicates pass; further ones are suppressed until different output arrives or the window
 * lapses. Suppressed output does not extend the window.
 *
 * @since 1.0
 */
public final class OutputThrottle {

  static final long WINDOW_MILLIS = 100L;
  static final int MAX_DUPLICATES = 3;

  private final Map<String, Tracker> trackers = new HashMap<>();

  /**
   * Records an output delivery.
   *
   * @param terminalId terminal id
   * @param data output text
   * @param nowMillis current time
   * @return true if the output should be dropped
   */
  public boolean shouldSuppress(final String terminalId, final String data, final long nowMillis) {
    final Tracker tracker = this.trackers.computeIfAbsent(terminalId, ignored -> new Tracker());
    final boolean duplicate = tracker.lastData != null && tracker.lastData.equals(data);
    final boolean withinWindow = tracker.lastAt >= 0 && nowMillis - tracker.lastAt < WINDOW_MILLIS;

    if (duplicate && withinWindow) {
      tracker.duplicates++;
      if (tracker.duplicates > MAX_DUPLICATES) {
        return true;
      }
    } else {
      tracker.duplicates = 0;
    }

    tracker.lastData = data;
    tracker.lastAt = nowMillis;
    return false;
  }

  public void forget(final String terminalId) {
    this.trackers.remove(terminalId);
  }

  public void clear() {
    this.trackers.clear();
  }

  private static final class Tracker {
    private String lastData;
    private long lastAt = -1L;
    private int duplicates;
  }
}
