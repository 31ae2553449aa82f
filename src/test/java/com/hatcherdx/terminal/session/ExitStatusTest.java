package com.hatcherdx.terminal.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ExitStatusTest {

  @Test
  @DisplayName("Should normalize a missing code to zero with no signal")
  void of_NullCode_ZeroAndNone() {
    assertThat(ExitStatus.of(null, Platform.UNIX)).isEqualTo(new ExitStatus(0, "none"));
  }

  @Test
  @DisplayName("Should map 128+N codes to signal names on Unix-like hosts only")
  void of_SignalCodes_MappedOnUnix() {
    assertThat(ExitStatus.of(143, Platform.UNIX).signal()).isEqualTo("SIGTERM");
    assertThat(ExitStatus.of(137, Platform.MAC).signal()).isEqualTo("SIGKILL");
    assertThat(ExitStatus.of(130, Platform.UNIX).signalled()).isTrue();
    assertThat(ExitStatus.of(143, Platform.WINDOWS).signal()).isEqualTo("none");
    assertThat(ExitStatus.of(1, Platform.UNIX).signalled()).isFalse();
  }

  @Test
  @DisplayName("Should detect platforms from os.name")
  void platformDetect_KnownNames() {
    assertThat(Platform.detect("Windows 11")).isEqualTo(Platform.WINDOWS);
    assertThat(Platform.detect("Mac OS X")).isEqualTo(Platform.MAC);
    assertThat(Platform.detect("Linux")).isEqualTo(Platform.UNIX);
    assertThat(Platform.detect(null)).isEqualTo(Platform.UNIX);
  }
}
