package com.hatcherdx.terminal.session;

import com.hatcherdx.terminal.process.TerminalBackend;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for creating a {@link TerminalSession}. Unset values fall back to host defaults.
 */
public final class TerminalSessionOptions {

  public static final int DEFAULT_COLS = 80;
  public static final int DEFAULT_ROWS = 24;

  private final String name;
  private final String shell;
  private final Path cwd;
  private final Map<String, String> env;
  private final int cols;
  private final int rows;
  private final TerminalBackend backend;

  private TerminalSessionOptions(Builder b) {
    this.name = b.name;
    this.shell = b.shell;
    this.cwd = b.cwd;
    this.env = Map.copyOf(b.env);
    this.cols = b.cols;
    this.rows = b.rows;
    this.backend = b.backend;
  }

  public static TerminalSessionOptions defaults() {
    return builder().build();
  }

  public String getName() {
    return name;
  }

  public String getShell() {
    return shell;
  }

  public Path getCwd() {
    return cwd;
  }

  public Map<String, String> getEnv() {
    return env;
  }

  public int getCols() {
    return cols;
  }

  public int getRows() {
    return rows;
  }

  public TerminalBackend getBackend() {
    return backend;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String name;
    private String shell;
    private Path cwd;
    private final Map<String, String> env = new LinkedHashMap<>();
    private int cols = DEFAULT_COLS;
    private int rows = DEFAULT_ROWS;
    private TerminalBackend backend = TerminalBackend.SUBPROCESS;

    private Builder() {
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder shell(String shell) {
      this.shell = shell;
      return this;
    }

    public Builder cwd(Path cwd) {
      this.cwd = cwd;
      return this;
    }

    public Builder env(Map<String, String> env) {
      if (env != null) {
        this.env.putAll(env);
      }
      return this;
    }

    public Builder cols(int cols) {
      this.cols = cols;
      return this;
    }

    public Builder rows(int rows) {
      this.rows = rows;
      return this;
    }

    public Builder backend(TerminalBackend backend) {
      this.backend = backend;
      return this;
    }

    public TerminalSessionOptions build() {
      if (cols <= 0 || rows <= 0) {
        throw new IllegalArgumentException("cols/rows must be positive.");
      }
      if (backend == null) {
        backend = TerminalBackend.SUBPROCESS;
      }
      return new TerminalSessionOptions(this);
    }
  }
}
