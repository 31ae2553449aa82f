package com.hatcherdx.terminal.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration for launching a shell process.
 *
 * @param command executable followed by its arguments (e.g., ["/bin/bash"])
 * @param workingDirectory working directory for the process
 * @param environment complete environment for the process (may be null to inherit)
 * @param columns initial terminal columns
 * @param rows initial terminal rows
 * @since 1.0
 */
public record ShellProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int columns,
    int rows) {
}
