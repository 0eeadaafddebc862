package com.zelang.compiler.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps BuildCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedBuildOptions {
    Path sourcePath;
    Path outputPath;
    Path executablePath;
}
