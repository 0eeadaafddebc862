package com.zelang.compiler;

import com.zelang.compiler.cli.BuildCommand;

import picocli.CommandLine;

/**
 * Main entry point for the ZeLang compiler. Translates {@code .zl} sources into
 * C programs backed by SQLite, optionally compiling them to a native binary.
 */
public class ZeLangApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BuildCommand()).execute(args);
        System.exit(exitCode);
    }
}
