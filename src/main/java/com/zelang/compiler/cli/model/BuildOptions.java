package com.zelang.compiler.cli.model;

import java.nio.file.Path;

import com.zelang.compiler.codegen.context.GeneratorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "build" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class BuildOptions {

    @Parameters(index = "0", paramLabel = "<source>", description = "ZeLang source file (.zl)")
    private Path source;

    @Option(names = { "--output", "-o" }, description = "Generated C file (defaults to the source name with .c)")
    private Path output;

    @Option(names = { "--db" }, defaultValue = GeneratorConfig.DEFAULT_DATABASE_PATH,
            description = "SQLite database file opened by the generated program (default: ${DEFAULT-VALUE})")
    private String databasePath;

    @Option(names = { "--port" }, defaultValue = "" + GeneratorConfig.DEFAULT_HTTP_PORT,
            description = "HTTP port of generated web programs (default: ${DEFAULT-VALUE})")
    private int port;

    @Option(names = { "--strict" }, description = "Fail the build when the parser reports diagnostics")
    private boolean strict;

    @Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
    private boolean force;

    @Option(names = { "--native" }, description = "Compile the generated C with the system C compiler")
    private boolean nativeBuild;

    @Option(names = { "--cc" }, defaultValue = "gcc", description = "C compiler used with --native (default: ${DEFAULT-VALUE})")
    private String compiler;
}
