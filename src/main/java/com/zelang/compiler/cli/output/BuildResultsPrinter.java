package com.zelang.compiler.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.CompilationResult;
import com.zelang.compiler.cli.model.BuildOptions;
import com.zelang.compiler.cli.model.ValidatedBuildOptions;

/**
 * Responsible only for printing CLI output for the "build" command.
 * No validation, no execution.
 */
public class BuildResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(BuildResultsPrinter.class);

    public void printBanner(BuildOptions o, ValidatedBuildOptions v) {
        log.info("=================================================");
        log.info("ZeLang Compiler");
        log.info("=================================================");
        log.info("Source: {}", v.getSourcePath());
        log.info("Output: {}", v.getOutputPath());
        log.info("Database: {}", o.getDatabasePath());
        log.info("HTTP Port: {}", o.getPort());
        if (o.isNativeBuild()) {
            log.info("Native Build: {} -> {}", o.getCompiler(), v.getExecutablePath());
        }
        log.info("=================================================");
    }

    public void printDiagnostics(CompilationResult result) {
        if (!result.hasDiagnostics()) {
            return;
        }
        log.warn("Parser reported {} diagnostic(s):", result.getDiagnostics().size());
        result.getDiagnostics().forEach(d -> log.warn("  {}", d));
    }

    public void printFailure(String message) {
        log.error("=================================================");
        log.error("BUILD FAILED");
        log.error("=================================================");
        log.error("{}", message);
    }

    public void printSuccess(BuildOptions o, ValidatedBuildOptions v, CompilationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("BUILD SUCCESSFUL");
        log.info("=================================================");
        log.info("Generated: {}", v.getOutputPath());
        log.info("Mode: {}", result.isWebMode() ? "web server" : "console demo");
        log.info("Structs: {}", result.getStructCount());
        log.info("Pages: {}", result.getPageCount());
        log.info("Handlers: {}", result.getHandlerCount());
        log.info("");

        if (o.isNativeBuild()) {
            log.info("Run the program:");
            log.info("   {}", v.getExecutablePath());
        } else {
            log.info("Compile the program:");
            log.info("   {} -o {} {} {}", o.getCompiler(), v.getExecutablePath(), v.getOutputPath(),
                    result.isWebMode() ? "-lsqlite3 -lmicrohttpd" : "-lsqlite3");
        }
        if (result.isWebMode()) {
            log.info("Then open http://localhost:{}/", o.getPort());
        }
        log.info("=================================================");
    }
}
