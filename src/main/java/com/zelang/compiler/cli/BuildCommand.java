package com.zelang.compiler.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.CompilationResult;
import com.zelang.compiler.ZeLangCompiler;
import com.zelang.compiler.cli.exception.OptionsValidationException;
import com.zelang.compiler.cli.model.BuildOptions;
import com.zelang.compiler.cli.model.ValidatedBuildOptions;
import com.zelang.compiler.cli.output.BuildResultsPrinter;
import com.zelang.compiler.cli.validation.BuildOptionsValidator;
import com.zelang.compiler.codegen.context.GeneratorConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command compiling one ZeLang source into a C program.
 */
@Command(
        name = "build",
        mixinStandardHelpOptions = true,
        version = "zelang 1.0.0",
        description = "Compiles a ZeLang source file into a C program backed by SQLite (and libmicrohttpd for web programs)."
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Mixin
    private BuildOptions options = new BuildOptions();

    private final BuildOptionsValidator validator = new BuildOptionsValidator();
    private final BuildResultsPrinter printer = new BuildResultsPrinter();

    @Override
    public Integer call() {
        ValidatedBuildOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        try {
            printer.printBanner(options, validated);

            String source = Files.readString(validated.getSourcePath(), StandardCharsets.UTF_8);

            GeneratorConfig config = GeneratorConfig.builder()
                    .databasePath(options.getDatabasePath())
                    .httpPort(options.getPort())
                    .build();

            CompilationResult result = new ZeLangCompiler(config)
                    .compile(source, validated.getSourcePath().getFileName().toString());

            printer.printDiagnostics(result);

            if (!result.isSuccess()) {
                printer.printFailure(result.getErrorMessage());
                return 1;
            }
            if (options.isStrict() && result.hasDiagnostics()) {
                printer.printFailure("Parse diagnostics reported and --strict is set");
                return 1;
            }

            Path output = validated.getOutputPath();
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, result.getGeneratedSource(), StandardCharsets.UTF_8);
            log.info("Wrote {}", output);

            if (options.isNativeBuild()) {
                NativeCompiler nativeCompiler = new NativeCompiler(options.getCompiler());
                if (!nativeCompiler.compile(output, validated.getExecutablePath(), result.isWebMode())) {
                    printer.printFailure("Native compilation failed");
                    return 1;
                }
            }

            printer.printSuccess(options, validated, result);
            return 0;

        } catch (Exception e) {
            log.error("Build failed with exception", e);
            return 1;
        }
    }
}
