package com.zelang.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.zelang.compiler.cli.exception.OptionsValidationException;
import com.zelang.compiler.cli.model.BuildOptions;
import com.zelang.compiler.cli.model.ValidatedBuildOptions;

public class BuildOptionsValidator {

    static final String SOURCE_EXTENSION = ".zl";
    static final String C_EXTENSION = ".c";
    static final String EXECUTABLE_SUFFIX = ".out";

    public ValidatedBuildOptions validate(BuildOptions o) {
        List<String> errors = new ArrayList<>();

        Path source = o.getSource() == null ? null : o.getSource().toAbsolutePath().normalize();
        if (source == null) {
            errors.add("Source file is required.");
        } else if (!Files.isRegularFile(source)) {
            errors.add("Source file does not exist or is not a regular file: " + source);
        } else if (!Files.isReadable(source)) {
            errors.add("Source file is not readable: " + source);
        }

        if (isBlank(o.getDatabasePath())) {
            errors.add("Database path must not be blank (--db).");
        }

        if (o.getPort() <= 0 || o.getPort() > 65535) {
            errors.add("HTTP port must be in range 1-65535. Got: " + o.getPort());
        }

        if (o.isNativeBuild() && isBlank(o.getCompiler())) {
            errors.add("C compiler must not be blank when --native is set (--cc).");
        }

        Path output = null;
        if (o.getOutput() != null) {
            output = o.getOutput().toAbsolutePath().normalize();
        } else if (source != null) {
            output = source.resolveSibling(baseName(source) + C_EXTENSION);
        }

        if (output != null) {
            if (Files.isDirectory(output)) {
                errors.add("Output path is a directory: " + output);
            } else if (Files.exists(output) && !o.isForce()) {
                errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
            }
            if (output.equals(source)) {
                errors.add("Output file must differ from the source file: " + output);
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        String outputName = output.getFileName().toString();
        String executableName = stripExtension(outputName, C_EXTENSION);
        if (executableName.equals(outputName)) {
            executableName = outputName + EXECUTABLE_SUFFIX;
        }
        Path executable = output.resolveSibling(executableName);
        return new ValidatedBuildOptions(source, output, executable);
    }

    private static String baseName(Path source) {
        return stripExtension(source.getFileName().toString(), SOURCE_EXTENSION);
    }

    private static String stripExtension(String fileName, String extension) {
        if (fileName.endsWith(extension) && fileName.length() > extension.length()) {
            return fileName.substring(0, fileName.length() - extension.length());
        }
        return fileName;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
