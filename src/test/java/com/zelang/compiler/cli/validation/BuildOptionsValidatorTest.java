package com.zelang.compiler.cli.validation;

import com.zelang.compiler.cli.exception.OptionsValidationException;
import com.zelang.compiler.cli.model.BuildOptions;
import com.zelang.compiler.cli.model.ValidatedBuildOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class BuildOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final BuildOptionsValidator validator = new BuildOptionsValidator();

    @Test
    void testDefaultOutputIsNextToSource() throws IOException {
        Path source = writeSource("app.zl");

        ValidatedBuildOptions validated = validator.validate(options(source.toString()));

        assertThat(validated.getSourcePath()).isEqualTo(source.toAbsolutePath().normalize());
        assertThat(validated.getOutputPath()).isEqualTo(tempDir.resolve("app.c").toAbsolutePath().normalize());
        assertThat(validated.getExecutablePath()).isEqualTo(tempDir.resolve("app").toAbsolutePath().normalize());
    }

    @Test
    void testExplicitOutputWithoutExtension() throws IOException {
        Path source = writeSource("app.zl");
        Path output = tempDir.resolve("generated");

        ValidatedBuildOptions validated = validator.validate(options(source.toString(), "-o", output.toString()));

        assertThat(validated.getExecutablePath().getFileName().toString()).isEqualTo("generated.out");
    }

    @Test
    void testCollectsAllErrors() {
        Path missing = tempDir.resolve("missing.zl");

        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(options(missing.toString(), "--port", "70000", "--db", " ")),
                OptionsValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrors()).hasSize(3);
        assertThat(e.getMessage())
                .contains("Source file does not exist")
                .contains("HTTP port must be in range 1-65535. Got: 70000")
                .contains("Database path must not be blank");
    }

    @Test
    void testExistingOutputRequiresForce() throws IOException {
        Path source = writeSource("app.zl");
        Files.writeString(tempDir.resolve("app.c"), "old");

        assertThatThrownBy(() -> validator.validate(options(source.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Use --force to overwrite");

        assertThatCode(() -> validator.validate(options(source.toString(), "--force")))
                .doesNotThrowAnyException();
    }

    @Test
    void testOutputMayNotOverwriteSource() throws IOException {
        Path source = writeSource("app.zl");

        assertThatThrownBy(() -> validator.validate(options(source.toString(), "-o", source.toString(), "-f")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("must differ from the source file");
    }

    @Test
    void testNativeBuildRequiresCompiler() throws IOException {
        Path source = writeSource("app.zl");

        assertThatThrownBy(() -> validator.validate(options(source.toString(), "--native", "--cc", "")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("C compiler must not be blank");
    }

    private Path writeSource(String name) throws IOException {
        Path source = tempDir.resolve(name);
        Files.writeString(source, "struct A { int id; }");
        return source;
    }

    private static BuildOptions options(String... args) {
        BuildOptions options = new BuildOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
