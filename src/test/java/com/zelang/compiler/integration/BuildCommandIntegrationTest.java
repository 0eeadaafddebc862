package com.zelang.compiler.integration;

import com.zelang.compiler.cli.BuildCommand;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete build command.
 */
class BuildCommandIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    void testBuildWritesCFileNextToSource() throws IOException {
        Path source = tempDir.resolve("todo.zl");
        Files.writeString(source, """
                struct Todo {
                    @primary @autoincrement int id;
                    @required string title;
                    bool completed;
                }

                @route("/")
                Page TodoApp {
                    DataList { }
                    Form { }
                }
                """);

        int exitCode = execute(source.toString(), "--port", "9000", "--db", "todos.db");

        assertThat(exitCode).isEqualTo(0);
        Path output = tempDir.resolve("todo.c");
        assertThat(output).exists();

        String c = Files.readString(output);
        assertThat(c).contains("#include <microhttpd.h>");
        assertThat(c).contains("sqlite3_open(\"todos.db\", &db)");
        assertThat(c).contains("MHD_USE_SELECT_INTERNALLY, 9000,");
        assertThat(c).contains("char* render_todoapp_page() {");
        assertThat(c).contains("if (strcmp(url, \"/todos/create\") == 0 && strcmp(method, \"POST\") == 0) {");
        assertThat(c).contains("Todo_create(title, completed);");
        assertThat(c).contains("if (strncmp(url, \"/todos/delete\", 13) == 0 && strcmp(method, \"GET\") == 0) {");
        assertThat(c).contains("if (strcmp(url, \"/\") == 0 && strcmp(method, \"GET\") == 0) {");
        assertThat(c).containsOnlyOnce("Todo_init_table();");
    }

    @Test
    void testBuildToExplicitOutputInNewDirectory() throws IOException {
        Path source = tempDir.resolve("simple.zl");
        Files.writeString(source, "struct Student { int id; string name; }");
        Path output = tempDir.resolve("build").resolve("student.c");

        int exitCode = execute(source.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(Files.readString(output))
                .contains("int main(int argc, char *argv[]) {")
                .contains("===== CRUD Operations Demo =====");
    }

    @Test
    void testStrictModeFailsOnDiagnostics() throws IOException {
        Path source = tempDir.resolve("broken.zl");
        Files.writeString(source, """
                struct User {
                    string name
                    int age;
                }
                """);

        assertThat(execute(source.toString(), "--strict")).isEqualTo(1);
        assertThat(tempDir.resolve("broken.c")).doesNotExist();

        assertThat(execute(source.toString())).isEqualTo(0);
        assertThat(tempDir.resolve("broken.c")).exists();
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path source = tempDir.resolve("app.zl");
        Files.writeString(source, "struct A { int id; }");
        Files.writeString(tempDir.resolve("app.c"), "previous");

        assertThat(execute(source.toString())).isEqualTo(1);
        assertThat(Files.readString(tempDir.resolve("app.c"))).isEqualTo("previous");

        assertThat(execute(source.toString(), "--force")).isEqualTo(0);
        assertThat(Files.readString(tempDir.resolve("app.c"))).contains("typedef struct A {");
    }

    @Test
    void testMissingSourceFails() {
        assertThat(execute(tempDir.resolve("nope.zl").toString())).isEqualTo(1);
    }

    private static int execute(String... args) {
        return new CommandLine(new BuildCommand()).execute(args);
    }
}
