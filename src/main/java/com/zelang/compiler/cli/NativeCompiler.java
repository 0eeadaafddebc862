package com.zelang.compiler.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the system C compiler on a generated file.
 */
public class NativeCompiler {
    private static final Logger log = LoggerFactory.getLogger(NativeCompiler.class);

    private final String compiler;

    public NativeCompiler(String compiler) {
        this.compiler = compiler;
    }

    /**
     * Command line for compiling {@code source} into {@code executable}.
     * Web programs additionally link libmicrohttpd.
     */
    public List<String> command(Path source, Path executable, boolean webMode) {
        List<String> command = new ArrayList<>();
        command.add(compiler);
        command.add("-o");
        command.add(executable.toString());
        command.add(source.toString());
        command.add("-lsqlite3");
        if (webMode) {
            command.add("-lmicrohttpd");
        }
        return command;
    }

    /**
     * @return true if the compiler exited with status 0
     */
    public boolean compile(Path source, Path executable, boolean webMode) {
        List<String> command = command(source, executable, webMode);
        log.info("Running {}", String.join(" ", command));
        try {
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectErrorStream(true);
            if (source.getParent() != null) {
                pb.directory(source.getParent().toFile());
            }

            Process process = pb.start();

            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info("{}: {}", compiler, line);
                }
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.error("{} exited with code {}", compiler, exitCode);
                return false;
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to run {}", compiler, e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for {}", compiler);
            return false;
        }
    }
}
