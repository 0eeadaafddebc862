package com.zelang.compiler.codegen.context;

import lombok.Builder;
import lombok.Data;

/**
 * Settings baked into the generated C program.
 */
@Data
@Builder
public class GeneratorConfig {
    public static final String DEFAULT_DATABASE_PATH = "app.db";
    public static final int DEFAULT_HTTP_PORT = 8080;

    @Builder.Default
    private String databasePath = DEFAULT_DATABASE_PATH;

    @Builder.Default
    private int httpPort = DEFAULT_HTTP_PORT;

    /**
     * Size of the buffer each page render function allocates.
     */
    @Builder.Default
    private int htmlBufferSize = 65536;

    /**
     * Initial capacity of the array returned by {@code X_all}; doubled on demand.
     */
    @Builder.Default
    private int listInitialCapacity = 10;

    @Builder.Default
    private int maxFormPairs = 10;

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
