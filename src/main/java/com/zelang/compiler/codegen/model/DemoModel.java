package com.zelang.compiler.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Input of the console demo entry point.
 */
@Value
@Builder
public class DemoModel {
    @Singular
    List<StructModel> structs;

    /**
     * First struct, exercised by the demo; null when there is none.
     */
    StructModel primaryStruct;

    @Singular
    List<DemoRecord> records;

    String databasePath;

    @Value
    public static class DemoRecord {
        String variable;

        /**
         * C argument list for the create call.
         */
        String arguments;
    }
}
