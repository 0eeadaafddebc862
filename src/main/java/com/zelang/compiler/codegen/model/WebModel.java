package com.zelang.compiler.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Input of the HTTP dispatch and web entry point templates. {@code primaryStruct} and
 * {@code page} are null when the program declares none.
 */
@Value
@Builder
public class WebModel {
    @Singular
    List<StructModel> structs;

    StructModel primaryStruct;
    PageModel page;

    @Singular
    List<HandlerStubModel> handlers;

    String databasePath;
    int httpPort;
    int maxFormPairs;
}
