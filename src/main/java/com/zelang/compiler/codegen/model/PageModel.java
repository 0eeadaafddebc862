package com.zelang.compiler.codegen.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PageModel {
    String title;
    String renderFunction;
    StructModel struct;
    int htmlBufferSize;
}
