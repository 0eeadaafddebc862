package com.zelang.compiler.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * UI composition nodes that can appear inside a page body.
 */
public sealed interface UiNode {

    Map<String, String> getProperties();

    /**
     * Nested nodes; empty for leaf components.
     */
    default List<UiNode> getChildren() {
        return List.of();
    }

    @Value
    @Builder
    final class SectionDecl implements UiNode {
        @Singular Map<String, String> properties;
        @Singular List<UiNode> children;
    }

    @Value
    @Builder
    final class RowDecl implements UiNode {
        @Singular Map<String, String> properties;
        @Singular List<UiNode> children;
    }

    @Value
    @Builder
    final class ColumnDecl implements UiNode {
        @Singular Map<String, String> properties;
        @Singular List<UiNode> children;
    }

    @Value
    @Builder
    final class FormDecl implements UiNode {
        @Singular Map<String, String> properties;
        @Singular List<UiNode> children;
    }

    @Value
    @Builder
    final class InputDecl implements UiNode {
        @Singular Map<String, String> properties;
    }

    @Value
    @Builder
    final class ButtonDecl implements UiNode {
        @Singular Map<String, String> properties;
    }

    @Value
    @Builder
    final class DataListDecl implements UiNode {
        @Singular Map<String, String> properties;
    }
}
