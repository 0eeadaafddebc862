package com.zelang.compiler.model;

import com.zelang.compiler.model.UiNode.DataListDecl;
import com.zelang.compiler.model.UiNode.FormDecl;
import com.zelang.compiler.model.UiNode.InputDecl;
import com.zelang.compiler.model.UiNode.SectionDecl;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PageDeclTest {

    @Test
    void testBuildPageTree() {
        PageDecl page = PageDecl.builder()
                .name("Dashboard")
                .property("title", "Dashboard")
                .child(SectionDecl.builder()
                        .property("class", "mt-3")
                        .child(DataListDecl.builder().property("source", "Todo").build())
                        .child(FormDecl.builder()
                                .child(InputDecl.builder().property("name", "title").build())
                                .build())
                        .build())
                .build();

        assertThat(page.getProperties()).containsEntry("title", "Dashboard");
        UiNode section = page.getBody().get(0);
        assertThat(section.getChildren()).hasSize(2);
        assertThat(section.getChildren().get(1).getChildren().get(0).getProperties())
                .containsEntry("name", "title");
        assertThat(section.getChildren().get(0).getChildren()).isEmpty();
    }

    @Test
    void testProgramKeepsDeclarationOrderAndVisitsEachKind() {
        Program program = Program.builder()
                .declaration(StructDecl.builder().name("A").build())
                .declaration(PageDecl.builder().name("Home").build())
                .declaration(HandlerDecl.builder().name("ping").build())
                .declaration(FunctionDecl.builder().returnType("void").name("helper").build())
                .declaration(MainDecl.builder().returnType("int").build())
                .build();

        DeclarationVisitor<String> kinds = new DeclarationVisitor<>() {
            public String visitStruct(StructDecl struct) { return "struct"; }
            public String visitPage(PageDecl page) { return "page"; }
            public String visitHandler(HandlerDecl handler) { return "handler"; }
            public String visitFunction(FunctionDecl function) { return "function"; }
            public String visitMain(MainDecl main) { return "main"; }
        };

        assertThat(program.getDeclarations()).extracting(d -> d.accept(kinds))
                .containsExactly("struct", "page", "handler", "function", "main");
        assertThat(program.getDeclarations()).extracting(Declaration::getName)
                .containsExactly("A", "Home", "ping", "helper", "main");
    }
}
