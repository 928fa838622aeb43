package com.viewstack.view.mustache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.util.Map;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.viewstack.view.ChildNotFoundException;
import com.viewstack.view.InvalidSectionException;
import com.viewstack.view.ParsedTemplate;
import com.viewstack.view.PassthroughSourceException;
import com.viewstack.view.RenderingContext;
import com.viewstack.view.StandardVariableProvider;
import com.viewstack.view.TemplateResolver;
import com.viewstack.view.ViewErrorHandler;

/**
 * Tests for parsing Mustache sources into sections, layout declarations and arguments.
 */
class MustacheTemplateParserTest {

    private MustacheTemplateParser parser;
    private RenderingContext context;

    @BeforeEach
    void setUp() {
        parser = new MustacheTemplateParser();
        context = new RenderingContext(mock(TemplateResolver.class), mock(ViewErrorHandler.class),
                new StandardVariableProvider(Map.of("name", "World")), mock(Log.class));
    }

    @Test
    void plainTemplateEvaluatesWithContextVariables() {
        ParsedTemplate template = parser.parse("greeting", "Hello {{name}}!");

        assertThat(template.getIdentifier()).isEqualTo("greeting");
        assertThat(template.evaluate(context)).isEqualTo("Hello World!");
    }

    @Test
    void sectionsAreCutOutOfTheBodyAndAddressableByName() {
        ParsedTemplate template = parser.parse("page", """
                before
                {{$main}}Main for {{name}}{{/main}}
                after
                """);

        assertThat(template.evaluate(context)).isEqualTo("before\nafter\n");
        assertThat(template.getNamedChild("main").evaluate(context)).isEqualTo("Main for World");
    }

    @Test
    void layoutNameIsAChild() {
        ParsedTemplate template = parser.parse("page", "{{$layoutName}} Default {{/layoutName}}body");

        assertThat(template.getNamedChild("layoutName").evaluate(context).trim()).isEqualTo("Default");
        assertThat(template.evaluate(context)).isEqualTo("body");
    }

    @Test
    void unknownChildFails() {
        ParsedTemplate template = parser.parse("page", "body");

        assertThatThrownBy(() -> template.getNamedChild("layoutName"))
                .isInstanceOf(ChildNotFoundException.class)
                .hasMessageContaining("layoutName")
                .hasMessageContaining("page");
    }

    @Test
    void argumentsBindAsDefaultsOnly() {
        ParsedTemplate template = parser.parse("page", """
                {{$arguments}}
                name: Default name
                color: blue
                {{/arguments}}
                {{name}} in {{color}}""");

        template.bindArguments(context);

        assertThat(context.getVariableProvider().get("name")).isEqualTo("World");
        assertThat(context.getVariableProvider().get("color")).isEqualTo("blue");
        assertThat(template.evaluate(context)).isEqualTo("World in blue");
        assertThatThrownBy(() -> template.getNamedChild("arguments")).isInstanceOf(ChildNotFoundException.class);
    }

    @Test
    void argumentsMustBeAMap() {
        assertThatThrownBy(() -> parser.parse("page", "{{$arguments}}- just\n- a list{{/arguments}}"))
                .isInstanceOf(InvalidSectionException.class)
                .hasMessageContaining("YAML map");
    }

    @Test
    void passthroughPragmaReturnsRemainingSource() {
        assertThatThrownBy(() -> parser.parse("raw", "{{! passthrough }}\n{{kept}} as is"))
                .isInstanceOfSatisfying(PassthroughSourceException.class,
                        e -> assertThat(e.getSource()).isEqualTo("{{kept}} as is"));
    }

    @Test
    void duplicateSectionIsInvalid() {
        assertThatThrownBy(() -> parser.parse("page", "{{$main}}a{{/main}}{{$main}}b{{/main}}"))
                .isInstanceOf(InvalidSectionException.class)
                .hasMessageContaining("declared twice");
    }

    @Test
    void unclosedSectionIsInvalid() {
        assertThatThrownBy(() -> parser.parse("page", "{{$main}}never closed"))
                .isInstanceOf(InvalidSectionException.class)
                .hasMessageContaining("not closed");
    }

    @Test
    void helpersAreAbsentWithoutAnEngine() {
        assertThat(ViewHelpers.scopeFor(context)).containsOnlyKeys("name");
    }
}
