package com.viewstack.view.mustache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.apache.maven.plugin.logging.SystemStreamLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.viewstack.view.RenderEngine;
import com.viewstack.view.RenderingContext;
import com.viewstack.view.TemplatePaths;
import com.viewstack.view.TemplateResolver;
import com.viewstack.view.TolerantErrorHandler;

/**
 * Renders the classpath views under {@code /views} end to end: layouts, sections, partials and
 * their error paths.
 */
class MustacheRenderingTest {

    private RenderEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RenderEngine();
        engine.assign("title", "Hello");
    }

    @Test
    void defaultControllerActionFallsBackToActionTemplate() {
        assertThat(engine.render()).isEqualTo("Default view for Hello\n");
        assertThat(engine.getTemplatePaths().getFormat()).isEqualTo("html");
    }

    @Test
    void contextWithoutControllerRendersActionTemplate() {
        SystemStreamLog log = new SystemStreamLog();
        TemplateResolver resolver = new TemplateResolver(new TemplatePaths(log), new MustacheTemplateParser(), log);
        RenderingContext context = new RenderingContext(resolver, new TolerantErrorHandler(log), log);
        context.setControllerAction("Default");
        RenderEngine noController = new RenderEngine(context).assign("title", "World");

        assertThat(noController.render()).isEqualTo("Default view for World\n");
    }

    @Test
    void templateWithLayoutRendersLayoutAroundSections() {
        useController("Blog");

        String output = engine.render("index");

        assertThat(output).startsWith("<html><title>Blog</title><body>");
        assertThat(output).contains("<h1>Hello</h1>");
        assertThat(output).contains("<div class=\"card\"><strong>Hello</strong></div>");
        assertThat(output).doesNotContain("never rendered");
        assertThat(output).endsWith("</body></html>\n");
        assertThat(engine.getRenderSession().depth()).isZero();
    }

    @Test
    void optionalLayoutSectionRendersPartialSection() {
        useController("Blog");

        String output = engine.render("sidebar");

        assertThat(output).contains("<p>Hello</p><aside><strong>Hello</strong></aside>");
    }

    @Test
    void templateWithoutLayoutHidesItsSections() {
        useController("Blog");

        assertThat(engine.render("plain")).isEqualTo("Plain Hello\n");
    }

    @Test
    void sectionCanBeRenderedOutsideAnyRenderCall() {
        useController("Blog");
        engine.getRenderingContext().setControllerAction("Plain");

        assertThat(engine.renderSection("unused", Map.of("title", "Section"), false)).isEqualTo("<em>Section</em>");
        assertThat(engine.getRenderingContext().getVariableProvider().get("title")).isEqualTo("Hello");
    }

    @Test
    void passthroughTemplateIsNotParsed() {
        useController("Blog");

        assertThat(engine.render("raw")).isEqualTo("{{not a tag}}\n");
    }

    @Test
    void missingPartialRendersInlineErrorUnlessIgnored() {
        useController("Blog");

        String output = engine.render("broken");

        assertThat(output).startsWith("[View error: Partials not found: Missing");
        assertThat(output).endsWith("][][]\n");
    }

    @Test
    void partialSectionWithVariables() {
        String output = engine.renderPartial("Card", "header", Map.of("title", "X"), false);

        assertThat(output).isEqualTo("<strong>X</strong>");
        assertThat(engine.getRenderingContext().getVariableProvider().get("title")).isEqualTo("Hello");
    }

    @Test
    void wholePartialUsesArgumentDefaults() {
        assertThat(engine.renderPartial("card", null, Map.of(), false))
                .isEqualTo("<div class=\"card\"><strong>Hello</strong></div>\n");
        assertThat(engine.getRenderingContext().getVariableProvider().exists("cardClass")).isFalse();
    }

    @Test
    void classpathPartialWithoutSections() {
        assertThat(engine.renderPartial("Footer", null, Map.of(), false))
                .isEqualTo("<footer>classpath footer</footer>\n");
    }

    @Test
    void missingTemplateIsReportedNotThrown() {
        useController("Nope");

        assertThat(engine.render("missing")).startsWith("View error: Templates not found: Nope/Missing");
    }

    private void useController(String controller) {
        RenderingContext context = engine.getRenderingContext();
        context.setControllerName(controller);
    }
}
