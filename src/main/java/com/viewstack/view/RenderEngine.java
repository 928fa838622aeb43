package com.viewstack.view;

import java.util.Map;

import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import com.viewstack.view.mustache.MustacheTemplateParser;

/**
 * Renders a controller action template, wrapped in its layout when it declares one, and the
 * sections and partials the templates ask for while they are evaluated.
 * <p>
 * Every nested render pushes a frame on the {@link RenderSession} and pops it before returning,
 * whichever way the render ends. Recoverable {@link ViewException}s are resolved at the entry
 * point that hit them: {@code ignoreUnknown} turns a missing section or partial into empty
 * output, otherwise the context's {@link ViewErrorHandler} renders a replacement. A
 * {@link PassthroughSourceException} makes the entry point return the raw source.
 */
public class RenderEngine {

    static final String LAYOUT_NAME_CHILD = "layoutName";

    private RenderingContext baseRenderingContext;
    private RenderSession session;

    /**
     * Creates an engine reading views from the classpath {@code /views/} folder, rendering
     * controller {@code Default}, action {@code Default}.
     */
    public RenderEngine() {
        this(defaultRenderingContext(new SystemStreamLog()));
    }

    public RenderEngine(RenderingContext context) {
        setRenderingContext(context);
    }

    static RenderingContext defaultRenderingContext(Log log) {
        TemplatePaths templatePaths = new TemplatePaths(log);
        TemplateResolver resolver = new TemplateResolver(templatePaths, new MustacheTemplateParser(), log);
        RenderingContext context = new RenderingContext(resolver, new TolerantErrorHandler(log), log);
        context.setControllerName("Default");
        context.setControllerAction("Default");
        return context;
    }

    public RenderingContext getRenderingContext() {
        return baseRenderingContext;
    }

    /**
     * Replaces the base context. Starts a fresh rendering stack.
     */
    public void setRenderingContext(RenderingContext context) {
        this.baseRenderingContext = context;
        this.session = new RenderSession(context);
        initializeRenderingContext();
    }

    /**
     * Prepares the base context before it is used. Subclasses may extend this to adjust the
     * context before rendering starts.
     */
    protected void initializeRenderingContext() {
        baseRenderingContext.setView(this);
    }

    public TemplatePaths getTemplatePaths() {
        return baseRenderingContext.getTemplatePaths();
    }

    public RenderSession getRenderSession() {
        return session;
    }

    public RenderEngine assign(String key, Object value) {
        baseRenderingContext.getVariableProvider().add(key, value);
        return this;
    }

    public RenderEngine assignMultiple(Map<String, ?> values) {
        VariableProvider variables = baseRenderingContext.getVariableProvider();
        values.forEach(variables::add);
        return this;
    }

    public String render() {
        return render(null);
    }

    /**
     * Renders the template of the configured controller action, or of {@code actionName} when
     * given. If the template declares a non-empty {@code layoutName} the layout is rendered
     * instead and pulls the template's sections itself.
     *
     * @param actionName action to render instead of the configured one, may be {@code null}
     * @return the rendered output
     */
    public String render(String actionName) {
        RenderingContext context = session.currentContext();
        if (actionName != null && !actionName.isEmpty()) {
            context.setControllerAction(Character.toUpperCase(actionName.charAt(0)) + actionName.substring(1));
        }

        ParsedTemplate parsedTemplate;
        try {
            parsedTemplate = session.currentTemplate();
            parsedTemplate.bindArguments(context);
        } catch (PassthroughSourceException e) {
            return e.getSource();
        } catch (RuntimeException e) {
            return context.getErrorHandler().handleViewError(e);
        }

        String layoutName = resolveLayoutName(parsedTemplate, context);
        if (layoutName == null || layoutName.isEmpty()) {
            return evaluateInFrame(TemplateKind.TEMPLATE, parsedTemplate, baseRenderingContext, parsedTemplate);
        }

        ParsedTemplate parsedLayout;
        try {
            parsedLayout = context.getTemplateResolver().resolveLayout(layoutName);
            parsedLayout.bindArguments(context);
        } catch (PassthroughSourceException e) {
            return e.getSource();
        } catch (RuntimeException e) {
            return context.getErrorHandler().handleViewError(e);
        }
        context.getLog().debug("Rendering " + parsedTemplate.getIdentifier() + " in layout " + layoutName);
        return evaluateInFrame(TemplateKind.LAYOUT, parsedTemplate, baseRenderingContext, parsedLayout);
    }

    /**
     * Renders a section of the template currently being rendered.
     * <p>
     * Inside a layout the section belongs to the template and shares the layout's variables.
     * Anywhere else it renders one level deeper with a copy of the current variables overlaid
     * with {@code variables}.
     *
     * @param sectionName name of the section
     * @param variables variables added for the section
     * @param ignoreUnknown return empty output instead of an error when the section is missing
     * @return the rendered section
     */
    public String renderSection(String sectionName, Map<String, ?> variables, boolean ignoreUnknown) {
        TemplateKind currentKind = session.currentKind();
        TemplateKind nextKind = switch (currentKind) {
            case LAYOUT -> TemplateKind.TEMPLATE;
            case TEMPLATE, PARTIAL -> currentKind;
        };
        RenderingContext context;
        if (currentKind == TemplateKind.LAYOUT) {
            context = session.currentContext();
        } else {
            context = session.currentContext().copy();
            context.setVariableProvider(context.getVariableProvider().getScopeCopy(variables));
        }

        ParsedTemplate parsedTemplate;
        try {
            parsedTemplate = session.currentTemplate();
        } catch (PassthroughSourceException e) {
            return e.getSource();
        } catch (TemplateNotFoundException e) {
            return ignoreUnknown ? "" : context.getErrorHandler().handleViewError(e);
        } catch (RuntimeException e) {
            return context.getErrorHandler().handleViewError(e);
        }

        TemplateNode section;
        try {
            section = parsedTemplate.getNamedChild(sectionName);
        } catch (ChildNotFoundException e) {
            return ignoreUnknown ? "" : context.getErrorHandler().handleViewError(e);
        }

        return evaluateInFrame(nextKind, parsedTemplate, context, section);
    }

    /**
     * Renders a partial, or one section of it, with a copy of the current variables.
     *
     * @param partialName name of the partial
     * @param sectionName section of the partial to render, {@code null} for the whole partial
     * @param variables variables added for the partial
     * @param ignoreUnknown return empty output instead of an error when the partial or section
     *                      is missing
     * @return the rendered partial
     */
    public String renderPartial(String partialName, String sectionName, Map<String, ?> variables,
            boolean ignoreUnknown) {
        RenderingContext context = session.currentContext().copy();

        ParsedTemplate parsedPartial;
        try {
            parsedPartial = context.getTemplateResolver().resolvePartial(partialName);
            parsedPartial.bindArguments(context);
        } catch (PassthroughSourceException e) {
            return e.getSource();
        } catch (TemplateNotFoundException | InvalidSectionException e) {
            return ignoreUnknown ? "" : context.getErrorHandler().handleViewError(e);
        } catch (RuntimeException e) {
            return context.getErrorHandler().handleViewError(e);
        }

        session.startRendering(TemplateKind.PARTIAL, parsedPartial, context);
        try {
            if (sectionName != null) {
                return renderSection(sectionName, variables, ignoreUnknown);
            }
            context.setVariableProvider(context.getVariableProvider().getScopeCopy(variables));
            return parsedPartial.evaluate(context);
        } finally {
            session.stopRendering();
        }
    }

    private String resolveLayoutName(ParsedTemplate parsedTemplate, RenderingContext context) {
        TemplateNode layoutNameNode;
        try {
            layoutNameNode = parsedTemplate.getNamedChild(LAYOUT_NAME_CHILD);
        } catch (ChildNotFoundException e) {
            return null;
        }
        String layoutName = layoutNameNode.evaluate(context);
        return layoutName == null ? null : layoutName.trim();
    }

    private String evaluateInFrame(TemplateKind kind, ParsedTemplate frameTemplate, RenderingContext context,
            TemplateNode node) {
        session.startRendering(kind, frameTemplate, context);
        try {
            return node.evaluate(context);
        } finally {
            session.stopRendering();
        }
    }
}
