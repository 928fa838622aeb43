package com.viewstack.view;

import org.apache.maven.plugin.logging.Log;

/**
 * Everything a template sees while it is evaluated: the controller/action being rendered, the
 * variables in scope, and the collaborators shared by the whole view.
 * <p>
 * {@link #copy()} gives nested sections and partials their own variables while they keep
 * sharing the collaborators.
 */
public class RenderingContext {

    private String controllerName;
    private String controllerAction;
    private VariableProvider variableProvider;
    private final TemplateResolver templateResolver;
    private final ViewErrorHandler errorHandler;
    private final Log log;
    private RenderEngine view;

    public RenderingContext(TemplateResolver templateResolver, ViewErrorHandler errorHandler, Log log) {
        this(templateResolver, errorHandler, new StandardVariableProvider(), log);
    }

    public RenderingContext(TemplateResolver templateResolver, ViewErrorHandler errorHandler,
            VariableProvider variableProvider, Log log) {
        this.templateResolver = templateResolver;
        this.errorHandler = errorHandler;
        this.variableProvider = variableProvider;
        this.log = log;
    }

    /**
     * Returns a context with the same controller, action and collaborators and a copy of the
     * variables.
     */
    public RenderingContext copy() {
        RenderingContext copy = new RenderingContext(templateResolver, errorHandler, variableProvider.copy(), log);
        copy.controllerName = controllerName;
        copy.controllerAction = controllerAction;
        copy.view = view;
        return copy;
    }

    public String getControllerName() {
        return controllerName;
    }

    public void setControllerName(String controllerName) {
        this.controllerName = controllerName;
    }

    public String getControllerAction() {
        return controllerAction;
    }

    public void setControllerAction(String controllerAction) {
        this.controllerAction = controllerAction;
    }

    public VariableProvider getVariableProvider() {
        return variableProvider;
    }

    public void setVariableProvider(VariableProvider variableProvider) {
        this.variableProvider = variableProvider;
    }

    public TemplateResolver getTemplateResolver() {
        return templateResolver;
    }

    public TemplatePaths getTemplatePaths() {
        return templateResolver.getTemplatePaths();
    }

    public ViewErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public Log getLog() {
        return log;
    }

    /**
     * @return the engine rendering with this context, used by view helpers to render nested
     *         sections and partials
     */
    public RenderEngine getView() {
        return view;
    }

    public void setView(RenderEngine view) {
        this.view = view;
    }
}
