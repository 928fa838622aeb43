package com.viewstack.view;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The rendering stack of one view. Each nested render pushes a {@link RenderingFrame} and pops
 * it when done; the top frame defines what is "current".
 * <p>
 * Not thread-safe: a session belongs to a single render call chain.
 */
public class RenderSession {

    private final Deque<RenderingFrame> stack = new ArrayDeque<>();
    private final RenderingContext baseContext;

    public RenderSession(RenderingContext baseContext) {
        this.baseContext = baseContext;
    }

    public void startRendering(TemplateKind kind, ParsedTemplate template, RenderingContext context) {
        stack.push(new RenderingFrame(kind, template, context));
    }

    /**
     * Pops the current frame. Calls must pair with {@link #startRendering}.
     *
     * @throws StackUnderflowException if nothing is being rendered
     */
    public void stopRendering() {
        if (stack.isEmpty()) {
            throw new StackUnderflowException();
        }
        stack.pop();
    }

    public TemplateKind currentKind() {
        RenderingFrame frame = stack.peek();
        return frame != null ? frame.getKind() : TemplateKind.TEMPLATE;
    }

    /**
     * Returns the template of the current frame. Outside any frame, the template of the current
     * context's controller and action is resolved; the result is not pushed.
     *
     * @throws TemplateNotFoundException if the template has to be resolved and cannot be found
     * @throws PassthroughSourceException if the resolved source is not templated content
     */
    public ParsedTemplate currentTemplate() {
        RenderingFrame frame = stack.peek();
        if (frame != null) {
            return frame.getTemplate();
        }
        RenderingContext context = currentContext();
        return context.getTemplateResolver().resolveTemplate(
                context.getControllerName(), context.getControllerAction());
    }

    public RenderingContext currentContext() {
        RenderingFrame frame = stack.peek();
        return frame != null ? frame.getContext() : baseContext;
    }

    public RenderingContext getBaseContext() {
        return baseContext;
    }

    public int depth() {
        return stack.size();
    }
}
