package com.viewstack.view;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.maven.plugin.logging.Log;

/**
 * Resolves templates, layouts and partials by logical name and caches the parsed result.
 * <p>
 * Safe for concurrent use: each {@link ResolutionKey} is parsed at most once. Failed
 * resolutions, including passthrough sources, are not cached.
 */
public class TemplateResolver {

    private final TemplatePaths templatePaths;
    private final TemplateParser templateParser;
    private final Log log;
    private final Map<ResolutionKey, ParsedTemplate> cache = new ConcurrentHashMap<>();

    public TemplateResolver(TemplatePaths templatePaths, TemplateParser templateParser, Log log) {
        this.templatePaths = templatePaths;
        this.templateParser = templateParser;
        this.log = log;
    }

    /**
     * Resolves a template by kind.
     *
     * @param kind what to resolve
     * @param nameParts {@code controller, action} for {@link TemplateKind#TEMPLATE}, a single
     *                  name otherwise
     * @throws TemplateNotFoundException if the source cannot be located
     * @throws PassthroughSourceException if the source is not templated content
     */
    public ParsedTemplate resolve(TemplateKind kind, String... nameParts) {
        return switch (kind) {
            case TEMPLATE -> {
                if (nameParts.length != 2) {
                    throw new IllegalArgumentException("Templates resolve by controller and action");
                }
                yield resolveTemplate(nameParts[0], nameParts[1]);
            }
            case LAYOUT -> resolveLayout(singleName(nameParts));
            case PARTIAL -> resolvePartial(singleName(nameParts));
        };
    }

    public ParsedTemplate resolveTemplate(String controller, String action) {
        return cache.computeIfAbsent(ResolutionKey.template(controller, action), key -> parse(
                templatePaths.getTemplateIdentifier(controller, action),
                templatePaths.getTemplateSource(controller, action)));
    }

    public ParsedTemplate resolveLayout(String layoutName) {
        return cache.computeIfAbsent(ResolutionKey.layout(layoutName), key -> parse(
                templatePaths.getLayoutIdentifier(layoutName),
                templatePaths.getLayoutSource(layoutName)));
    }

    public ParsedTemplate resolvePartial(String partialName) {
        return cache.computeIfAbsent(ResolutionKey.partial(partialName), key -> parse(
                templatePaths.getPartialIdentifier(partialName),
                templatePaths.getPartialSource(partialName)));
    }

    public boolean isCached(ResolutionKey key) {
        return cache.containsKey(key);
    }

    public void flushCache() {
        log.debug("Flushing " + cache.size() + " cached template(s)");
        cache.clear();
    }

    public TemplatePaths getTemplatePaths() {
        return templatePaths;
    }

    private ParsedTemplate parse(String identifier, String source) {
        log.debug("Parsing " + identifier);
        return templateParser.parse(identifier, source);
    }

    private static String singleName(String[] nameParts) {
        if (nameParts.length != 1) {
            throw new IllegalArgumentException("Layouts and partials resolve by a single name");
        }
        return nameParts[0];
    }
}
