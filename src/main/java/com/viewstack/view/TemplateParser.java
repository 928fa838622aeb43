package com.viewstack.view;

/**
 * Turns raw template source into an evaluable tree.
 */
public interface TemplateParser {

    /**
     * Parses a template source.
     *
     * @param identifier stable identifier of the source, used for naming and diagnostics
     * @param source the raw template text
     * @return the parsed template
     * @throws PassthroughSourceException if the source is not templated content
     * @throws InvalidSectionException if the source declares sections that cannot be addressed
     */
    ParsedTemplate parse(String identifier, String source);
}
