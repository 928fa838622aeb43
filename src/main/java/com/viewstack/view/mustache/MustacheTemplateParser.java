package com.viewstack.view.mustache;

import java.io.StringReader;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.MustacheFactory;
import com.viewstack.view.InvalidSectionException;
import com.viewstack.view.ParsedTemplate;
import com.viewstack.view.PassthroughSourceException;
import com.viewstack.view.TemplateNode;
import com.viewstack.view.TemplateParser;

/**
 * Mustache-based template parser.
 * <p>
 * Top-level {@code {{$name}}...{{/name}}} blocks become named children and are cut out of the
 * template body. Two names are special: {@code layoutName} holds the name of the enclosing
 * layout, {@code arguments} holds a YAML map of variable defaults. A source starting with
 * {@code {{! passthrough }}} is returned verbatim instead of being parsed.
 */
public class MustacheTemplateParser implements TemplateParser {

    static final String ARGUMENTS_CHILD = "arguments";

    private static final Pattern PASSTHROUGH_PRAGMA = Pattern.compile("\\A\\{\\{!\\s*passthrough\\s*}}\\R?");
    private static final Pattern SECTION_BLOCK = Pattern.compile(
            "\\{\\{\\$\\s*([\\w.-]+)\\s*}}(.*?)\\{\\{/\\s*\\1\\s*}}\\R?", Pattern.DOTALL);
    private static final Pattern SECTION_OPENING = Pattern.compile("\\{\\{\\$\\s*([\\w.-]+)\\s*}}");

    private final MustacheFactory mustacheFactory;

    public MustacheTemplateParser() {
        this(new DefaultMustacheFactory());
    }

    public MustacheTemplateParser(MustacheFactory mustacheFactory) {
        this.mustacheFactory = mustacheFactory;
    }

    @Override
    public ParsedTemplate parse(String identifier, String source) {
        Matcher pragma = PASSTHROUGH_PRAGMA.matcher(source);
        if (pragma.lookingAt()) {
            throw new PassthroughSourceException(identifier, source.substring(pragma.end()));
        }

        Map<String, TemplateNode> children = new LinkedHashMap<>();
        Map<String, Object> argumentDefaults = Collections.emptyMap();
        Set<String> declared = new HashSet<>();
        StringBuilder body = new StringBuilder();

        Matcher block = SECTION_BLOCK.matcher(source);
        int last = 0;
        while (block.find()) {
            body.append(source, last, block.start());
            last = block.end();

            String name = block.group(1);
            String content = block.group(2);
            if (!declared.add(name)) {
                throw new InvalidSectionException("Section '" + name + "' declared twice in " + identifier);
            }
            if (ARGUMENTS_CHILD.equals(name)) {
                argumentDefaults = parseArguments(identifier, content);
            } else {
                children.put(name, new MustacheSection(
                        mustacheFactory.compile(new StringReader(content), identifier + "#" + name)));
            }
        }
        body.append(source, last, source.length());

        Matcher unclosed = SECTION_OPENING.matcher(body);
        if (unclosed.find()) {
            throw new InvalidSectionException("Section '" + unclosed.group(1) + "' is not closed in " + identifier);
        }

        return new MustacheParsedTemplate(identifier,
                mustacheFactory.compile(new StringReader(body.toString()), identifier),
                children, argumentDefaults);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parseArguments(String identifier, String content) {
        Object data;
        try {
            data = new Yaml().load(content);
        } catch (YAMLException e) {
            throw new InvalidSectionException("Unreadable arguments in " + identifier + ": " + e.getMessage());
        }
        if (data == null) {
            return Collections.emptyMap();
        }
        if (!(data instanceof Map)) {
            throw new InvalidSectionException("Arguments of " + identifier + " must be a YAML map");
        }
        return new LinkedHashMap<>((Map<String, Object>) data);
    }
}
