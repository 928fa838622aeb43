package com.viewstack.view;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.maven.plugin.logging.Log;

/**
 * Locates template, layout and partial sources by logical name.
 * Resolution order: configured root paths in the order given -> classpath {@code /views/}
 */
public class TemplatePaths {

    public static final String DEFAULT_FORMAT = "html";

    static final String TEMPLATES_FOLDER = "Templates";
    static final String LAYOUTS_FOLDER = "Layouts";
    static final String PARTIALS_FOLDER = "Partials";

    private static final String CLASSPATH_ROOT = "/views/";

    private final List<Path> templateRootPaths = new ArrayList<>();
    private final List<Path> layoutRootPaths = new ArrayList<>();
    private final List<Path> partialRootPaths = new ArrayList<>();
    private String format = DEFAULT_FORMAT;
    private final Log log;

    public TemplatePaths(Log log) {
        this.log = log;
    }

    /**
     * Uses the conventional {@code Templates}, {@code Layouts} and {@code Partials} folders
     * below a single views directory.
     */
    public TemplatePaths(Path viewsDir, Log log) {
        this(log);
        templateRootPaths.add(viewsDir.resolve(TEMPLATES_FOLDER));
        layoutRootPaths.add(viewsDir.resolve(LAYOUTS_FOLDER));
        partialRootPaths.add(viewsDir.resolve(PARTIALS_FOLDER));
    }

    public List<Path> getTemplateRootPaths() {
        return templateRootPaths;
    }

    public void setTemplateRootPaths(List<Path> paths) {
        templateRootPaths.clear();
        templateRootPaths.addAll(paths);
    }

    public List<Path> getLayoutRootPaths() {
        return layoutRootPaths;
    }

    public void setLayoutRootPaths(List<Path> paths) {
        layoutRootPaths.clear();
        layoutRootPaths.addAll(paths);
    }

    public List<Path> getPartialRootPaths() {
        return partialRootPaths;
    }

    public void setPartialRootPaths(List<Path> paths) {
        partialRootPaths.clear();
        partialRootPaths.addAll(paths);
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String getTemplateIdentifier(String controller, String action) {
        return identifier(TEMPLATES_FOLDER, controller == null ? action : controller + "_" + action);
    }

    public String getLayoutIdentifier(String layoutName) {
        return identifier(LAYOUTS_FOLDER, layoutName);
    }

    public String getPartialIdentifier(String partialName) {
        return identifier(PARTIALS_FOLDER, partialName);
    }

    /**
     * Loads a controller action template, trying {@code <Controller>/<Action>} before
     * {@code <Action>} in each root.
     *
     * @throws TemplateNotFoundException if no root contains the template
     */
    public String getTemplateSource(String controller, String action) {
        List<String> candidates = new ArrayList<>();
        if (controller != null && !controller.isEmpty()) {
            for (String name : nameVariants(action)) {
                candidates.add(controller + "/" + name);
            }
        }
        candidates.addAll(nameVariants(action));
        return loadSource(TEMPLATES_FOLDER, templateRootPaths, candidates,
                controller == null ? action : controller + "/" + action);
    }

    /**
     * @throws TemplateNotFoundException if no root contains the layout
     */
    public String getLayoutSource(String layoutName) {
        return loadSource(LAYOUTS_FOLDER, layoutRootPaths, nameVariants(layoutName), layoutName);
    }

    /**
     * @throws TemplateNotFoundException if no root contains the partial
     */
    public String getPartialSource(String partialName) {
        return loadSource(PARTIALS_FOLDER, partialRootPaths, nameVariants(partialName), partialName);
    }

    private String loadSource(String folder, List<Path> roots, List<String> candidates, String logicalName) {
        if (logicalName == null || logicalName.isBlank() || logicalName.contains("..")
                || isAbsoluteName(logicalName)) {
            throw new TemplateNotFoundException("Invalid " + folder + " name: '" + logicalName + "'");
        }

        for (Path root : roots) {
            Path normalizedRoot = root.toAbsolutePath().normalize();
            for (String candidate : candidates) {
                Path file = normalizedRoot.resolve(candidate + "." + format).normalize();
                if (!file.startsWith(normalizedRoot)) {
                    log.debug("Skipping " + folder + " candidate outside " + normalizedRoot + ": " + candidate);
                    continue;
                }
                if (Files.isRegularFile(file)) {
                    log.debug("Using " + folder + " source: " + file);
                    try {
                        return Files.readString(file);
                    } catch (IOException e) {
                        throw new ViewException("Failed to read " + file, e);
                    }
                }
            }
        }

        for (String candidate : candidates) {
            if (isAbsoluteName(candidate)) {
                continue;
            }
            String resourcePath = CLASSPATH_ROOT + folder + "/" + candidate + "." + format;
            try (InputStream inputStream = TemplatePaths.class.getResourceAsStream(resourcePath)) {
                if (inputStream != null) {
                    log.debug("Using classpath " + folder + " source: " + resourcePath);
                    return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
                }
            } catch (IOException e) {
                throw new ViewException("Failed to read classpath resource " + resourcePath, e);
            }
        }

        throw new TemplateNotFoundException(folder + " not found: " + logicalName
                + " (checked roots: " + roots + ", classpath: " + CLASSPATH_ROOT + folder + ")");
    }

    private String identifier(String folder, String name) {
        return folder + "_" + String.valueOf(name).replaceAll("[^A-Za-z0-9]", "_") + "_" + format;
    }

    // Names stay below their root: no leading separator and no drive letter.
    private static boolean isAbsoluteName(String name) {
        return name.startsWith("/") || name.startsWith("\\") || name.matches("^[A-Za-z]:.*");
    }

    private static List<String> nameVariants(String name) {
        Set<String> variants = new LinkedHashSet<>();
        if (name != null && !name.isEmpty()) {
            variants.add(name);
            variants.add(Character.toUpperCase(name.charAt(0)) + name.substring(1));
        }
        return new ArrayList<>(variants);
    }
}
