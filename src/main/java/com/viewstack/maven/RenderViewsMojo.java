package com.viewstack.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.maven.model.Resource;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import com.viewstack.maven.config.ViewConfig;
import com.viewstack.maven.config.ViewConfigLoader;
import com.viewstack.maven.config.ViewDefinition;
import com.viewstack.view.RenderEngine;
import com.viewstack.view.RenderingContext;
import com.viewstack.view.TemplatePaths;
import com.viewstack.view.TemplateResolver;
import com.viewstack.view.TolerantErrorHandler;
import com.viewstack.view.ViewErrorHandler;
import com.viewstack.view.mustache.MustacheTemplateParser;

/**
 * Renders the views listed in {@code views.yaml} into static files.
 * <p>
 * All views share one template cache, so a layout or partial used by many views is parsed once.
 * <p>
 * Run manually: {@code mvn viewstack:render}
 */
@Mojo(name = "render", defaultPhase = LifecyclePhase.GENERATE_RESOURCES)
public class RenderViewsMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    private MavenProject project;

    @Parameter(property = "viewstack.viewsDir", defaultValue = "${project.basedir}/src/main/views")
    private File viewsDir;

    @Parameter(property = "viewstack.configFile", defaultValue = "${project.basedir}/src/main/views/views.yaml")
    private File configFile;

    @Parameter(property = "viewstack.outputDir", defaultValue = "${project.build.directory}/generated-views")
    private File outputDir;

    @Parameter(property = "viewstack.addResource", defaultValue = "true")
    private boolean addResource;

    @Parameter(property = "viewstack.skip", defaultValue = "false")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException {
        if (skip) {
            getLog().info("viewstack: Skipping view rendering.");
            return;
        }
        if (configFile == null || !configFile.isFile()) {
            getLog().warn("viewstack: View configuration does not exist: " + configFile);
            return;
        }

        try {
            ViewConfig config = ViewConfigLoader.load(configFile.toPath());
            TemplateResolver resolver = new TemplateResolver(createTemplatePaths(config),
                    new MustacheTemplateParser(), getLog());
            ViewErrorHandler errorHandler = new TolerantErrorHandler(getLog());

            Path outDir = outputDir.toPath();
            int count = 0;
            for (ViewDefinition view : config.getViews()) {
                String output = renderView(view, config, resolver, errorHandler);
                Path outFile = outDir.resolve(view.resolveOutput(config.getFormat()));
                Files.createDirectories(outFile.getParent());
                Files.writeString(outFile, output);
                getLog().debug("viewstack: Wrote " + outFile);
                count++;
            }

            getLog().info("viewstack: Rendered " + count + " view(s) to " + outDir);

            // Project is null when the mojo runs outside a build (tests)
            if (addResource && project != null) {
                Resource resource = new Resource();
                resource.setDirectory(outputDir.getAbsolutePath());
                project.addResource(resource);
            }
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to render views", e);
        }
    }

    private String renderView(ViewDefinition view, ViewConfig config, TemplateResolver resolver,
            ViewErrorHandler errorHandler) {
        RenderingContext context = new RenderingContext(resolver, errorHandler, getLog());
        context.setControllerName(view.getController());
        context.setControllerAction("Default");

        RenderEngine engine = new RenderEngine(context);
        engine.assignMultiple(config.getVariables());
        engine.assignMultiple(view.getVariables());
        return engine.render(view.getAction());
    }

    private TemplatePaths createTemplatePaths(ViewConfig config) {
        Path viewsPath = viewsDir.toPath();
        TemplatePaths paths = new TemplatePaths(viewsPath, getLog());
        if (!config.getTemplateRootPaths().isEmpty()) {
            paths.setTemplateRootPaths(resolveAll(viewsPath, config.getTemplateRootPaths()));
        }
        if (!config.getLayoutRootPaths().isEmpty()) {
            paths.setLayoutRootPaths(resolveAll(viewsPath, config.getLayoutRootPaths()));
        }
        if (!config.getPartialRootPaths().isEmpty()) {
            paths.setPartialRootPaths(resolveAll(viewsPath, config.getPartialRootPaths()));
        }
        paths.setFormat(config.getFormat());
        return paths;
    }

    private static List<Path> resolveAll(Path base, List<String> paths) {
        List<Path> resolved = new ArrayList<>();
        for (String path : paths) {
            resolved.add(base.resolve(path));
        }
        return resolved;
    }
}
