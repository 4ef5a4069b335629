package com.example.ajml.config;

import com.example.ajml.compiler.ProjectSources;
import com.example.ajml.compiler.SourceDocument;
import com.example.ajml.service.SampleProjectRegistry;
import com.example.ajml.validation.ProjectDocumentValidator;
import com.example.ajml.validation.ScriptLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the sample projects bundled under {@code classpath:<samplesLocation>/<name>/} into the
 * {@link SampleProjectRegistry} at startup. A sample is any folder holding a {@code _project.ajml}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SampleProjectsLoader implements ApplicationRunner {

    private final CompilerProperties properties;
    private final SampleProjectRegistry registry;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    @Override
    public void run(ApplicationArguments args) {
        String root = properties.samplesLocation();
        Resource[] projects;
        try {
            projects = resolver.getResources("classpath*:" + root + "/*/" + ProjectDocumentValidator.PROJECT_FILE);
        } catch (IOException e) {
            log.error("Failed to scan sample projects under {}: {}", root, e.getMessage());
            return;
        }
        for (Resource project : projects) {
            String name = sampleName(project);
            if (name == null) {
                log.warn("Skipping sample project with unreadable location: {}", project.getDescription());
                continue;
            }
            try {
                registry.register(name, load(root + "/" + name, project));
                log.info("Loaded sample project: {}", name);
            } catch (IOException e) {
                log.error("Failed to read sample project {}: {}", name, e.getMessage());
            }
        }
    }

    private ProjectSources load(String folder, Resource project) throws IOException {
        List<SourceDocument> agents = new ArrayList<>();
        for (Resource document : resolver.getResources("classpath*:" + folder + "/*.ajml")) {
            String fileName = document.getFilename();
            if (fileName != null && !fileName.equals(ProjectDocumentValidator.PROJECT_FILE)) {
                agents.add(new SourceDocument(fileName, read(document)));
            }
        }
        Set<String> scripts = new LinkedHashSet<>();
        String marker = folder + "/" + ScriptLocator.SCRIPT_DIRECTORY;
        for (Resource script : resolver.getResources("classpath*:" + marker + "**/*.py")) {
            String url = script.getURL().toString();
            int index = url.lastIndexOf(marker);
            if (index >= 0) {
                scripts.add(url.substring(index + marker.length()));
            }
        }
        return new ProjectSources(new SourceDocument(ProjectDocumentValidator.PROJECT_FILE, read(project)), agents, scripts);
    }

    private static String read(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String sampleName(Resource project) {
        try {
            String[] segments = project.getURL().toString().split("/");
            return segments.length >= 2 ? segments[segments.length - 2] : null;
        } catch (IOException e) {
            log.debug("No URL for {}: {}", project.getDescription(), e.getMessage());
            return null;
        }
    }
}
