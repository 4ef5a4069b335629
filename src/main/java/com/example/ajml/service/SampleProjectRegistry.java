package com.example.ajml.service;

import com.example.ajml.api.SampleNotFoundException;
import com.example.ajml.compiler.ProjectSources;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory catalogue of the bundled sample projects, filled at startup.
 */
@Component
public class SampleProjectRegistry {

    private final Map<String, ProjectSources> samples = new ConcurrentSkipListMap<>();

    public void register(String name, ProjectSources sources) {
        samples.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(sources, "sources"));
    }

    /** Sample names in alphabetical order. */
    public List<String> names() {
        return List.copyOf(samples.keySet());
    }

    /**
     * @throws SampleNotFoundException if no sample has that name
     */
    public ProjectSources get(String name) {
        ProjectSources sources = samples.get(name);
        if (sources == null) {
            throw new SampleNotFoundException(name);
        }
        return sources;
    }
}
