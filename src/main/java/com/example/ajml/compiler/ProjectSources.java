package com.example.ajml.compiler;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything one compilation reads: the project document, the agent documents and the script paths
 * available under {@code tools/}.
 *
 * @param project {@code _project.ajml}, {@code null} when the project has none
 */
public record ProjectSources(SourceDocument project, List<SourceDocument> agents, Set<String> scripts) {

    public ProjectSources {
        agents = agents != null ? List.copyOf(agents) : List.of();
        scripts = scripts != null ? new TreeSet<>(scripts) : new TreeSet<>();
    }

    /** Agent documents ordered by file name, the order they are validated and generated in. */
    public List<SourceDocument> agentsInFileOrder() {
        return agents.stream().sorted(Comparator.comparing(SourceDocument::fileName)).toList();
    }
}
