package com.example.ajml.validation;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * The script files available under a project's {@code tools/} directory, as relative paths.
 * <p>
 * Compilation never touches the file system itself; callers list the scripts they hold.
 * </p>
 */
public final class ScriptLocator {

    public static final String SCRIPT_DIRECTORY = "tools/";

    private final Set<String> available;

    private ScriptLocator(Set<String> available) {
        this.available = available;
    }

    /** Accepts paths with or without the {@code tools/} prefix. */
    public static ScriptLocator of(Collection<String> paths) {
        Set<String> normalised = new TreeSet<>();
        for (String path : paths) {
            normalised.add(normalise(path));
        }
        return new ScriptLocator(normalised);
    }

    public static ScriptLocator none() {
        return new ScriptLocator(Set.of());
    }

    public boolean exists(String relativePath) {
        return relativePath != null && !relativePath.isBlank() && available.contains(normalise(relativePath));
    }

    /** Throws E308 when the script is not available. */
    public void require(String relativePath, String file, int line) {
        if (!exists(relativePath)) {
            throw new CompilationException(DiagnosticCode.SCRIPT_NOT_FOUND,
                    "Script file `" + SCRIPT_DIRECTORY + (relativePath != null ? normalise(relativePath) : "")
                            + "` does not exist.", file, line);
        }
    }

    private static String normalise(String path) {
        String result = path.trim().replace('\\', '/');
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        if (result.startsWith(SCRIPT_DIRECTORY)) {
            result = result.substring(SCRIPT_DIRECTORY.length());
        }
        return result;
    }
}
