package im.arun.codex.path;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * State threaded through a recursive include resolution: the directory includes are
 * resolved against, the containment root, the recursion depth and the set of files
 * already visited.
 * <p>
 * {@link #enter(Path)} shares the visited set with the caller, so a file is visited at
 * most once per pass. {@link #branch(Path)} copies it, so only the chain of ancestors
 * is tracked and the same file may appear in separate branches.
 */
public final class ResolutionContext {

    private final Path baseDir;
    private final Path root;
    private final int depth;
    private final Set<Path> visited;

    private ResolutionContext(Path baseDir, Path root, int depth, Set<Path> visited) {
        this.baseDir = baseDir;
        this.root = root;
        this.depth = depth;
        this.visited = visited;
    }

    public static ResolutionContext start(Path baseDir, Path root) {
        return new ResolutionContext(normalize(baseDir), normalize(root), 0, new LinkedHashSet<>());
    }

    public static ResolutionContext start(Path baseDir, Path root, Path documentFile) {
        ResolutionContext context = start(baseDir, root);
        if (documentFile != null) {
            context.visited.add(normalize(documentFile));
        }
        return context;
    }

    /**
     * Records {@code file} as visited and returns whether it was new.
     */
    public boolean markVisited(Path file) {
        return visited.add(normalize(file));
    }

    public boolean isVisited(Path file) {
        return visited.contains(normalize(file));
    }

    /**
     * Context for the children of {@code file}; the visited set is shared.
     */
    public ResolutionContext enter(Path file) {
        Path target = normalize(file);
        visited.add(target);
        return new ResolutionContext(target.getParent(), root, depth + 1, visited);
    }

    /**
     * Context for the children of {@code file}; the visited set is copied.
     */
    public ResolutionContext branch(Path file) {
        Path target = normalize(file);
        Set<Path> chain = new LinkedHashSet<>(visited);
        chain.add(target);
        return new ResolutionContext(target.getParent(), root, depth + 1, chain);
    }

    /**
     * Same visited set and depth, different base directory (inline folder nodes).
     */
    public ResolutionContext withBaseDir(Path directory) {
        return new ResolutionContext(normalize(directory), root, depth, visited);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path getRoot() {
        return root;
    }

    public int getDepth() {
        return depth;
    }

    public Set<Path> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    private static Path normalize(Path path) {
        return path == null ? null : path.toAbsolutePath().normalize();
    }
}
