package im.arun.codex.service;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.config.ConfigLoader;
import im.arun.codex.index.IndexResolution;
import im.arun.codex.index.IndexResolver;
import im.arun.codex.io.CodexFileStore;
import im.arun.codex.model.DropPosition;
import im.arun.codex.order.IndexReorderer;
import im.arun.codex.order.OrderCalculator;
import im.arun.codex.order.ReorderOptions;
import im.arun.codex.order.ReorderResult;
import im.arun.codex.path.PathResolver;
import im.arun.codex.tree.ExplodeOptions;
import im.arun.codex.tree.ExplodeResult;
import im.arun.codex.tree.GraphExploder;
import im.arun.codex.tree.GraphImploder;
import im.arun.codex.tree.ImplodeOptions;
import im.arun.codex.tree.ImplodeResult;
import im.arun.codex.util.CancellationToken;
import im.arun.codex.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point that wires every engine component from one {@link CodexConfig}.
 */
public class CodexService {
    private static final Logger logger = LoggerFactory.getLogger(CodexService.class);

    private final CodexConfig config;
    private final GraphExploder exploder;
    private final GraphImploder imploder;
    private final IndexResolver indexResolver;
    private final IndexReorderer reorderer;

    public CodexService() {
        this(new ConfigLoader().load());
    }

    public CodexService(CodexConfig config) {
        this.config = config;
        PathResolver pathResolver = new PathResolver(config);
        CodexFileStore fileStore = new CodexFileStore();
        this.exploder = new GraphExploder(config, pathResolver, fileStore);
        this.imploder = new GraphImploder(config, pathResolver, fileStore);
        this.indexResolver = new IndexResolver(config, pathResolver, fileStore);
        this.reorderer = new IndexReorderer(new OrderCalculator(config), fileStore);
        logger.debug("Codex service ready (projectRoot={}, enforceContainment={})",
            config.getProjectRoot(), config.isEnforceContainment());
    }

    public CodexConfig getConfig() {
        return config;
    }

    public ExplodeOptions explodeOptions() {
        return ExplodeOptions.fromConfig(config);
    }

    public ImplodeOptions implodeOptions() {
        return ImplodeOptions.fromConfig(config);
    }

    public ExplodeResult explode(Path document) {
        return explode(document, explodeOptions());
    }

    public ExplodeResult explode(Path document, ExplodeOptions options) {
        return exploder.explode(document, options);
    }

    public ExplodeResult explode(Path document, ExplodeOptions options,
                                 ProgressListener progress, CancellationToken cancellation) {
        return exploder.explode(document, options, progress, cancellation);
    }

    public ImplodeResult implode(Path document) {
        return implode(document, implodeOptions());
    }

    public ImplodeResult implode(Path document, ImplodeOptions options) {
        return imploder.implode(document, options);
    }

    public ImplodeResult implode(Path document, ImplodeOptions options,
                                 ProgressListener progress, CancellationToken cancellation) {
        return imploder.implode(document, options, progress, cancellation);
    }

    public IndexResolution resolveIndex(Path indexFile) {
        return indexResolver.resolve(indexFile);
    }

    public ReorderResult reorder(Path indexFile, List<String> itemIds, String targetId, DropPosition position) {
        return reorder(indexFile, itemIds, targetId, position, ReorderOptions.fromConfig(config));
    }

    public ReorderResult reorder(Path indexFile, List<String> itemIds, String targetId,
                                 DropPosition position, ReorderOptions options) {
        return reorderer.reorder(indexFile, itemIds, targetId, position, options);
    }

    public List<String> childTypes(Path document) {
        return exploder.childTypes(document);
    }
}
