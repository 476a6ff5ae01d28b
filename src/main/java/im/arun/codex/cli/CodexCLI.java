package im.arun.codex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.codex.config.CodexConfig;
import im.arun.codex.config.ConfigLoader;
import im.arun.codex.error.CodexException;
import im.arun.codex.index.IndexResolution;
import im.arun.codex.io.CodexFormat;
import im.arun.codex.model.DropPosition;
import im.arun.codex.order.ReorderOptions;
import im.arun.codex.order.ReorderResult;
import im.arun.codex.service.CodexService;
import im.arun.codex.tree.ExplodeOptions;
import im.arun.codex.tree.ExplodeResult;
import im.arun.codex.tree.ImplodeOptions;
import im.arun.codex.tree.ImplodeResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the codex engine using Picocli.
 * Every subcommand prints its result object as JSON and exits with 1 when the
 * operation failed as a whole.
 */
@Command(
    name = "codex",
    description = "Explode, implode and resolve codex document trees",
    mixinStandardHelpOptions = true,
    version = "Codex Engine 1.0",
    subcommands = {
        CodexCLI.ExplodeCommand.class,
        CodexCLI.ImplodeCommand.class,
        CodexCLI.IndexCommand.class,
        CodexCLI.ReorderCommand.class,
        CodexCLI.TypesCommand.class
    }
)
public class CodexCLI implements Callable<Integer> {

    @Option(names = {"--config"}, description = "Path to a codex-config.yaml overriding the bundled defaults")
    private String configPath;

    @Option(names = {"--project-root"}, description = "Directory includes must stay inside")
    private String projectRoot;

    @Option(names = {"--no-containment"}, description = "Allow include targets outside the project root")
    private boolean noContainment;

    @Option(names = {"--journal-dir"}, description = "Write a JSON operation journal into this directory")
    private String journalDir;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    CodexService createService() {
        Map<String, Object> overrides = new HashMap<>();
        if (projectRoot != null) {
            overrides.put("projectRoot", projectRoot);
        }
        if (noContainment) {
            overrides.put("enforceContainment", false);
        }
        if (journalDir != null) {
            overrides.put("journalDir", journalDir);
        }
        CodexConfig config = new ConfigLoader(configPath).load(overrides);
        return new CodexService(config);
    }

    static int print(CommandSpec spec, Object result, boolean success) {
        PrintWriter out = spec.commandLine().getOut();
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        try {
            out.println(mapper.writeValueAsString(result));
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: could not render result: " + e.getMessage());
            return 1;
        }
        out.flush();
        return success ? 0 : 1;
    }

    static Path existingFile(CommandSpec spec, String file) {
        Path path = Paths.get(file);
        if (!Files.isRegularFile(path)) {
            spec.commandLine().getErr().println("Error: file not found: " + file);
            return null;
        }
        return path;
    }

    @Command(name = "explode", mixinStandardHelpOptions = true,
        description = "Extract direct children into standalone files and replace them with include stubs")
    static class ExplodeCommand implements Callable<Integer> {

        @ParentCommand
        private CodexCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Codex document to explode")
        private String file;

        @Option(names = {"-t", "--type"}, description = "Child type to extract (repeatable); all children when omitted")
        private List<String> types = new ArrayList<>();

        @Option(names = {"--pattern"}, description = "Output path pattern ({type}, {name}, {id}, {index})")
        private String pattern;

        @Option(names = {"--format"}, description = "Output format: yaml or json")
        private String format;

        @Option(names = {"--dry-run"}, description = "Report what would be extracted without writing")
        private boolean dryRun;

        @Option(names = {"--force"}, description = "Overwrite existing output files")
        private boolean force;

        @Option(names = {"--no-backup"}, description = "Do not write a .backup copy of the document")
        private boolean noBackup;

        @Override
        public Integer call() {
            Path document = existingFile(spec, file);
            if (document == null) {
                return 1;
            }
            CodexService service = parent.createService();
            ExplodeOptions options = service.explodeOptions();
            options.setTypes(types);
            options.setDryRun(dryRun);
            if (pattern != null) {
                options.setOutputPattern(pattern);
            }
            if (format != null) {
                try {
                    options.setFormat(CodexFormat.parse(format));
                } catch (IllegalArgumentException e) {
                    spec.commandLine().getErr().println("Error: " + e.getMessage());
                    return 1;
                }
            }
            if (force) {
                options.setForce(true);
            }
            if (noBackup) {
                options.setBackup(false);
            }

            ExplodeResult result = service.explode(document, options);
            return print(spec, result, result.isSuccess());
        }
    }

    @Command(name = "implode", mixinStandardHelpOptions = true,
        description = "Merge included files back into the document")
    static class ImplodeCommand implements Callable<Integer> {

        @ParentCommand
        private CodexCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Codex document to implode")
        private String file;

        @Option(names = {"--dry-run"}, description = "Report what would be merged without writing")
        private boolean dryRun;

        @Option(names = {"--delete-sources"}, description = "Delete merged files after the document is written")
        private boolean deleteSources;

        @Option(names = {"--delete-empty-folders"}, description = "Remove folders left empty by --delete-sources")
        private boolean deleteEmptyFolders;

        @Option(names = {"--no-recursive"}, description = "Only resolve includes among the direct children")
        private boolean noRecursive;

        @Option(names = {"--no-backup"}, description = "Do not write a .backup copy of the document")
        private boolean noBackup;

        @Override
        public Integer call() {
            Path document = existingFile(spec, file);
            if (document == null) {
                return 1;
            }
            CodexService service = parent.createService();
            ImplodeOptions options = service.implodeOptions();
            options.setDryRun(dryRun);
            if (deleteSources) {
                options.setDeleteSourceFiles(true);
            }
            if (deleteEmptyFolders) {
                options.setDeleteEmptyFolders(true);
            }
            if (noRecursive) {
                options.setRecursive(false);
            }
            if (noBackup) {
                options.setBackup(false);
            }

            ImplodeResult result = service.implode(document, options);
            return print(spec, result, result.isSuccess());
        }
    }

    @Command(name = "index", mixinStandardHelpOptions = true,
        description = "Resolve an index file and its sub-indexes into one tree")
    static class IndexCommand implements Callable<Integer> {

        @ParentCommand
        private CodexCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Root index file")
        private String file;

        @Option(names = {"--output"}, description = "Write the resolved tree to this JSON file")
        private String outputPath;

        @Override
        public Integer call() throws Exception {
            Path indexFile = existingFile(spec, file);
            if (indexFile == null) {
                return 1;
            }
            IndexResolution resolution = parent.createService().resolveIndex(indexFile);
            if (outputPath != null && resolution.isSuccess()) {
                ObjectMapper mapper = new ObjectMapper();
                mapper.enable(SerializationFeature.INDENT_OUTPUT);
                Files.writeString(Paths.get(outputPath), mapper.writeValueAsString(resolution.getDocument()));
                spec.commandLine().getOut().println("Output written to: " + outputPath);
            }
            return print(spec, resolution, resolution.isSuccess());
        }
    }

    @Command(name = "reorder", mixinStandardHelpOptions = true,
        description = "Move index nodes before, after or inside a target node")
    static class ReorderCommand implements Callable<Integer> {

        @ParentCommand
        private CodexCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Index file")
        private String file;

        @Option(names = {"--item"}, required = true, description = "Id of a node to move (repeatable, in order)")
        private List<String> itemIds;

        @Option(names = {"--target"}, required = true, description = "Id of the drop target")
        private String targetId;

        @Option(names = {"--position"}, defaultValue = "after", description = "before, after or inside")
        private String position;

        @Option(names = {"--dry-run"}, description = "Compute new orders without writing")
        private boolean dryRun;

        @Option(names = {"--no-backup"}, description = "Do not write a .backup copy of the index")
        private boolean noBackup;

        @Override
        public Integer call() {
            Path indexFile = existingFile(spec, file);
            if (indexFile == null) {
                return 1;
            }
            DropPosition dropPosition;
            try {
                dropPosition = DropPosition.parse(position);
            } catch (IllegalArgumentException e) {
                spec.commandLine().getErr().println("Error: invalid position '" + position + "'");
                return 1;
            }

            CodexService service = parent.createService();
            ReorderOptions options = ReorderOptions.fromConfig(service.getConfig());
            options.setDryRun(dryRun);
            if (noBackup) {
                options.setBackup(false);
            }
            ReorderResult result = service.reorder(indexFile, itemIds, targetId, dropPosition, options);
            return print(spec, result, result.isSuccess());
        }
    }

    @Command(name = "types", mixinStandardHelpOptions = true,
        description = "List the types of a document's direct children")
    static class TypesCommand implements Callable<Integer> {

        @ParentCommand
        private CodexCLI parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Codex document")
        private String file;

        @Override
        public Integer call() {
            Path document = existingFile(spec, file);
            if (document == null) {
                return 1;
            }
            try {
                List<String> types = parent.createService().childTypes(document);
                types.forEach(spec.commandLine().getOut()::println);
                spec.commandLine().getOut().flush();
                return 0;
            } catch (CodexException e) {
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodexCLI()).execute(args);
        System.exit(exitCode);
    }
}
