package rtyaml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import rtyaml.writer.WriterSettings;

@Command(name = "rtyaml", versionProvider = Main.ManifestVersionProvider.class,
        description = "A comment-preserving YAML formatter", mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true, abbreviateSynopsis = true, descriptionHeading = "%n",
        parameterListHeading = "%nParameters:%n", optionListHeading = "%nOptions:%n")
public class Main implements Callable<Integer> {
    static final int EXIT_CHANGED = 1;

    static final int EXIT_PARSE_ERROR = 2;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Parameters(defaultValue = ".", paramLabel = "<files>",
            description = "List of files or directories to format [default: ${DEFAULT-VALUE}]")
    private Set<Path> paths;

    @Option(names = {"-H", "--hidden"}, defaultValue = "true",
            description = "Search hidden files and directories")
    private boolean ignoreHidden;

    @Option(names = "--exclude", paramLabel = "<pattern>",
            description = "List of patterns, used to omit files and/or directories from analysis")
    private Set<String> excludedPatterns;

    @Option(names = "--indentWidth", defaultValue = "2", paramLabel = "<width>",
            description = "[default: ${DEFAULT-VALUE}]")
    private int indentationWidth;

    @Option(names = "--write", description = "Rewrite files in place instead of printing them")
    private boolean write;

    @Option(names = "--check",
            description = "Print nothing and exit with status 1 if any file is not formatted")
    private boolean check;

    @Override
    public Integer call() throws IOException {
        var settings = WriterSettings.DEFAULT.withIndentWidth(indentationWidth);
        int status = 0;

        for (var file : collectFiles()) {
            var src = Files.readString(file, StandardCharsets.UTF_8);
            var doc = Yaml.parseDocument(src);

            if (!doc.getErrors().isEmpty()) {
                for (var error : doc.getErrors()) {
                    System.err.println(file + ": " + error);
                }

                status = EXIT_PARSE_ERROR;
                continue;
            }

            for (var warning : doc.getWarnings()) {
                log.warn("{}: {}", file, warning);
            }

            var formatted = Yaml.stringify(doc, settings);

            if (check) {
                if (!formatted.equals(src)) {
                    System.err.println(file + ": not formatted");
                    status = Math.max(status, EXIT_CHANGED);
                }
            } else if (write) {
                if (!formatted.equals(src)) {
                    log.debug("Rewriting {}", file);
                    Files.writeString(file, formatted, StandardCharsets.UTF_8);
                }
            } else {
                System.out.print(formatted);
            }
        }

        return status;
    }

    private Set<Path> collectFiles() throws IOException {
        Set<Path> files = new TreeSet<>();
        var excludedMatcher = Optional.ofNullable(excludedPatterns).map(patterns -> FileSystems
                .getDefault().getPathMatcher("glob:{" + String.join(",", patterns) + "}"));

        for (var path : paths) {
            Files.walkFileTree(path.normalize(), new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                        throws IOException {
                    if (ignoreHidden && !dir.equals(path.normalize()) && Files.isHidden(dir)
                            || excludedMatcher.map(matcher -> matcher.matches(dir)).orElse(false)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }

                    return super.preVisitDirectory(dir, attrs);
                };

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                        throws IOException {
                    if (attrs.isRegularFile() && isYaml(file)
                            && !(ignoreHidden && Files.isHidden(file)) && !excludedMatcher
                                    .map(matcher -> matcher.matches(file)).orElse(false)) {
                        files.add(file);
                    }

                    return super.visitFile(file, attrs);
                };
            });
        }

        log.debug("Found {} YAML files", files.size());

        return files;
    }

    private static boolean isYaml(Path file) {
        var name = file.getFileName().toString();

        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    static class ManifestVersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            var version = getClass().getPackage().getImplementationVersion();

            return new String[] {"${ROOT-COMMAND-NAME} " + version};
        }
    }
}
