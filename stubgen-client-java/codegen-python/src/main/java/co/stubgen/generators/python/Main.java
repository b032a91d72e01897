package co.stubgen.generators.python;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entry point for the stub generator.
 *
 * Usage:
 *   java -jar codegen-python.jar [--output <dir>] <tree.json> [<tree.json> ...]
 *
 * Each argument is a syntax tree written by the parser. Stubs land in the output
 * directory (default: the working directory) under the source module's file name.
 */
public class Main {

    private static final String USAGE =
        "Usage: java -jar codegen-python.jar [--output <dir>] <tree.json> [<tree.json> ...]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Generate stubs for every tree named in {@code args}.
     *
     * @return process exit code: 0 when every file succeeded, 1 otherwise
     */
    static int run(String[] args) {
        String outputDir = ".";
        List<Path> trees = new ArrayList<>();

        // Parse arguments
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                    if (i + 1 >= args.length) {
                        System.err.println(USAGE);
                        return 1;
                    }
                    outputDir = args[++i];
                    break;
                default:
                    trees.add(Paths.get(args[i]));
                    break;
            }
        }

        if (trees.isEmpty()) {
            System.err.println(USAGE);
            return 1;
        }

        StubWriter writer = new StubWriter();
        Path outDir = Paths.get(outputDir);
        int failures = 0;
        for (Path tree : trees) {
            try {
                Path written = writer.write(tree, outDir);
                System.out.println("  - " + tree + " -> " + written);
            } catch (Exception e) {
                failures++;
                System.err.println("Error: " + tree + ": " + e.getMessage());
            }
        }

        System.out.println("Generated " + (trees.size() - failures) + " of " + trees.size()
            + " stub(s) in " + outputDir);
        return failures == 0 ? 0 : 1;
    }
}
