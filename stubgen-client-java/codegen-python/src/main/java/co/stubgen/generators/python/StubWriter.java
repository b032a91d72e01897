package co.stubgen.generators.python;

import co.stubgen.core.SyntaxTreeLoader;
import co.stubgen.core.model.ModuleNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns one syntax tree file into one stub file.
 */
public class StubWriter {

    private static final String TREE_SUFFIX = ".json";
    private static final String SOURCE_SUFFIX = ".py";

    /**
     * Load the tree at {@code treeFile}, generate its stub and write it into {@code outDir}.
     *
     * @return the written stub file
     */
    public Path write(Path treeFile, Path outDir) throws IOException {
        ModuleNode module = SyntaxTreeLoader.load(treeFile);
        return write(module, treeFile, outDir);
    }

    public Path write(ModuleNode module, Path treeFile, Path outDir) throws IOException {
        String stub = new StubGenerator().generate(module);
        Files.createDirectories(outDir);
        Path target = outDir.resolve(stubFileName(module, treeFile));
        Files.writeString(target, stub, StandardCharsets.UTF_8);
        return target;
    }

    /**
     * Base name of the module's source file when the tree records one; otherwise the tree
     * file's own name with {@code .json} swapped for {@code .py}.
     */
    static String stubFileName(ModuleNode module, Path treeFile) {
        if (module.path() != null && !module.path().isEmpty()) {
            return Path.of(module.path()).getFileName().toString();
        }
        String name = treeFile.getFileName().toString();
        if (name.endsWith(TREE_SUFFIX)) {
            return name.substring(0, name.length() - TREE_SUFFIX.length()) + SOURCE_SUFFIX;
        }
        return name;
    }
}
