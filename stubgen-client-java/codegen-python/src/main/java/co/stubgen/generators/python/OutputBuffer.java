package co.stubgen.generators.python;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Text of a stub under construction: body fragments in emission order, helper names to
 * import from the typing module, and verbatim import lines.
 *
 * <p>Fragments are append-only except for {@link #overwrite}, which exists so an empty
 * class can be folded onto its header line after its body turned out to produce nothing.
 */
final class OutputBuffer {

    static final String HELPER_MODULE = "typing";

    private final List<String> fragments = new ArrayList<>();
    private final Set<String> helpers = new LinkedHashSet<>();
    private final List<String> importLines = new ArrayList<>();

    void append(String fragment) {
        fragments.add(fragment);
    }

    /** Number of fragments appended so far; also the index the next fragment will get. */
    int size() {
        return fragments.size();
    }

    String fragment(int index) {
        return fragments.get(index);
    }

    void overwrite(int index, String fragment) {
        fragments.set(index, fragment);
    }

    void requireHelper(String name) {
        helpers.add(name);
    }

    void addImportLine(String line) {
        importLines.add(line);
    }

    Set<String> helpers() {
        return Collections.unmodifiableSet(helpers);
    }

    List<String> importLines() {
        return Collections.unmodifiableList(importLines);
    }

    /**
     * Import header followed by all body fragments. The header imports the helpers in
     * first-use order, then repeats the recorded import lines, then leaves one blank line.
     */
    String render() {
        StringBuilder out = new StringBuilder();
        if (!helpers.isEmpty()) {
            out.append("from ").append(HELPER_MODULE).append(" import ")
                .append(String.join(", ", helpers)).append('\n');
        }
        for (String line : importLines) {
            out.append(line);
        }
        if (out.length() > 0) {
            out.append('\n');
        }
        for (String fragment : fragments) {
            out.append(fragment);
        }
        return out.toString();
    }
}
