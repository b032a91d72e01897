package co.stubgen.generators.python;

import java.util.Set;

/**
 * Decides which names stay out of generated stubs.
 *
 * <p>A leading underscore marks a name private unless the name is dunder-shaped
 * ({@code __init__}, {@code __eq__}). Module metadata dunders are private regardless.
 */
public final class NameClassifier {

    private static final Set<String> ALWAYS_PRIVATE = Set.of("__all__", "__author__", "__version__");

    private NameClassifier() {}

    public static boolean isPrivate(String name) {
        return name.startsWith("_") && (!name.endsWith("__") || ALWAYS_PRIVATE.contains(name));
    }
}
