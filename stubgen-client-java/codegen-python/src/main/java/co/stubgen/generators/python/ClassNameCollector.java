package co.stubgen.generators.python;

import co.stubgen.core.TreeTraverser;
import co.stubgen.core.model.ModuleNode;
import co.stubgen.core.model.Statement.ClassDef;

import java.util.HashSet;
import java.util.Set;

/**
 * Collects the name of every class defined anywhere in a module, including classes
 * nested in other classes, functions or conditional blocks.
 */
final class ClassNameCollector extends TreeTraverser {

    private final Set<String> names = new HashSet<>();

    static Set<String> collect(ModuleNode module) {
        ClassNameCollector collector = new ClassNameCollector();
        collector.visitModule(module);
        return collector.names;
    }

    @Override
    protected void visitClassDef(ClassDef cls) {
        names.add(cls.name());
        super.visitClassDef(cls);
    }
}
