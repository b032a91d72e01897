package co.stubgen.generators.python;

import co.stubgen.core.model.ModuleNode;
import co.stubgen.core.model.Statement.TryStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static co.stubgen.generators.python.Nodes.*;
import static org.assertj.core.api.Assertions.*;

public class ClassNameCollectorTest {

    @Test
    void collectsClassesAtAnyDepth() {
        ModuleNode module = module(
            cls("Top", cls("Nested")),
            def("factory", List.of(), cls("LocalToFunction")),
            ifThen(name("DEBUG"), cls("Conditional")),
            new TryStatement(List.of(), List.of(new TryStatement.Handler(null, null, List.of(cls("Fallback")))),
                List.of(), List.of()),
            decorated(cls("Decorated"), name("dataclass")));

        assertThat(ClassNameCollector.collect(module))
            .containsExactlyInAnyOrder("Top", "Nested", "LocalToFunction", "Conditional", "Fallback", "Decorated");
    }

    @Test
    void includesPrivateClasses() {
        assertThat(ClassNameCollector.collect(module(cls("_Hidden")))).containsExactly("_Hidden");
    }

    @Test
    void returnsEmptySetForModuleWithoutClasses() {
        assertThat(ClassNameCollector.collect(module(def("f"), assign("x", 1)))).isEmpty();
    }
}
