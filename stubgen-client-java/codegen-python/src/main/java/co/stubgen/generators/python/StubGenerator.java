package co.stubgen.generators.python;

import co.stubgen.core.TreeTraverser;
import co.stubgen.core.model.Expression;
import co.stubgen.core.model.Expression.ComparisonExpr;
import co.stubgen.core.model.Expression.ListExpr;
import co.stubgen.core.model.Expression.MemberExpr;
import co.stubgen.core.model.Expression.NameExpr;
import co.stubgen.core.model.Expression.StrLiteral;
import co.stubgen.core.model.Expression.TupleExpr;
import co.stubgen.core.model.ModuleNode;
import co.stubgen.core.model.Parameter;
import co.stubgen.core.model.ParameterKind;
import co.stubgen.core.model.Statement.Assignment;
import co.stubgen.core.model.Statement.ClassDef;
import co.stubgen.core.model.Statement.Decorated;
import co.stubgen.core.model.Statement.FunctionDef;
import co.stubgen.core.model.Statement.IfStatement;
import co.stubgen.core.model.Statement.ImportAll;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Generates a dynamically typed stub for one parsed module.
 *
 * <p>The stub keeps the public shape of the module and drops everything else:
 * <ul>
 *   <li>functions and methods become one-line signatures ending in {@code : pass},
 *       with parameter defaults reduced to literals of the same kind</li>
 *   <li>classes keep their header; the base list keeps only classes defined in the same
 *       module and names that look like exceptions</li>
 *   <li>module and class variables, and attributes a method assigns through {@code self},
 *       become {@code name = Undefined(Any)}</li>
 *   <li>{@code property}, {@code staticmethod}, {@code classmethod} and
 *       {@code @x.setter} decorators survive; others are dropped</li>
 *   <li>{@code from m import *} lines are repeated in the import header</li>
 *   <li>the {@code if __name__ == '__main__':} block disappears</li>
 * </ul>
 * Private names (see {@link NameClassifier}) are left out everywhere.
 *
 * <p>Blank lines follow a fixed grouping: consecutive functions, consecutive variables
 * and consecutive one-line classes stay together, and a blank line separates a
 * top-level declaration from a preceding one of another kind.
 *
 * <p>An instance holds the state of a single run and is discarded afterwards.
 */
public class StubGenerator extends TreeTraverser {

    private static final Logger log = LoggerFactory.getLogger(StubGenerator.class);

    static final String INDENT_UNIT = "    ";
    static final String UNDEFINED = "Undefined";
    static final String ANY = "Any";
    static final String PLACEHOLDER_VALUE = UNDEFINED + "(" + ANY + ")";

    private static final Set<String> KEPT_DECORATORS = Set.of("property", "staticmethod", "classmethod");

    private final OutputBuffer output = new OutputBuffer();
    private final DeclarationScopes scopes = new DeclarationScopes();
    private final List<String> pendingDecorators = new ArrayList<>();
    private Set<String> moduleClasses = Set.of();
    private String indent = "";
    private FormattingState state = FormattingState.EMPTY;
    private boolean used;

    /**
     * Generate the stub text for {@code module}.
     *
     * @throws IllegalStateException when this generator already produced a stub
     */
    public String generate(ModuleNode module) {
        if (used) {
            throw new IllegalStateException("StubGenerator instances generate exactly one stub");
        }
        used = true;
        visitModule(module);
        String stub = output.render();
        log.debug("Generated stub for {}: {} helper import(s), {} wildcard import(s), {} chars",
            module.path() != null ? module.path() : "<module>",
            output.helpers().size(), output.importLines().size(), stub.length());
        return stub;
    }

    @Override
    public void visitModule(ModuleNode module) {
        moduleClasses = ClassNameCollector.collect(module);
        super.visitModule(module);
    }

    // =========================================================================
    // Functions
    // =========================================================================

    @Override
    protected void visitFunctionDef(FunctionDef function) {
        if (NameClassifier.isPrivate(function.name())) {
            log.trace("Skipping private function {}", function.name());
            pendingDecorators.clear();
            return;
        }
        if (atTopLevel() && state != FormattingState.EMPTY && state != FormattingState.FUNCTION) {
            output.append("\n");
        }
        for (String attribute : ReceiverAttributeCollector.collect(function)) {
            declareVariable(attribute);
        }
        flushDecorators();
        output.append(indent + "def " + function.name() + "(");
        output.append(String.join(", ", renderParameters(function.parameters())));
        output.append("): pass\n");
        if (atTopLevel()) {
            state = FormattingState.FUNCTION;
        }
    }

    private List<String> renderParameters(List<Parameter> parameters) {
        List<String> rendered = new ArrayList<>();
        boolean starSeen = false;
        for (Parameter parameter : parameters) {
            String name = parameter.name();
            if (parameter.kind() == ParameterKind.KEYWORD_ONLY && !starSeen) {
                rendered.add("*");
                starSeen = true;
            }
            if (parameter.hasDefault()) {
                rendered.add(name + "=" + renderDefault(parameter.defaultValue()));
            } else if (parameter.kind() == ParameterKind.STAR) {
                rendered.add("*" + name);
                starSeen = true;
            } else if (parameter.kind() == ParameterKind.DOUBLE_STAR) {
                rendered.add("**" + name);
            } else {
                rendered.add(name);
            }
        }
        return rendered;
    }

    private String renderDefault(Expression value) {
        return DefaultValueRenderer.literalText(value).orElseGet(() -> {
            requirePlaceholderHelpers();
            return UNDEFINED;
        });
    }

    // =========================================================================
    // Decorators
    // =========================================================================

    @Override
    protected void visitDecorated(Decorated decorated) {
        for (Expression decorator : decorated.decorators()) {
            if (decorator instanceof NameExpr n && KEPT_DECORATORS.contains(n.name())) {
                pendingDecorators.add("@" + n.name());
            } else if (decorator instanceof MemberExpr m
                    && "setter".equals(m.name())
                    && m.expr() instanceof NameExpr target) {
                pendingDecorators.add("@" + target.name() + ".setter");
            }
        }
        super.visitDecorated(decorated);
    }

    private void flushDecorators() {
        for (String decorator : pendingDecorators) {
            output.append(indent + decorator + "\n");
        }
        pendingDecorators.clear();
    }

    // =========================================================================
    // Classes
    // =========================================================================

    @Override
    protected void visitClassDef(ClassDef cls) {
        int separator = -1;
        if (atTopLevel() && state != FormattingState.EMPTY) {
            separator = output.size();
            output.append("\n");
        }
        flushDecorators();
        output.append(indent + "class " + cls.name());
        List<String> bases = keptBases(cls.bases());
        if (!bases.isEmpty()) {
            output.append("(" + String.join(", ", bases) + ")");
        }
        output.append(":\n");

        boolean topLevel = atTopLevel();
        FormattingState before = state;
        int bodyStart = output.size();
        indent += INDENT_UNIT;
        scopes.enter();
        super.visitClassDef(cls);
        indent = indent.substring(0, indent.length() - INDENT_UNIT.length());
        scopes.exit();

        boolean empty = output.size() == bodyStart;
        if (empty) {
            if (separator >= 0 && before == FormattingState.EMPTY_CLASS) {
                output.overwrite(separator, "");
            }
            int header = output.size() - 1;
            String last = output.fragment(header);
            output.overwrite(header, last.substring(0, last.length() - 1) + " pass\n");
        }
        if (topLevel) {
            state = empty ? FormattingState.EMPTY_CLASS : FormattingState.CLASS;
        }
    }

    private List<String> keptBases(List<Expression> baseExpressions) {
        List<String> bases = new ArrayList<>();
        for (Expression base : baseExpressions) {
            if (base instanceof NameExpr n
                    && (moduleClasses.contains(n.name())
                        || n.name().endsWith("Exception")
                        || n.name().endsWith("Error"))) {
                bases.add(n.name());
            }
        }
        return bases;
    }

    // =========================================================================
    // Variables
    // =========================================================================

    @Override
    protected void visitAssignment(Assignment assignment) {
        Expression lvalue = assignment.targets().get(0);
        List<Expression> items;
        if (lvalue instanceof TupleExpr t) {
            items = t.items();
        } else if (lvalue instanceof ListExpr l) {
            items = l.items();
        } else {
            items = List.of(lvalue);
        }
        boolean separated = false;
        boolean found = false;
        for (Expression item : items) {
            if (item instanceof NameExpr n) {
                if (!separated && atTopLevel()
                        && state != FormattingState.EMPTY && state != FormattingState.VARIABLE) {
                    output.append("\n");
                    separated = true;
                }
                found = declareVariable(n.name()) || found;
            }
        }
        if (found && atTopLevel()) {
            state = FormattingState.VARIABLE;
        }
    }

    /**
     * Emit {@code name = Undefined(Any)} in the current scope unless the name is private
     * or already declared there.
     *
     * @return whether a declaration was emitted
     */
    private boolean declareVariable(String name) {
        if (NameClassifier.isPrivate(name) || !scopes.declare(name)) {
            return false;
        }
        output.append(indent + name + " = " + PLACEHOLDER_VALUE + "\n");
        requirePlaceholderHelpers();
        return true;
    }

    private void requirePlaceholderHelpers() {
        output.requireHelper(UNDEFINED);
        output.requireHelper(ANY);
    }

    // =========================================================================
    // Conditionals and imports
    // =========================================================================

    @Override
    protected void visitIf(IfStatement ifStatement) {
        if (isEntryPointGuard(ifStatement.branches().get(0).condition())) {
            log.trace("Skipping entry point block");
            return;
        }
        super.visitIf(ifStatement);
    }

    private static boolean isEntryPointGuard(Expression condition) {
        return condition instanceof ComparisonExpr c
            && "==".equals(c.operators().get(0))
            && c.operands().get(0) instanceof NameExpr n
            && "__name__".equals(n.name())
            && c.operands().get(1) instanceof StrLiteral s
            && s.value().contains("__main__");
    }

    @Override
    protected void visitImportAll(ImportAll importAll) {
        String module = ".".repeat(importAll.relative()) + (importAll.module() != null ? importAll.module() : "");
        output.addImportLine("from " + module + " import *\n");
    }

    private boolean atTopLevel() {
        return indent.isEmpty();
    }
}
