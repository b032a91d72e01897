package co.stubgen.core;

import co.stubgen.core.model.Expression.IntLiteral;
import co.stubgen.core.model.Expression.NameExpr;
import co.stubgen.core.model.ModuleNode;
import co.stubgen.core.model.Statement;
import co.stubgen.core.model.Statement.Assignment;
import co.stubgen.core.model.Statement.ClassDef;
import co.stubgen.core.model.Statement.Decorated;
import co.stubgen.core.model.Statement.ForStatement;
import co.stubgen.core.model.Statement.FunctionDef;
import co.stubgen.core.model.Statement.IfStatement;
import co.stubgen.core.model.Statement.TryStatement;
import co.stubgen.core.model.Statement.WhileStatement;
import co.stubgen.core.model.Statement.WithStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class TreeTraverserTest {

  /** Records every assigned name in visiting order. */
  private static class AssignedNames extends TreeTraverser {
    final List<String> names = new ArrayList<>();

    @Override
    protected void visitAssignment(Assignment assignment) {
      names.add(((NameExpr) assignment.targets().get(0)).name());
    }
  }

  private static Assignment assign(String name) {
    return new Assignment(List.of(new NameExpr(name)), IntLiteral.of(0));
  }

  @Test
  void visitsEveryNestedBlockInDocumentOrder() {
    ModuleNode module = ModuleNode.of(
        assign("a"),
        new FunctionDef("f", List.of(), List.of(assign("b"))),
        new ClassDef("C", List.of(), List.of(assign("c"),
            new Decorated(List.of(), new FunctionDef("m", List.of(), List.of(assign("d")))))),
        new IfStatement(List.of(
            new IfStatement.Branch(new NameExpr("x"), List.of(assign("e"))),
            new IfStatement.Branch(new NameExpr("y"), List.of(assign("f")))),
            List.of(assign("g"))),
        new ForStatement(new NameExpr("i"), new NameExpr("items"), List.of(assign("h")), List.of(assign("i"))),
        new WhileStatement(new NameExpr("x"), List.of(assign("j")), List.of(assign("k"))),
        new WithStatement(List.of(new NameExpr("lock")), List.of(assign("l"))),
        new TryStatement(List.of(assign("m")),
            List.of(new TryStatement.Handler(null, null, List.of(assign("n")))),
            List.of(assign("o")), List.of(assign("p"))));

    AssignedNames traverser = new AssignedNames();
    traverser.visitModule(module);

    assertThat(traverser.names)
        .containsExactly("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l", "m", "n", "o", "p");
  }

  @Test
  void stopsWhereSubclassDoesNotCallSuper() {
    AssignedNames traverser = new AssignedNames() {
      @Override
      protected void visitFunctionDef(FunctionDef function) {
        // bodies skipped
      }
    };
    traverser.visitModule(ModuleNode.of(
        new FunctionDef("f", List.of(), List.of(assign("hidden"))),
        assign("visible")));

    assertThat(traverser.names).containsExactly("visible");
  }

  @Test
  void ignoresLeafStatements() {
    AssignedNames traverser = new AssignedNames();
    traverser.visitModule(ModuleNode.of(
        new Statement.Pass(),
        new Statement.Import(List.of("os")),
        new Statement.ImportFrom("os", 0, List.of("path")),
        new Statement.ExpressionStatement(new NameExpr("x")),
        new Statement.Return(null),
        new Statement.OpaqueStatement("Global")));

    assertThat(traverser.names).isEmpty();
  }
}
