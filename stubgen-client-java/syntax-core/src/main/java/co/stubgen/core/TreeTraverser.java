package co.stubgen.core;

import co.stubgen.core.model.ModuleNode;
import co.stubgen.core.model.Statement;
import co.stubgen.core.model.Statement.Assignment;
import co.stubgen.core.model.Statement.ClassDef;
import co.stubgen.core.model.Statement.Decorated;
import co.stubgen.core.model.Statement.ExpressionStatement;
import co.stubgen.core.model.Statement.ForStatement;
import co.stubgen.core.model.Statement.FunctionDef;
import co.stubgen.core.model.Statement.IfStatement;
import co.stubgen.core.model.Statement.Import;
import co.stubgen.core.model.Statement.ImportAll;
import co.stubgen.core.model.Statement.ImportFrom;
import co.stubgen.core.model.Statement.OpaqueStatement;
import co.stubgen.core.model.Statement.Pass;
import co.stubgen.core.model.Statement.Return;
import co.stubgen.core.model.Statement.TryStatement;
import co.stubgen.core.model.Statement.WhileStatement;
import co.stubgen.core.model.Statement.WithStatement;

import java.util.List;

/**
 * Walks a syntax tree statement by statement.
 *
 * <p>Each {@code visitXxx} method by default descends into every nested block of its
 * statement in document order; leaf statements do nothing. Subclasses override the
 * shapes they care about and call {@code super} to keep descending.
 */
public abstract class TreeTraverser {

  public void visitModule(ModuleNode module) {
    visitBlock(module.body());
  }

  protected final void visitBlock(List<Statement> block) {
    for (Statement statement : block) {
      visit(statement);
    }
  }

  protected final void visit(Statement statement) {
    if (statement instanceof FunctionDef f) {
      visitFunctionDef(f);
    } else if (statement instanceof ClassDef c) {
      visitClassDef(c);
    } else if (statement instanceof Decorated d) {
      visitDecorated(d);
    } else if (statement instanceof Assignment a) {
      visitAssignment(a);
    } else if (statement instanceof IfStatement i) {
      visitIf(i);
    } else if (statement instanceof ForStatement f) {
      visitFor(f);
    } else if (statement instanceof WhileStatement w) {
      visitWhile(w);
    } else if (statement instanceof WithStatement w) {
      visitWith(w);
    } else if (statement instanceof TryStatement t) {
      visitTry(t);
    } else if (statement instanceof ImportAll i) {
      visitImportAll(i);
    } else if (statement instanceof Import
        || statement instanceof ImportFrom
        || statement instanceof ExpressionStatement
        || statement instanceof Return
        || statement instanceof Pass
        || statement instanceof OpaqueStatement) {
      visitLeaf(statement);
    } else {
      throw new IllegalStateException("Unhandled statement " + statement);
    }
  }

  protected void visitFunctionDef(FunctionDef function) {
    visitBlock(function.body());
  }

  protected void visitClassDef(ClassDef cls) {
    visitBlock(cls.body());
  }

  protected void visitDecorated(Decorated decorated) {
    visit(decorated.declaration());
  }

  protected void visitAssignment(Assignment assignment) {
  }

  protected void visitIf(IfStatement ifStatement) {
    for (IfStatement.Branch branch : ifStatement.branches()) {
      visitBlock(branch.body());
    }
    visitBlock(ifStatement.elseBody());
  }

  protected void visitFor(ForStatement forStatement) {
    visitBlock(forStatement.body());
    visitBlock(forStatement.elseBody());
  }

  protected void visitWhile(WhileStatement whileStatement) {
    visitBlock(whileStatement.body());
    visitBlock(whileStatement.elseBody());
  }

  protected void visitWith(WithStatement withStatement) {
    visitBlock(withStatement.body());
  }

  protected void visitTry(TryStatement tryStatement) {
    visitBlock(tryStatement.body());
    for (TryStatement.Handler handler : tryStatement.handlers()) {
      visitBlock(handler.body());
    }
    visitBlock(tryStatement.elseBody());
    visitBlock(tryStatement.finallyBody());
  }

  protected void visitImportAll(ImportAll importAll) {
  }

  /** Statements without nested blocks: imports, expressions, returns, pass. */
  protected void visitLeaf(Statement statement) {
  }
}
