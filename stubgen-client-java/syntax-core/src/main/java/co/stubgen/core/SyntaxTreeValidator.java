package co.stubgen.core;

import co.stubgen.core.model.Expression;
import co.stubgen.core.model.Expression.CallExpr;
import co.stubgen.core.model.Expression.ComparisonExpr;
import co.stubgen.core.model.Expression.IndexExpr;
import co.stubgen.core.model.Expression.ListExpr;
import co.stubgen.core.model.Expression.MemberExpr;
import co.stubgen.core.model.Expression.NameExpr;
import co.stubgen.core.model.Expression.TupleExpr;
import co.stubgen.core.model.Expression.UnaryExpr;
import co.stubgen.core.model.ModuleNode;
import co.stubgen.core.model.Parameter;
import co.stubgen.core.model.Statement;
import co.stubgen.core.model.Statement.Assignment;
import co.stubgen.core.model.Statement.ClassDef;
import co.stubgen.core.model.Statement.Decorated;
import co.stubgen.core.model.Statement.ForStatement;
import co.stubgen.core.model.Statement.FunctionDef;
import co.stubgen.core.model.Statement.IfStatement;
import co.stubgen.core.model.Statement.ImportAll;
import co.stubgen.core.model.Statement.TryStatement;
import co.stubgen.core.model.Statement.WhileStatement;
import co.stubgen.core.model.Statement.WithStatement;

import java.util.List;

/**
 * Rejects trees whose shape breaks the positional assumptions stub generation makes
 * (first assignment target, first {@code if} condition, first two comparison operands).
 */
public final class SyntaxTreeValidator {

  private SyntaxTreeValidator() {}

  public static void validate(ModuleNode module) {
    if (module == null) fail("module required");
    block(module.body(), "module");
  }

  private static void block(List<Statement> statements, String where) {
    for (int i = 0; i < statements.size(); i++) {
      statement(statements.get(i), where + "[" + i + "]");
    }
  }

  private static void statement(Statement s, String where) {
    if (s == null) fail(where + ": statement required");

    if (s instanceof FunctionDef f) {
      function(f, where);
    } else if (s instanceof ClassDef c) {
      if (isBlank(c.name())) fail(where + ": class name required");
      where = where + " (class " + c.name() + ")";
      for (Expression base : c.bases()) expression(base, where + ".bases");
      block(c.body(), where);
    } else if (s instanceof Decorated d) {
      if (!(d.declaration() instanceof FunctionDef) && !(d.declaration() instanceof ClassDef)) {
        fail(where + ": decorators must wrap a function or class");
      }
      for (Expression decorator : d.decorators()) expression(decorator, where + ".decorators");
      statement(d.declaration(), where);
    } else if (s instanceof Assignment a) {
      if (a.targets().isEmpty()) fail(where + ": assignment has no targets");
      for (Expression target : a.targets()) expression(target, where + ".targets");
      expression(a.value(), where + ".value");
    } else if (s instanceof IfStatement i) {
      if (i.branches().isEmpty()) fail(where + ": if statement has no branches");
      for (int b = 0; b < i.branches().size(); b++) {
        IfStatement.Branch branch = i.branches().get(b);
        if (branch.condition() == null) fail(where + ".branches[" + b + "]: condition required");
        expression(branch.condition(), where + ".branches[" + b + "]");
        block(branch.body(), where + ".branches[" + b + "]");
      }
      block(i.elseBody(), where + ".else");
    } else if (s instanceof ForStatement f) {
      block(f.body(), where + ".for");
      block(f.elseBody(), where + ".else");
    } else if (s instanceof WhileStatement w) {
      block(w.body(), where + ".while");
      block(w.elseBody(), where + ".else");
    } else if (s instanceof WithStatement w) {
      block(w.body(), where + ".with");
    } else if (s instanceof TryStatement t) {
      block(t.body(), where + ".try");
      for (int h = 0; h < t.handlers().size(); h++) {
        block(t.handlers().get(h).body(), where + ".handlers[" + h + "]");
      }
      block(t.elseBody(), where + ".else");
      block(t.finallyBody(), where + ".finally");
    } else if (s instanceof ImportAll i) {
      if (i.relative() < 0) fail(where + ": negative relative import level");
      if (i.relative() == 0 && isBlank(i.module())) fail(where + ": module required for absolute import");
    }
  }

  private static void function(FunctionDef f, String where) {
    if (isBlank(f.name())) fail(where + ": function name required");
    where = where + " (def " + f.name() + ")";
    for (Parameter p : f.parameters()) {
      if (p == null || isBlank(p.name())) fail(where + ": parameter name required");
      if (p.kind() == null) fail(where + "." + p.name() + ": parameter kind required");
      expression(p.defaultValue(), where + "." + p.name());
    }
    block(f.body(), where);
  }

  private static void expression(Expression e, String where) {
    if (e == null) return;

    if (e instanceof ComparisonExpr c) {
      if (c.operands().size() < 2) fail(where + ": comparison needs at least two operands");
      if (c.operators().size() != c.operands().size() - 1) {
        fail(where + ": comparison has " + c.operators().size() + " operators for "
            + c.operands().size() + " operands");
      }
      for (Expression operand : c.operands()) expression(operand, where);
    } else if (e instanceof UnaryExpr u) {
      if (u.operand() == null) fail(where + ": unary operand required");
      expression(u.operand(), where);
    } else if (e instanceof MemberExpr m) {
      if (m.expr() == null || isBlank(m.name())) fail(where + ": member access needs a target and a name");
      expression(m.expr(), where);
    } else if (e instanceof TupleExpr t) {
      for (Expression item : t.items()) expression(item, where);
    } else if (e instanceof ListExpr l) {
      for (Expression item : l.items()) expression(item, where);
    } else if (e instanceof CallExpr c) {
      expression(c.callee(), where);
      for (Expression argument : c.arguments()) expression(argument, where);
    } else if (e instanceof IndexExpr i) {
      expression(i.base(), where);
      expression(i.index(), where);
    } else if (e instanceof NameExpr n) {
      if (isBlank(n.name())) fail(where + ": name required");
    }
  }

  private static boolean isBlank(String s) { return s == null || s.isEmpty(); }
  private static void fail(String msg) { throw new IllegalArgumentException(msg); }
}
