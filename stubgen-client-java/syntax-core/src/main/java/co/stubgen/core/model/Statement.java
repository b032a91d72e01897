package co.stubgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Statement shapes the parser emits.
 *
 * <p>Every block-valued component (bodies, branches, handlers) is normalized to an
 * immutable list, empty when the JSON omits it.
 *
 * <p>JSON form: {@code {"node": "<simple type name>", ...components}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Statement.FunctionDef.class, name = "FunctionDef"),
    @JsonSubTypes.Type(value = Statement.ClassDef.class, name = "ClassDef"),
    @JsonSubTypes.Type(value = Statement.Decorated.class, name = "Decorated"),
    @JsonSubTypes.Type(value = Statement.Assignment.class, name = "Assignment"),
    @JsonSubTypes.Type(value = Statement.IfStatement.class, name = "IfStatement"),
    @JsonSubTypes.Type(value = Statement.ForStatement.class, name = "ForStatement"),
    @JsonSubTypes.Type(value = Statement.WhileStatement.class, name = "WhileStatement"),
    @JsonSubTypes.Type(value = Statement.WithStatement.class, name = "WithStatement"),
    @JsonSubTypes.Type(value = Statement.TryStatement.class, name = "TryStatement"),
    @JsonSubTypes.Type(value = Statement.ImportAll.class, name = "ImportAll"),
    @JsonSubTypes.Type(value = Statement.Import.class, name = "Import"),
    @JsonSubTypes.Type(value = Statement.ImportFrom.class, name = "ImportFrom"),
    @JsonSubTypes.Type(value = Statement.ExpressionStatement.class, name = "ExpressionStatement"),
    @JsonSubTypes.Type(value = Statement.Return.class, name = "Return"),
    @JsonSubTypes.Type(value = Statement.Pass.class, name = "Pass"),
    @JsonSubTypes.Type(value = Statement.OpaqueStatement.class, name = "OpaqueStatement")
})
public sealed interface Statement {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record FunctionDef(String name, List<Parameter> parameters, List<Statement> body) implements Statement {
    public FunctionDef {
      parameters = parameters != null ? List.copyOf(parameters) : List.of();
      body = body != null ? List.copyOf(body) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ClassDef(String name, List<Expression> bases, List<Statement> body) implements Statement {
    public ClassDef {
      bases = bases != null ? List.copyOf(bases) : List.of();
      body = body != null ? List.copyOf(body) : List.of();
    }
  }

  /** A function or class definition with the decorator expressions written above it. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Decorated(List<Expression> decorators, Statement declaration) implements Statement {
    public Decorated {
      decorators = decorators != null ? List.copyOf(decorators) : List.of();
    }
  }

  /**
   * {@code t1 = t2 = ... = value}; {@code targets} holds one entry per {@code =}.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Assignment(List<Expression> targets, Expression value) implements Statement {
    public Assignment {
      targets = targets != null ? List.copyOf(targets) : List.of();
    }
  }

  /** {@code if}/{@code elif} chain; the first branch is the {@code if}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record IfStatement(List<Branch> branches, List<Statement> elseBody) implements Statement {
    public IfStatement {
      branches = branches != null ? List.copyOf(branches) : List.of();
      elseBody = elseBody != null ? List.copyOf(elseBody) : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Branch(Expression condition, List<Statement> body) {
      public Branch {
        body = body != null ? List.copyOf(body) : List.of();
      }
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ForStatement(Expression target, Expression iterable, List<Statement> body, List<Statement> elseBody)
      implements Statement {
    public ForStatement {
      body = body != null ? List.copyOf(body) : List.of();
      elseBody = elseBody != null ? List.copyOf(elseBody) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WhileStatement(Expression condition, List<Statement> body, List<Statement> elseBody) implements Statement {
    public WhileStatement {
      body = body != null ? List.copyOf(body) : List.of();
      elseBody = elseBody != null ? List.copyOf(elseBody) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WithStatement(List<Expression> items, List<Statement> body) implements Statement {
    public WithStatement {
      items = items != null ? List.copyOf(items) : List.of();
      body = body != null ? List.copyOf(body) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TryStatement(List<Statement> body, List<Handler> handlers, List<Statement> elseBody,
                      List<Statement> finallyBody) implements Statement {
    public TryStatement {
      body = body != null ? List.copyOf(body) : List.of();
      handlers = handlers != null ? List.copyOf(handlers) : List.of();
      elseBody = elseBody != null ? List.copyOf(elseBody) : List.of();
      finallyBody = finallyBody != null ? List.copyOf(finallyBody) : List.of();
    }

    /** {@code except type as name:}; type and name are null for a bare {@code except:}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Handler(Expression type, String name, List<Statement> body) {
      public Handler {
        body = body != null ? List.copyOf(body) : List.of();
      }
    }
  }

  /**
   * {@code from module import *}. {@code relative} counts the leading dots of a relative
   * import; {@code module} may be null for {@code from . import *}.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record ImportAll(String module, int relative) implements Statement {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Import(@JsonProperty("modules") List<String> modules) implements Statement {
    public Import {
      modules = modules != null ? List.copyOf(modules) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ImportFrom(String module, int relative, List<String> names) implements Statement {
    public ImportFrom {
      names = names != null ? List.copyOf(names) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ExpressionStatement(@JsonProperty("expression") Expression expression) implements Statement {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Return(@JsonProperty("value") Expression value) implements Statement {}

  record Pass() implements Statement {}

  /** Any statement shape without nested blocks the generator cares about. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record OpaqueStatement(@JsonProperty("kind") String kind) implements Statement {}
}
