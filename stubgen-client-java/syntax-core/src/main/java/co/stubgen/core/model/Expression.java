package co.stubgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigInteger;
import java.util.List;

/**
 * Expression shapes the parser emits.
 *
 * <p>Only a handful of shapes carry meaning for stub generation (literals used as
 * parameter defaults, names and member accesses in decorators, base lists and
 * assignment targets, and the comparison guarding a script entry point). Everything
 * else arrives as a {@link CallExpr}, {@link IndexExpr} or {@link OpaqueExpr}.
 *
 * <p>JSON form: {@code {"node": "<simple type name>", ...components}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Expression.IntLiteral.class, name = "IntLiteral"),
    @JsonSubTypes.Type(value = Expression.StrLiteral.class, name = "StrLiteral"),
    @JsonSubTypes.Type(value = Expression.BytesLiteral.class, name = "BytesLiteral"),
    @JsonSubTypes.Type(value = Expression.FloatLiteral.class, name = "FloatLiteral"),
    @JsonSubTypes.Type(value = Expression.UnaryExpr.class, name = "UnaryExpr"),
    @JsonSubTypes.Type(value = Expression.NameExpr.class, name = "NameExpr"),
    @JsonSubTypes.Type(value = Expression.MemberExpr.class, name = "MemberExpr"),
    @JsonSubTypes.Type(value = Expression.TupleExpr.class, name = "TupleExpr"),
    @JsonSubTypes.Type(value = Expression.ListExpr.class, name = "ListExpr"),
    @JsonSubTypes.Type(value = Expression.ComparisonExpr.class, name = "ComparisonExpr"),
    @JsonSubTypes.Type(value = Expression.CallExpr.class, name = "CallExpr"),
    @JsonSubTypes.Type(value = Expression.IndexExpr.class, name = "IndexExpr"),
    @JsonSubTypes.Type(value = Expression.OpaqueExpr.class, name = "OpaqueExpr")
})
public sealed interface Expression {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record IntLiteral(@JsonProperty("value") BigInteger value) implements Expression {
    public static IntLiteral of(long value) {
      return new IntLiteral(BigInteger.valueOf(value));
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record StrLiteral(@JsonProperty("value") String value) implements Expression {}

  /** Byte-string literal; {@code value} holds the decoded text of the literal body. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record BytesLiteral(@JsonProperty("value") String value) implements Expression {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record FloatLiteral(@JsonProperty("value") double value) implements Expression {}

  /** Prefix operator application, e.g. {@code -5} or {@code not x}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record UnaryExpr(String operator, Expression operand) implements Expression {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NameExpr(@JsonProperty("name") String name) implements Expression {}

  /** Attribute access {@code expr.name}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record MemberExpr(Expression expr, String name) implements Expression {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TupleExpr(@JsonProperty("items") List<Expression> items) implements Expression {
    public TupleExpr {
      items = items != null ? List.copyOf(items) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ListExpr(@JsonProperty("items") List<Expression> items) implements Expression {
    public ListExpr {
      items = items != null ? List.copyOf(items) : List.of();
    }
  }

  /**
   * Chained comparison {@code a < b < c}: operators hold one entry less than operands.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record ComparisonExpr(List<String> operators, List<Expression> operands) implements Expression {
    public ComparisonExpr {
      operators = operators != null ? List.copyOf(operators) : List.of();
      operands = operands != null ? List.copyOf(operands) : List.of();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CallExpr(Expression callee, List<Expression> arguments) implements Expression {
    public CallExpr {
      arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }
  }

  /** Subscript {@code base[index]}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record IndexExpr(Expression base, Expression index) implements Expression {}

  /** Any expression shape the generator never inspects; {@code kind} names it for diagnostics. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record OpaqueExpr(@JsonProperty("kind") String kind) implements Expression {}
}
