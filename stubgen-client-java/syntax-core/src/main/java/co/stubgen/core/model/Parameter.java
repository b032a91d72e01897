package co.stubgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A function parameter.
 *
 * @param name parameter name without any star prefix
 * @param defaultValue default value expression, or null when the parameter has none
 * @param kind binding kind
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Parameter(String name, Expression defaultValue, ParameterKind kind) {

  public static Parameter positional(String name) {
    return new Parameter(name, null, ParameterKind.POSITIONAL);
  }

  public static Parameter withDefault(String name, Expression defaultValue) {
    return new Parameter(name, defaultValue, ParameterKind.POSITIONAL);
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }
}
