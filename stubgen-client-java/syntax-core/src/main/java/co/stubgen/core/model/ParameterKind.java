package co.stubgen.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a parameter binds arguments.
 *
 * <pre>
 *   positional  → a, a=1
 *   star        → *args
 *   doubleStar  → **kwargs
 *   keywordOnly → parameters after a bare * or *args
 * </pre>
 */
public enum ParameterKind {
  @JsonProperty("positional") POSITIONAL,
  @JsonProperty("star") STAR,
  @JsonProperty("doubleStar") DOUBLE_STAR,
  @JsonProperty("keywordOnly") KEYWORD_ONLY
}
