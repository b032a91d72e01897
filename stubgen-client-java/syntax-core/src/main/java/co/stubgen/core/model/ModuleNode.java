package co.stubgen.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root of a parsed source module, as handed over by the parser.
 *
 * @param path source file the parser read; may be null when the tree was built in memory
 * @param body top-level statements in document order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModuleNode(String path, List<Statement> body) {
  public ModuleNode {
    body = body != null ? List.copyOf(body) : List.of();
  }

  public static ModuleNode of(Statement... body) {
    return new ModuleNode(null, List.of(body));
  }
}
