package co.stubgen.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import co.stubgen.core.model.ModuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the JSON syntax tree the parser writes for one source module.
 */
public final class SyntaxTreeLoader {
  private static final Logger log = LoggerFactory.getLogger(SyntaxTreeLoader.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private SyntaxTreeLoader() {}

  public static ModuleNode load(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    log.debug("Loading syntax tree {} ({} bytes)", path, bytes.length);
    ModuleNode module = JSON.readValue(bytes, ModuleNode.class);
    SyntaxTreeValidator.validate(module);
    return module;
  }

  public static ModuleNode parse(String json) throws IOException {
    ModuleNode module = JSON.readValue(json, ModuleNode.class);
    SyntaxTreeValidator.validate(module);
    return module;
  }
}
