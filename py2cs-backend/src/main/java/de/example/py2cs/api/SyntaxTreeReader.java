package de.example.py2cs.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.example.py2cs.PythonToCSharpTranslator;
import de.example.py2cs.UnsupportedConstructException;
import de.example.py2cs.syntax.Module;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Component;

/**
 * Decodes one module of a batch request. Decoding per module lets a malformed
 * tree fail on its own instead of rejecting the whole request.
 */
@Component
public class SyntaxTreeReader {

  private final ObjectMapper mapper;

  public SyntaxTreeReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public Module read(JsonNode tree) {
    Module module;
    try {
      module = mapper.treeToValue(tree, Module.class);
    } catch (JsonProcessingException e) {
      if (NestedExceptionUtils.getMostSpecificCause(e) instanceof UnsupportedConstructException u) throw u;
      throw new UnsupportedConstructException("malformed syntax tree", e.getOriginalMessage());
    }
    if (module == null) throw new UnsupportedConstructException("malformed syntax tree", "missing module");
    return module;
  }

  public String nameOf(JsonNode tree) {
    JsonNode name = tree == null ? null : tree.get("name");
    return PythonToCSharpTranslator.moduleName(name != null && name.isTextual() ? name.asText() : null);
  }
}
