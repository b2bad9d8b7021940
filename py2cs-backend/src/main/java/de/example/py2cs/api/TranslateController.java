package de.example.py2cs.api;

import com.fasterxml.jackson.databind.JsonNode;
import de.example.py2cs.PythonToCSharpTranslator;
import de.example.py2cs.TranslationResult;
import de.example.py2cs.config.TranslatorProperties;
import de.example.py2cs.syntax.Module;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api")
public class TranslateController {

  private final PythonToCSharpTranslator translator;
  private final SyntaxTreeReader reader;
  private final TranslatorProperties properties;

  public TranslateController(PythonToCSharpTranslator translator, SyntaxTreeReader reader, TranslatorProperties properties) {
    this.translator = translator;
    this.reader = reader;
    this.properties = properties;
  }

  @PostMapping(value = {"/translate", "/translate/"}, consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> translate(
      @RequestParam(name = "namespace", required = false) String namespace,
      @RequestBody Module module
  ) {
    return ResponseEntity.ok(translator.translate(module, namespace));
  }

  @PostMapping(value = "/translate/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
  public List<TranslationResult> translateBatch(
      @RequestParam(name = "namespace", required = false) String namespace,
      @RequestBody List<JsonNode> modules
  ) {
    if (modules.size() > properties.maxModules()) {
      throw new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
          "At most " + properties.maxModules() + " modules per request.");
    }
    return translator.translateAll(modules, namespace, reader::read, reader::nameOf);
  }
}
