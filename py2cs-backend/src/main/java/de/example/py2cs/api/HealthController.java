package de.example.py2cs.api;

import de.example.py2cs.PythonToCSharpTranslator;
import de.example.py2cs.TranslationException;
import de.example.py2cs.config.TranslatorProperties;
import de.example.py2cs.syntax.Module;
import de.example.py2cs.syntax.PassStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Liveness of the translation pipeline. Translates a one-statement module on
 * every call and reports the effective translator settings.
 */
@RestController
@RequestMapping("/api")
public class HealthController {
  private static final Logger log = LoggerFactory.getLogger(HealthController.class);

  static final Module SELF_CHECK = new Module("health", List.of(new PassStatement()));

  public record Health(String status, String defaultNamespace, int indentWidth, int maxModules) {
  }

  private final PythonToCSharpTranslator translator;
  private final TranslatorProperties properties;

  public HealthController(PythonToCSharpTranslator translator, TranslatorProperties properties) {
    this.translator = translator;
    this.properties = properties;
  }

  @GetMapping(value = {"/health", "/health/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Health> health() {
    String status = "ok";
    HttpStatus code = HttpStatus.OK;
    try {
      translator.translate(SELF_CHECK, properties.defaultNamespace());
    } catch (TranslationException | IllegalArgumentException e) {
      log.warn("Self-check translation failed: {}", e.getMessage());
      status = "degraded";
      code = HttpStatus.SERVICE_UNAVAILABLE;
    }
    return ResponseEntity.status(code)
        .body(new Health(status, properties.defaultNamespace(), properties.indentWidth(), properties.maxModules()));
  }
}
