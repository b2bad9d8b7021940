package de.example.py2cs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "py2cs")
public record TranslatorProperties(
    @DefaultValue("Translated") String defaultNamespace,
    @DefaultValue("4") int indentWidth,
    @DefaultValue("50") int maxModules,
    @DefaultValue Cors cors
) {

  public record Cors(@DefaultValue({"http://localhost:5173", "http://127.0.0.1:5173"}) List<String> allowedOriginPatterns) {
  }

  /** The built-in defaults, for use outside a Spring context. */
  public static TranslatorProperties defaults() {
    return new TranslatorProperties("Translated", 4, 50,
        new Cors(List.of("http://localhost:5173", "http://127.0.0.1:5173")));
  }
}
