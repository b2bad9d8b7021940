package de.example.py2cs.api;

import de.example.py2cs.config.TranslatorProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

  private final TranslatorProperties properties;

  public CorsConfig(TranslatorProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/api/**")
      .allowedOriginPatterns(properties.cors().allowedOriginPatterns().toArray(String[]::new))
      .allowedMethods("GET", "POST", "OPTIONS")
      .allowedHeaders("*")
      .maxAge(3600);
  }
}
