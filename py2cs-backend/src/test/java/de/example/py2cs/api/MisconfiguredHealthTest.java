package de.example.py2cs.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {"py2cs.default-namespace=not valid", "py2cs.indent-width=2"})
@AutoConfigureMockMvc
class MisconfiguredHealthTest {

  @Autowired
  private MockMvc mvc;

  @Test
  void unusableDefaultNamespaceIsReportedAsDegraded() throws Exception {
    mvc.perform(get("/api/health"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value("degraded"))
        .andExpect(jsonPath("$.defaultNamespace").value("not valid"))
        .andExpect(jsonPath("$.indentWidth").value(2));
  }
}
