package de.example.py2cs.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "py2cs.max-modules=1")
@AutoConfigureMockMvc
class BatchLimitTest {

  @Autowired
  private MockMvc mvc;

  @Test
  void oversizedBatchIsRejected() throws Exception {
    String module = "{\"name\":\"m\",\"statements\":[]}";
    mvc.perform(post("/api/translate/batch").contentType(MediaType.APPLICATION_JSON)
            .content("[" + module + "," + module + "]"))
        .andExpect(status().isPayloadTooLarge());
  }

  @Test
  void batchWithinTheLimitIsAccepted() throws Exception {
    mvc.perform(post("/api/translate/batch").contentType(MediaType.APPLICATION_JSON)
            .content("[{\"name\":\"m\",\"statements\":[]}]"))
        .andExpect(status().isOk());
  }
}
