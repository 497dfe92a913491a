package com.eyegaze.heatmapapi.models;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.eyegaze.heatmapapi.config.SecurityConfig;
import com.eyegaze.heatmapapi.render.DecodeFailureException;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ModelController.class)
@Import(SecurityConfig.class)
class ModelControllerTest {

  private static final String UPLOAD_BODY = """
      {"model_name": "home", "user_id": 4, "image_base64": "iVBORw0KGgo="}
      """;

  @Autowired
  private MockMvc mvc;

  @MockBean
  private ModelService service;

  @Test
  void uploadAnswersCreated() throws Exception {
    when(service.create(any(ModelUploadRequest.class)))
        .thenReturn(new ModelCreatedResponse("success", 12L, 64, 48));

    mvc.perform(post("/v1/models")
            .contentType(MediaType.APPLICATION_JSON)
            .content(UPLOAD_BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.model_id").value(12))
        .andExpect(jsonPath("$.width").value(64));
  }

  @Test
  void undecodableUploadIsABadRequest() throws Exception {
    when(service.create(any(ModelUploadRequest.class)))
        .thenThrow(new DecodeFailureException("Background image is not in a supported format."));

    mvc.perform(post("/v1/models")
            .contentType(MediaType.APPLICATION_JSON)
            .content(UPLOAD_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2003));
  }

  @Test
  void uploadNeedsAnImage() throws Exception {
    mvc.perform(post("/v1/models")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"model_name\": \"home\", \"user_id\": 4}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void listAndCheck() throws Exception {
    when(service.list()).thenReturn(List.of(
        new ModelSummary(12L, "home", 64, 48, 4L, Instant.parse("2024-05-01T10:15:30Z"))));
    when(service.exists("home")).thenReturn(false);

    mvc.perform(get("/v1/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].model_name").value("home"))
        .andExpect(jsonPath("$[0].user_id").value(4));
    mvc.perform(get("/v1/models/check").param("name", "home"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value(false));
  }

  @Test
  void unknownModelIsNotFound() throws Exception {
    when(service.file(99L)).thenThrow(new NoSuchElementException("Model not found: 99"));

    mvc.perform(get("/v1/models/99/file"))
        .andExpect(status().isNotFound());
  }

  @Test
  void fileIsServedAsPng() throws Exception {
    when(service.file(12L)).thenReturn(new byte[] {(byte) 0x89, 'P', 'N', 'G'});

    mvc.perform(get("/v1/models/12/file"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG));
  }

  @Test
  void deleteConfirms() throws Exception {
    mvc.perform(delete("/v1/models/12"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("deleted"));
    verify(service).delete(12L);
  }
}
