package com.eyegaze.heatmapapi.models;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/models")
@Validated
@Tag(name = "Models")
public class ModelController {

  private final ModelService svc;

  public ModelController(ModelService svc) {
    this.svc = svc;
  }

  @PostMapping
  @Operation(summary = "Upload a reference image",
      description = "Stores the image as PNG so heatmaps can be rendered over it by model_id.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Stored",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ModelCreatedResponse.class))),
      @ApiResponse(responseCode = "400", description = "Not a readable image",
          content = @Content(mediaType = "application/json"))
  })
  public ResponseEntity<ModelCreatedResponse> create(@Valid @RequestBody ModelUploadRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(svc.create(request));
  }

  @GetMapping
  @Operation(summary = "List reference images", description = "Newest first.")
  public List<ModelSummary> list() {
    return svc.list();
  }

  @GetMapping("/check")
  @Operation(summary = "Check a model name", description = "Whether a model with this name exists.")
  public Map<String, Boolean> check(@RequestParam @NotBlank String name) {
    return Map.of("status", svc.exists(name));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get model metadata")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Metadata",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ModelSummary.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ModelSummary get(@PathVariable @Positive long id) {
    return svc.get(id);
  }

  @GetMapping(value = "/{id}/file", produces = MediaType.IMAGE_PNG_VALUE)
  @Operation(summary = "Download the stored reference image")
  public ResponseEntity<byte[]> file(@PathVariable @Positive long id) {
    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .body(svc.file(id));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a reference image", description = "Removes the stored file and its record.")
  public Map<String, String> delete(@PathVariable @Positive long id) {
    svc.delete(id);
    return Map.of("status", "deleted");
  }
}
