package com.eyegaze.heatmapapi.heatmaps;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/heatmaps")
@Validated
@Tag(name = "Heatmaps")
public class HeatmapController {
  private static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  private static final MediaType PNG_MEDIA_TYPE = MediaType.IMAGE_PNG;

  private final HeatmapService svc;

  public HeatmapController(HeatmapService svc) {
    this.svc = svc;
  }

  @PostMapping("/render")
  @Operation(summary = "Render a heatmap",
      description = "Render gaze points over an optional background and return the PNG as base64. Nothing is stored.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Rendered image",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = RenderResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid canvas or background",
          content = @Content(mediaType = "application/json"))
  })
  public RenderResponse render(@Valid @RequestBody RenderRequest request) {
    return svc.render(request);
  }

  @PostMapping
  @Operation(summary = "Render and store a heatmap",
      description = "Render gaze points, store the PNG and record it for the owning user.")
  @ApiResponses({
      @ApiResponse(responseCode = "201", description = "Stored",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = HeatmapCreatedResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid canvas or background",
          content = @Content(mediaType = "application/json"))
  })
  public ResponseEntity<HeatmapCreatedResponse> create(
      @Valid @RequestBody HeatmapUploadRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(svc.create(request));
  }

  @GetMapping
  @Operation(summary = "List a user's heatmaps", description = "Newest first, as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Heatmaps",
          content = {
              @Content(mediaType = "application/json"),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<HeatmapSummary>> list(
      @RequestParam(name = "user_id") @Positive @Parameter(description = "Owning user", example = "1") long userId,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    return ResponseEntity.ok()
        .contentType(contentType)
        .body(svc.listForUser(userId));
  }

  @GetMapping("/check")
  @Operation(summary = "Check a heatmap name", description = "Whether the user already has a heatmap with this name.")
  public Map<String, Boolean> check(
      @RequestParam(name = "user_id") @Positive long userId,
      @RequestParam @NotBlank String name) {
    return Map.of("status", svc.exists(userId, name));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get heatmap metadata")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Metadata",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = HeatmapDetails.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public HeatmapDetails get(@PathVariable @Positive long id) {
    return svc.get(id);
  }

  @GetMapping(value = "/{id}/file", produces = MediaType.IMAGE_PNG_VALUE)
  @Operation(summary = "Download the stored PNG")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "PNG image",
          content = @Content(mediaType = "image/png")),
      @ApiResponse(responseCode = "404", description = "Not found")
  })
  public ResponseEntity<byte[]> file(@PathVariable @Positive long id) {
    return ResponseEntity.ok()
        .contentType(PNG_MEDIA_TYPE)
        .body(svc.file(id));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a heatmap", description = "Removes the stored file and its record.")
  public Map<String, String> delete(@PathVariable @Positive long id) {
    svc.delete(id);
    return Map.of("status", "deleted");
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new IllegalArgumentException("Invalid format value. Supported values: json,csv.");
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
