package com.eyegaze.heatmapapi.web;

import com.eyegaze.heatmapapi.render.RenderSettings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

  private final RenderSettings settings;

  public RootController(RenderSettings settings) {
    this.settings = settings;
  }

  /** Service banner with the render configuration clients are served with. */
  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> render = new LinkedHashMap<>();
    render.put("kernel_size", settings.kernelSize());
    render.put("colormap", settings.colormap().name());
    render.put("smoothing", settings.smoothing().name());
    render.put("alpha_background", settings.alphaBackground());
    render.put("alpha_heatmap", settings.alphaHeatmap());
    render.put("mask_fraction", settings.maskFraction());
    render.put("empty_base", settings.emptyBase().name().toLowerCase(Locale.ROOT));
    render.put("max_canvas_pixels", settings.maxCanvasPixels());
    render.put("output", "image/png");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "heatmap-service");
    body.put("status", "ok");
    body.put("render", render);
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
