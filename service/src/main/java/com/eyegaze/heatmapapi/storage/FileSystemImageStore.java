package com.eyegaze.heatmapapi.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/** Stores images as {@code <root>/[<folder>/]<uuid>_<name>.png}. */
public class FileSystemImageStore implements ImageStore {

  private static final Logger log = LoggerFactory.getLogger(FileSystemImageStore.class);

  private final Path root;

  public FileSystemImageStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public String save(String folder, String name, byte[] png) {
    String fileName = UUID.randomUUID().toString().replace("-", "") + "_" + sanitize(name)
        + ".png";
    String reference = StringUtils.hasText(folder) ? sanitize(folder) + "/" + fileName : fileName;
    Path target = resolve(reference);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, png);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write image " + target, ex);
    }
    log.debug("Wrote {} bytes to {}", png.length, target);
    return reference;
  }

  @Override
  public byte[] read(String reference) {
    Path source = resolve(reference);
    try {
      return Files.readAllBytes(source);
    } catch (NoSuchFileException ex) {
      throw new NoSuchElementException("Image file not found: " + reference);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read image " + source, ex);
    }
  }

  @Override
  public boolean delete(String reference) {
    Path target = resolve(reference);
    try {
      return Files.deleteIfExists(target);
    } catch (IOException ex) {
      log.warn("Error deleting image file {}: {}", target, ex.toString());
      return false;
    }
  }

  private Path resolve(String reference) {
    Path resolved = root.resolve(reference).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new IllegalArgumentException("Reference escapes the storage root: " + reference);
    }
    return resolved;
  }

  static String sanitize(String name) {
    String cleaned = name.trim().replace(' ', '_').replaceAll("[^A-Za-z0-9._-]", "_");
    return cleaned.isEmpty() ? "image" : cleaned;
  }
}
