package com.eyegaze.heatmapapi.storage;

/** Where encoded images live once written. References are opaque to callers. */
public interface ImageStore {

  /**
   * Writes {@code png} under {@code folder} (may be null for the store root) and returns the
   * reference to read it back with.
   */
  String save(String folder, String name, byte[] png);

  /** @throws java.util.NoSuchElementException when nothing is stored under the reference */
  byte[] read(String reference);

  /** Returns false when the reference did not resolve to a stored file. */
  boolean delete(String reference);
}
