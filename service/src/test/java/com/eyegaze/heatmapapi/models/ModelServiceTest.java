package com.eyegaze.heatmapapi.models;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.eyegaze.heatmapapi.render.DecodeFailureException;
import com.eyegaze.heatmapapi.storage.ImageStore;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

class ModelServiceTest {

  private ImageStore store;
  private ModelRecordRepository repository;
  private ModelService service;

  @BeforeEach
  void setUp() {
    store = mock(ImageStore.class);
    repository = mock(ModelRecordRepository.class);
    service = new ModelService(store, repository);
  }

  @Test
  void createStoresAPngAndRecordsItsSize() throws IOException {
    when(store.save(isNull(), eq("home page"), any(byte[].class))).thenReturn("abc_home_page.png");
    when(repository.save(any(ModelRecord.class))).thenAnswer(invocation -> {
      ModelRecord record = invocation.getArgument(0);
      ReflectionTestUtils.setField(record, "id", 12L);
      return record;
    });

    ModelCreatedResponse response = service.create(
        new ModelUploadRequest("home page", 4L, "data:image/jpeg;base64," + encoded(64, 48, "jpg")));

    assertThat(response.status()).isEqualTo("success");
    assertThat(response.modelId()).isEqualTo(12L);
    assertThat(response.width()).isEqualTo(64);
    assertThat(response.height()).isEqualTo(48);

    ArgumentCaptor<byte[]> written = ArgumentCaptor.forClass(byte[].class);
    verify(store).save(isNull(), eq("home page"), written.capture());
    assertThat(new String(written.getValue(), 1, 3, StandardCharsets.US_ASCII)).isEqualTo("PNG");

    ArgumentCaptor<ModelRecord> saved = ArgumentCaptor.forClass(ModelRecord.class);
    verify(repository).save(saved.capture());
    assertThat(saved.getValue().getModelPath()).isEqualTo("abc_home_page.png");
    assertThat(saved.getValue().getUserId()).isEqualTo(4L);
    assertThat(saved.getValue().getWidth()).isEqualTo(64);
  }

  @Test
  void nonImagesAreRejectedBeforeStoring() {
    assertThatThrownBy(() -> service.create(new ModelUploadRequest("x", 4L, "bm90IGFuIGltYWdl")))
        .isInstanceOf(DecodeFailureException.class);
    verifyNoInteractions(store, repository);
  }

  @Test
  void failedRecordRemovesTheStoredFile() throws IOException {
    when(store.save(isNull(), eq("x"), any(byte[].class))).thenReturn("ref.png");
    when(repository.save(any(ModelRecord.class)))
        .thenThrow(new DataIntegrityViolationException("duplicate"));

    assertThatThrownBy(() -> service.create(new ModelUploadRequest("x", 4L, encoded(8, 8, "png"))))
        .isInstanceOf(DataIntegrityViolationException.class);
    verify(store).delete("ref.png");
  }

  @Test
  void imageDecodesTheStoredFile() throws IOException {
    when(repository.findById(12L)).thenReturn(Optional.of(record(12L, "ref.png")));
    when(store.read("ref.png")).thenReturn(Base64.getDecoder().decode(encoded(30, 20, "png")));

    BufferedImage image = service.image(12L);

    assertThat(image.getWidth()).isEqualTo(30);
    assertThat(image.getHeight()).isEqualTo(20);
  }

  @Test
  void unknownModelsAreNotFound() {
    when(repository.findById(99L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.image(99L)).isInstanceOf(NoSuchElementException.class);
    assertThatThrownBy(() -> service.get(99L)).isInstanceOf(NoSuchElementException.class);
    assertThatThrownBy(() -> service.delete(99L)).isInstanceOf(NoSuchElementException.class);
    verifyNoInteractions(store);
  }

  @Test
  void listAndCheck() {
    when(repository.findAllByOrderByCreatedAtDescIdDesc()).thenReturn(List.of(record(12L, "ref.png")));
    when(repository.existsByModelName("home")).thenReturn(true);

    assertThat(service.list()).extracting(ModelSummary::id).containsExactly(12L);
    assertThat(service.exists("home")).isTrue();
    assertThatThrownBy(() -> service.exists("")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void recordIsKeptWhenTheFileCannotBeDeleted() {
    ModelRecord record = record(12L, "ref.png");
    when(repository.findById(12L)).thenReturn(Optional.of(record));
    when(store.delete("ref.png")).thenReturn(false);

    assertThatThrownBy(() -> service.delete(12L)).isInstanceOf(IllegalStateException.class);
    verify(repository, never()).delete(any(ModelRecord.class));
  }

  @Test
  void deleteRemovesFileThenRecord() {
    ModelRecord record = record(12L, "ref.png");
    when(repository.findById(12L)).thenReturn(Optional.of(record));
    when(store.delete("ref.png")).thenReturn(true);

    service.delete(12L);

    verify(repository).delete(record);
  }

  private static ModelRecord record(long id, String path) {
    ModelRecord record = new ModelRecord("home", path, 4L, 30, 20, Instant.now());
    ReflectionTestUtils.setField(record, "id", id);
    return record;
  }

  private static String encoded(int width, int height, String format) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, format, out);
    return Base64.getEncoder().encodeToString(out.toByteArray());
  }
}
