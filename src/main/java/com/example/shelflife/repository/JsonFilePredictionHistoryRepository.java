package com.example.shelflife.repository;

import com.example.shelflife.domain.PredictionHistoryEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Prediction history kept as a single JSON array file.
 *
 * <p>Writes go to a sibling {@code .tmp} file that is then moved over the target, so an
 * interrupted write never leaves a half-written history behind. A file that cannot be
 * parsed is treated as empty and replaced on the next successful write.</p>
 */
@Slf4j
public class JsonFilePredictionHistoryRepository implements PredictionHistoryRepository {
  private static final TypeReference<List<PredictionHistoryEntry>> ENTRY_LIST = new TypeReference<>() {
  };

  private final Path path;
  private final int limit;
  private final ObjectMapper objectMapper;
  private final ReentrantLock lock = new ReentrantLock();

  public JsonFilePredictionHistoryRepository(Path path, int limit, ObjectMapper objectMapper) {
    if (limit < 1) {
      throw new IllegalArgumentException("History limit must be positive, got " + limit);
    }
    this.path = path.toAbsolutePath();
    this.limit = limit;
    this.objectMapper = objectMapper;
    ensureParentDir();
  }

  @Override
  public boolean append(PredictionHistoryEntry entry) {
    lock.lock();
    try {
      List<PredictionHistoryEntry> history = read();
      history.add(entry);
      return write(history);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<PredictionHistoryEntry> findAll() {
    lock.lock();
    try {
      return read();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean annotateActualShelfLife(String batchId, double actualDays) {
    if (batchId == null || batchId.isBlank()) {
      throw new IllegalArgumentException("Batch id is required to record an observed shelf life");
    }
    if (!Double.isFinite(actualDays) || actualDays <= 0) {
      throw new IllegalArgumentException("Observed shelf life must be positive, got " + actualDays);
    }
    lock.lock();
    try {
      List<PredictionHistoryEntry> history = read();
      for (int i = history.size() - 1; i >= 0; i--) {
        PredictionHistoryEntry entry = history.get(i);
        if (batchId.equals(entry.getBatchId()) && entry.getActualShelfLifeDays() == null) {
          entry.setActualShelfLifeDays(actualDays);
          entry.setActualRecordedAt(Instant.now());
          return write(history);
        }
      }
      log.info("No un-annotated history entry for batch '{}'", batchId);
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int count() {
    lock.lock();
    try {
      return read().size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int retentionLimit() {
    return limit;
  }

  private List<PredictionHistoryEntry> read() {
    if (!Files.exists(path)) {
      return new ArrayList<>();
    }
    try {
      List<PredictionHistoryEntry> entries = objectMapper.readValue(
          Files.readString(path, StandardCharsets.UTF_8), ENTRY_LIST);
      if (entries == null) {
        return new ArrayList<>();
      }
      entries.removeIf(Objects::isNull);
      return new ArrayList<>(entries);
    } catch (IOException ex) {
      log.warn("Failed to parse prediction history {}, treating as empty: {}", path, ex.getMessage());
      return new ArrayList<>();
    }
  }

  private boolean write(List<PredictionHistoryEntry> history) {
    List<PredictionHistoryEntry> retained = history.size() > limit
        ? history.subList(history.size() - limit, history.size())
        : history;
    Path tmp = path.resolveSibling(path.getFileName().toString() + ".tmp");
    try {
      ensureParentDir();
      Files.writeString(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(retained),
          StandardCharsets.UTF_8);
      move(tmp);
      return true;
    } catch (IOException ex) {
      log.warn("Failed to persist prediction history {}: {}", path, ex.getMessage());
      deleteQuietly(tmp);
      return false;
    }
  }

  private void move(Path tmp) throws IOException {
    try {
      Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move not supported for {}, falling back to replace", path);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException ex) {
      log.debug("Could not remove temporary history file {}: {}", tmp, ex.getMessage());
    }
  }

  private void ensureParentDir() {
    Path parent = path.getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      log.warn("Could not create history directory {}: {}", parent, ex.getMessage());
    }
  }
}
