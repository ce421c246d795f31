package com.example.shelflife.repository;

import com.example.shelflife.domain.PredictionHistoryEntry;

import java.util.List;

public interface PredictionHistoryRepository {
  /**
   * Appends an entry and drops the oldest ones beyond the retention window.
   *
   * @return false when the entry could not be persisted
   */
  boolean append(PredictionHistoryEntry entry);

  /**
   * All retained entries, oldest first. Never throws on unreadable storage.
   */
  List<PredictionHistoryEntry> findAll();

  /**
   * Records the observed shelf life on the newest entry of {@code batchId} that has none yet.
   *
   * @return true when an entry was updated and persisted
   */
  boolean annotateActualShelfLife(String batchId, double actualDays);

  /**
   * Number of retained entries; 0 when the store is missing or unreadable.
   */
  int count();

  int retentionLimit();
}
