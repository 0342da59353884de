package com.phillippitts.webpbatch.service.history;

import java.util.List;

/**
 * Persistence of finished runs.
 *
 * <p>Implementations are best-effort: failures are logged, never thrown to the caller.
 */
public interface RunHistoryStore {

    /**
     * Adds a run as the newest entry, dropping the oldest entries beyond capacity.
     */
    void append(HistoryEntry entry);

    /**
     * @return entries newest first; empty when nothing is stored or the store cannot be read
     */
    List<HistoryEntry> list();

    void clear();
}
