package com.pantrysync.backend.consumption.web;

import com.pantrysync.backend.consumption.dto.SyncReport;

/**
 * 某一筆 menu entry 寫入失敗（DB 掛掉 / 寫入被拒）→ 該筆整個 rollback，整輪中止。
 * partial 只包含已經 commit 的 entry。
 */
public class ConsumptionSyncException extends RuntimeException {
    private final Long entryId;
    private final SyncReport partial;

    public ConsumptionSyncException(Long entryId, SyncReport partial, Throwable cause) {
        super("consumption sync aborted at menu entry " + entryId, cause);
        this.entryId = entryId;
        this.partial = partial;
    }

    public Long entryId() { return entryId; }

    public SyncReport partial() { return partial; }
}
