package com.pantrysync.backend.common.web;

import com.pantrysync.backend.consumption.web.ConsumptionSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.DateTimeException;
import java.util.HashMap;
import java.util.Map;

/**
 * 統一錯誤格式 {"code": ..., "message": ...}：
 * - 400：日期格式錯 / 參數錯
 * - 503：sync 中途 DB 失敗（已 commit 的 entry 放在 partial）
 * - 500：其他未預期錯誤
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage()));
    }

    // ===== 503：store 掛掉，下次 sync 會接著跑 =====

    @ExceptionHandler(ConsumptionSyncException.class)
    public ResponseEntity<Map<String, Object>> handleSyncAborted(ConsumptionSyncException ex) {
        Map<String, Object> body = err("SYNC_ABORTED", ex.getMessage());
        body.put("entryId", ex.entryId());
        body.put("partial", ex.partial());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex) {
        log.error("unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", ex.getMessage()));
    }

    private static Map<String, Object> err(String code, String message) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        return m;
    }
}
