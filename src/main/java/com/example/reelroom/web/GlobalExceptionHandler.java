package com.example.reelroom.web;

import com.example.reelroom.archive.ArchiveException;
import com.example.reelroom.transfer.DownloadException;
import com.example.reelroom.transfer.PayloadTooLargeException;
import com.example.reelroom.transfer.TransferCancelledException;
import com.example.reelroom.transfer.UploadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException e) {
        return error(HttpStatus.CONFLICT, "conflict", e.getMessage());
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleTooLarge(PayloadTooLargeException e) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "payload_too_large", e.getMessage());
    }

    @ExceptionHandler(ArchiveException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleArchive(ArchiveException e) {
        log.warn("archive error: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "archive_error", e.getMessage());
    }

    @ExceptionHandler(UploadException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleUpload(UploadException e) {
        log.warn("upload failed (status {}): {}", e.getStatus(), e.getMessage());
        ResponseEntity<Map<String, Object>> res = error(HttpStatus.BAD_GATEWAY, "upload_failed", e.getMessage());
        res.getBody().put("upstreamStatus", e.getStatus());
        return res;
    }

    @ExceptionHandler(DownloadException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleDownload(DownloadException e) {
        log.warn("download failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "download_failed", e.getMessage());
    }

    @ExceptionHandler(TransferCancelledException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleCancelled(TransferCancelledException e) {
        return error(HttpStatus.CONFLICT, "cancelled", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException e) {
        String reason = (e.getReason() != null && !e.getReason().isBlank()) ? e.getReason() : e.getStatus().getReasonPhrase();
        return error(e.getStatus(), e.getStatus().name().toLowerCase(), reason);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
