package org.csits.kex.web.exception;

import lombok.extern.slf4j.Slf4j;
import org.csits.kex.manager.exception.ExportException;
import org.csits.kex.manager.exception.ExportFileNotFoundException;
import org.csits.kex.manager.exception.InvalidFileNameException;
import org.csits.kex.server.exception.DataSourceException;
import org.csits.kex.server.exception.ExportAuthorizationDeniedException;
import org.csits.kex.server.exception.ExportJobRejectedException;
import org.csits.kex.server.exception.UnknownExportProviderException;
import org.csits.kex.server.exception.UnknownExportTypeException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 导出异常到 HTTP 状态的映射。授权失败只返回 401，不带原因。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ExportAuthorizationDeniedException.class)
    public ResponseEntity<Void> handleDenied(ExportAuthorizationDeniedException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
    }

    @ExceptionHandler({UnknownExportTypeException.class, UnknownExportProviderException.class,
        InvalidFileNameException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(ExportException e) {
        log.info("导出请求参数错误: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("InvalidRequest", "请求体格式错误"));
    }

    @ExceptionHandler(ExportFileNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ExportFileNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ExportJobRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(ExportJobRejectedException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(DataSourceException.class)
    public ResponseEntity<ErrorResponse> handleDataSource(DataSourceException e) {
        log.error("数据源查询失败", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(ExportException.class)
    public ResponseEntity<ErrorResponse> handleExport(ExportException e) {
        log.error("导出请求处理失败", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, ExportException e) {
        String name = e.getClass().getSimpleName();
        if (name.endsWith("Exception")) {
            name = name.substring(0, name.length() - "Exception".length());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(name, e.getMessage()));
    }
}
