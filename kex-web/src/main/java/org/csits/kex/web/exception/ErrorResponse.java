package org.csits.kex.web.exception;

import lombok.Value;

/**
 * 错误响应体。
 */
@Value
public class ErrorResponse {

    String error;

    String message;
}
