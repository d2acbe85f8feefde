package com.gazetteindex.query;

/**
 * 客户端查询条件不合法，与内部错误区分。
 */
public class InvalidQueryException extends RuntimeException {
    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
