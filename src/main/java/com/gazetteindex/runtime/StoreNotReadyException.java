package com.gazetteindex.runtime;

/**
 * 行存尚未就绪，调用方可稍后重试。
 */
public class StoreNotReadyException extends RuntimeException {
    public StoreNotReadyException(String message) {
        super(message);
    }
}
