package com.gazetteindex.storage;

import java.io.IOException;

/**
 * 行存文件格式不合法（例如长度不是行宽的整数倍），属于启动期配置错误。
 */
public class RowStoreFormatException extends IOException {
    public RowStoreFormatException(String message) {
        super(message);
    }
}
