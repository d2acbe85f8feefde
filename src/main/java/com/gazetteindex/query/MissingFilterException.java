package com.gazetteindex.query;

/**
 * 没有任何可用于检索的倒排条件。
 */
public class MissingFilterException extends InvalidQueryException {
    public MissingFilterException() {
        super("至少需要提供以下条件之一: 地点编码、公告类型编码或有效的日期区间");
    }
}
