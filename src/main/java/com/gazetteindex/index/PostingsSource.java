package com.gazetteindex.index;

import com.gazetteindex.storage.PostingList;

import java.io.IOException;

/**
 * 按（索引名，键）获取倒排列表。
 */
public interface PostingsSource {

    /**
     * 返回指定键的倒排列表；键不存在或索引文件缺失时返回空列表。
     *
     * @param indexName 索引名
     * @param key 索引键
     * @return 严格递增的行号列表
     * @throws IOException 索引文件存在但无法读取或内容非法时抛出
     */
    PostingList postings(String indexName, int key) throws IOException;
}
