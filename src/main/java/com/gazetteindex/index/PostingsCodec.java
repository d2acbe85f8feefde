package com.gazetteindex.index;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gazetteindex.storage.PostingList;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.SortedMap;

/**
 * 索引文件的 JSON 编解码。
 *
 * <p>分片文件只包含一个数组；整体索引文件是字符串键到数组的对象。
 */
final class PostingsCodec {
    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    private static final TypeReference<Map<String, int[]>> MONOLITHIC_TYPE = new TypeReference<>() {
    };

    private PostingsCodec() {
    }

    /**
     * 读取分片文件。
     *
     * @param shardFile 分片文件
     * @return 倒排列表
     * @throws IOException 读取失败或内容不是严格递增数组时抛出
     */
    static PostingList readShard(Path shardFile) throws IOException {
        int[] rowIds;
        try (InputStream inputStream = Files.newInputStream(shardFile)) {
            rowIds = OBJECT_MAPPER.readValue(inputStream, int[].class);
        } catch (IOException exception) {
            throw new IOException("读取分片失败: " + shardFile, exception);
        }
        return toPostingList(rowIds, shardFile);
    }

    /**
     * 读取整体索引文件。
     *
     * @param monolithicFile 整体索引文件
     * @return 字符串键到行号数组的映射
     * @throws IOException 读取或解析失败时抛出
     */
    static Map<String, int[]> readMonolithic(Path monolithicFile) throws IOException {
        try (InputStream inputStream = Files.newInputStream(monolithicFile)) {
            Map<String, int[]> mapping = OBJECT_MAPPER.readValue(inputStream, MONOLITHIC_TYPE);
            return mapping == null ? Map.of() : mapping;
        } catch (IOException exception) {
            throw new IOException("读取整体索引失败: " + monolithicFile, exception);
        }
    }

    /**
     * 写出一个紧凑的行号数组。
     */
    static void writeShard(OutputStream outputStream, PostingList postingList) throws IOException {
        OBJECT_MAPPER.writeValue(outputStream, postingList.rowIds());
    }

    /**
     * 按键的数值顺序写出整体索引，键编码为字符串。
     */
    static void writeMonolithic(OutputStream outputStream, SortedMap<Integer, PostingList> buckets) throws IOException {
        try (JsonGenerator generator = OBJECT_MAPPER.getFactory().createGenerator(outputStream)) {
            generator.writeStartObject();
            for (Map.Entry<Integer, PostingList> entry : buckets.entrySet()) {
                generator.writeFieldName(String.valueOf(entry.getKey()));
                int[] rowIds = entry.getValue().rowIds();
                generator.writeArray(rowIds, 0, rowIds.length);
            }
            generator.writeEndObject();
        }
    }

    /**
     * 校验数组并转换为倒排列表，非法内容视为读取错误而不是空结果。
     */
    static PostingList toPostingList(int[] rowIds, Path source) throws IOException {
        if (rowIds == null) {
            throw new IOException("倒排内容为空值: " + source);
        }
        try {
            return new PostingList(rowIds);
        } catch (IllegalArgumentException exception) {
            throw new IOException("倒排内容非法: " + source + " - " + exception.getMessage(), exception);
        }
    }
}
