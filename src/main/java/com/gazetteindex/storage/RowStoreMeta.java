package com.gazetteindex.storage;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gazetteindex.config.Constants;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * 行存描述信息，与行存文件同目录保存，仅供人工查看与工具核对。
 */
public record RowStoreMeta(
    int rows,
    List<String> schema,
    String struct
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    /**
     * 按当前行格式生成描述信息。
     *
     * @param rows 行数
     * @return 描述信息
     */
    public static RowStoreMeta forRows(int rows) {
        List<String> fieldNames = Arrays.stream(RowField.values()).map(RowField::indexName).toList();
        return new RowStoreMeta(rows, fieldNames, Constants.ROW_STORE_STRUCT);
    }

    /**
     * 将描述信息写入指定 JSON 文件。
     *
     * @param file 描述文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("描述文件不能为空");
        }
        try {
            StorageFileUtil.writeAtomically(file.toPath(), outputStream -> OBJECT_MAPPER.writeValue(outputStream, this));
        } catch (IOException exception) {
            throw new IOException("写入行存描述失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取描述信息。
     *
     * @param file 描述文件
     * @return 反序列化后的描述信息
     * @throws IOException 读取或解析失败时抛出
     */
    public static RowStoreMeta readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("描述文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, RowStoreMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取行存描述失败: " + file.getAbsolutePath(), exception);
        }
    }
}
