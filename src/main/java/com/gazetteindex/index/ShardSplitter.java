package com.gazetteindex.index;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.gazetteindex.config.Constants;
import com.gazetteindex.storage.PostingList;
import com.gazetteindex.storage.StorageFileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * 把整体索引文件拆成按键分片的文件。
 *
 * <p>以流式方式逐个读取键值对，内存占用只与单个键的倒排长度有关。分片内容与整体索引中的
 * 数组完全一致；已存在的分片跳过，写出同样走原子重命名。
 */
public final class ShardSplitter {
    private static final Logger logger = LoggerFactory.getLogger(ShardSplitter.class);

    private final Path monolithicFile;
    private final Path outputDirectory;
    private final boolean twoLevel;
    private int progressKeys = 10_000;

    /**
     * @param monolithicFile 整体索引文件
     * @param outputDirectory 分片输出目录（该索引自己的目录，键直接落在其下）
     * @param twoLevel 是否使用两级目录
     */
    public ShardSplitter(Path monolithicFile, Path outputDirectory, boolean twoLevel) {
        if (monolithicFile == null || outputDirectory == null) {
            throw new IllegalArgumentException("输入文件与输出目录不能为空");
        }
        this.monolithicFile = monolithicFile;
        this.outputDirectory = outputDirectory;
        this.twoLevel = twoLevel;
    }

    public void setProgressKeys(int progressKeys) {
        this.progressKeys = progressKeys;
    }

    /**
     * 执行拆分并写出 _meta.json。
     *
     * @return 分片统计
     * @throws IOException 输入不存在、格式非法或写出失败时抛出
     * @throws InterruptedException 线程被中断时抛出
     */
    public ShardMeta split() throws IOException, InterruptedException {
        if (!Files.isRegularFile(monolithicFile)) {
            throw new NoSuchFileException(monolithicFile.toString(), null, "整体索引文件不存在");
        }
        Files.createDirectories(outputDirectory);
        int keyCount = 0;
        long postingsTotal = 0;
        int filesWritten = 0;

        try (InputStream inputStream = Files.newInputStream(monolithicFile);
             JsonParser parser = PostingsCodec.OBJECT_MAPPER.getFactory().createParser(inputStream)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("整体索引顶层必须是对象: " + monolithicFile);
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("拆分被中断: 已处理 " + keyCount + " 个键");
                }
                int key = parseKey(parser.currentName());
                parser.nextToken();
                PostingList postingList = PostingsCodec.toPostingList(parser.readValueAs(int[].class), monolithicFile);

                Path shardPath = shardPath(key);
                if (!Files.exists(shardPath)) {
                    Files.createDirectories(shardPath.getParent());
                    StorageFileUtil.writeAtomically(shardPath,
                        outputStream -> PostingsCodec.writeShard(outputStream, postingList));
                    filesWritten++;
                }
                keyCount++;
                postingsTotal += postingList.size();
                if (progressKeys > 0 && keyCount % progressKeys == 0) {
                    logger.info("[shard] 已处理 {} 个键", keyCount);
                }
            }
        }

        ShardMeta meta = new ShardMeta(monolithicFile.toString(), keyCount, postingsTotal);
        StorageFileUtil.writeAtomically(outputDirectory.resolve(Constants.SHARD_META_FILE_NAME),
            outputStream -> PostingsCodec.OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(outputStream, meta));
        logger.info("[shard] 拆分完成: {} 个键, {} 个倒排项, 新文件 {}", keyCount, postingsTotal, filesWritten);
        return meta;
    }

    private Path shardPath(int key) {
        String fileName = key + "." + Constants.INDEX_FILE_EXTENSION;
        if (twoLevel) {
            return outputDirectory.resolve(ShardLayout.fanoutDirectoryName(key)).resolve(fileName);
        }
        return outputDirectory.resolve(fileName);
    }

    private int parseKey(String rawKey) throws IOException {
        try {
            return Integer.parseInt(rawKey);
        } catch (NumberFormatException exception) {
            throw new IOException("整体索引键不是整数: " + rawKey + " (" + monolithicFile + ")", exception);
        }
    }
}
