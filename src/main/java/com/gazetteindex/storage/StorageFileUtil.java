package com.gazetteindex.storage;

import com.gazetteindex.config.Constants;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 存储文件工具方法，封装"临时文件 + 原子重命名"的写入流程。
 *
 * <p>读者只会看到完整文件或看不到文件；写入中途失败只会留下同目录下的临时文件。
 */
public final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 向输出流写入内容的回调。
     */
    @FunctionalInterface
    public interface StreamWriter {
        void writeTo(OutputStream outputStream) throws IOException;
    }

    /**
     * 返回目标文件对应的临时文件路径（同目录，追加 .tmp 后缀）。
     *
     * @param target 目标文件
     * @return 临时文件路径
     */
    public static Path tempPathFor(Path target) {
        return target.resolveSibling(target.getFileName().toString() + Constants.TEMP_FILE_SUFFIX);
    }

    /**
     * 先写临时文件再原子重命名到目标路径。
     *
     * @param target 目标文件
     * @param writer 内容写入回调
     * @return 写入的字节数
     * @throws IOException 写入或重命名失败时抛出，此时目标文件保持原状
     */
    public static long writeAtomically(Path target, StreamWriter writer) throws IOException {
        Path tempPath = tempPathFor(target);
        try {
            try (OutputStream outputStream = new BufferedOutputStream(Files.newOutputStream(tempPath))) {
                writer.writeTo(outputStream);
            }
            long size = Files.size(tempPath);
            Files.move(tempPath, target, StandardCopyOption.ATOMIC_MOVE);
            return size;
        } catch (IOException exception) {
            deleteQuietly(tempPath, exception);
            throw new IOException("原子写入失败: " + target, exception);
        }
    }

    private static void deleteQuietly(Path tempPath, IOException cause) {
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException cleanupException) {
            cause.addSuppressed(cleanupException);
        }
    }
}
