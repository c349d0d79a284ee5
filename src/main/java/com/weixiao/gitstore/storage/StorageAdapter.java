package com.weixiao.gitstore.storage;

import java.io.IOException;
import java.util.List;

/**
 * 版本控制引擎依赖的存储契约：类 POSIX 的文件、目录、stat、符号链接操作。
 * <p>
 * 所有 path 参数都是相对仓库根的不可信字符串，实现必须先经
 * {@link com.weixiao.gitstore.path.PathSanitizer} 解析；越界时抛出
 * {@link com.weixiao.gitstore.path.PathTraversalException}，绝不返回默认值或空结果。
 * 其余错误使用 java.nio.file 的异常类型（NoSuchFileException、NotDirectoryException 等），
 * 不同实现之间保持一致，引擎无需知道当前是哪种实现。
 * <p>
 * 实现不持有全局锁，不同路径上的并发调用互不影响；同一 ref 的串行化由引擎负责。
 * 实现内部不做重试。
 */
public interface StorageAdapter {

    /** 读取文件全部字节；符号链接会被跟随。 */
    byte[] readFile(String path) throws IOException;

    /** 写入文件，父目录不存在时自动创建；写入是原子的（要么完整可见，要么不可见）。 */
    default void writeFile(String path, byte[] data) throws IOException {
        writeFile(path, data, null);
    }

    /**
     * 写入文件并可选地设置权限位。
     *
     * @param mode 权限位（如 0644），null 表示使用默认值；不支持权限的存储会忽略
     */
    void writeFile(String path, byte[] data, Integer mode) throws IOException;

    /** 删除文件或符号链接；目录请使用 {@link #rmdir(String)}。 */
    void unlink(String path) throws IOException;

    /** 列出目录下的条目名称（不递归），按名称排序。 */
    List<String> readdir(String path) throws IOException;

    /** 递归创建目录。 */
    default void mkdir(String path) throws IOException {
        mkdir(path, true);
    }

    /**
     * 创建目录。
     *
     * @param recursive true 时同时创建缺失的父目录，已存在的目录不报错
     */
    void mkdir(String path, boolean recursive) throws IOException;

    /** 删除目录。 */
    void rmdir(String path) throws IOException;

    /** 获取条目信息，跟随符号链接。 */
    EntryStats stat(String path) throws IOException;

    /** 获取条目信息，不跟随末端的符号链接。 */
    EntryStats lstat(String path) throws IOException;

    /** 读取符号链接的目标。 */
    String readlink(String path) throws IOException;

    /**
     * 在 path 处创建指向 target 的符号链接。
     * target 必须是相对路径，且相对 path 所在目录解析后仍位于仓库根之内。
     */
    void symlink(String target, String path) throws IOException;
}
