package com.weixiao.gitstore.storage;

import com.weixiao.gitstore.path.ResolvedPath;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.NotLinkException;

/**
 * 各适配器共用的错误构造：异常中的文件名一律是相对仓库根的路径，不暴露存储布局。
 * JDK 没有 EISDIR 对应的异常类，用 FileSystemException + 固定 reason 表示。
 */
@UtilityClass
public class StorageErrors {

    public static final String IS_A_DIRECTORY = "Is a directory";

    /** Linux 下 ENOTDIR 的 reason；JDK 只在部分操作上抛出 NotDirectoryException，其余情况是带此 reason 的 FileSystemException。 */
    static final String NOT_A_DIRECTORY = "Not a directory";

    /** 对外展示的路径：相对路径，根显示为 "."。 */
    public static String display(ResolvedPath path) {
        return path.isRoot() ? "." : path.getRelative();
    }

    public static FileSystemException isADirectory(ResolvedPath path) {
        return new FileSystemException(display(path), null, IS_A_DIRECTORY);
    }

    /** 判断异常是否为 "Is a directory"。 */
    public static boolean isDirectoryError(Throwable e) {
        return e instanceof FileSystemException && IS_A_DIRECTORY.equals(((FileSystemException) e).getReason());
    }

    /**
     * 把 java.nio.file 抛出的异常换成同类型、但文件名为相对路径的异常，原异常作为 cause 保留。
     * reason 为 "Not a directory" 的 FileSystemException 统一换成 NotDirectoryException。非 FileSystemException 原样返回。
     */
    public static IOException relativize(IOException e, ResolvedPath path) {
        if (!(e instanceof FileSystemException)) {
            return e;
        }
        String file = display(path);
        IOException mapped;
        if (e instanceof NoSuchFileException) {
            mapped = new NoSuchFileException(file);
        } else if (e instanceof AccessDeniedException) {
            mapped = new AccessDeniedException(file);
        } else if (e instanceof NotDirectoryException || NOT_A_DIRECTORY.equals(((FileSystemException) e).getReason())) {
            mapped = new NotDirectoryException(file);
        } else if (e instanceof DirectoryNotEmptyException) {
            mapped = new DirectoryNotEmptyException(file);
        } else if (e instanceof FileAlreadyExistsException) {
            mapped = new FileAlreadyExistsException(file);
        } else if (e instanceof NotLinkException) {
            mapped = new NotLinkException(file);
        } else if (e instanceof FileSystemLoopException) {
            mapped = new FileSystemLoopException(file);
        } else {
            mapped = new FileSystemException(file, null, ((FileSystemException) e).getReason());
        }
        mapped.initCause(e);
        return mapped;
    }
}
