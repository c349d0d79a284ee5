package com.weixiao.gitstore.command;

import com.weixiao.gitstore.GitStore;
import com.weixiao.gitstore.path.PathSanitizer;
import com.weixiao.gitstore.path.PathTraversalException;
import com.weixiao.gitstore.storage.StorageAdapter;
import com.weixiao.gitstore.stream.PayloadTooLargeException;
import com.weixiao.gitstore.stream.StreamSizeCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

/**
 * 子命令的公共部分：打开仓库、执行、把错误转成 "fatal: ..." 与退出码 1。
 * 越界与超限各有单独的提示，消息中不包含存储根目录。
 */
abstract class StorageCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(StorageCommand.class);

    @ParentCommand
    protected GitStore parent;

    private int exitCode = 0;

    @Override
    public final void run() {
        exitCode = 0;
        try {
            StorageAdapter storage = parent.openRepository();
            execute(storage);
        } catch (PathTraversalException e) {
            fail("path outside repository: " + PathSanitizer.printable(e.getRequestedPath()));
        } catch (PayloadTooLargeException e) {
            log.warn("{} rejected after {} bytes", e.getOperationName(), e.getBytesReceived());
            fail("payload too large (limit " + StreamSizeCounter.formatBytes(e.getMaxSize()) + ")");
        } catch (NoSuchFileException e) {
            fail("path not found: " + e.getFile());
        } catch (IOException e) {
            log.error("command failed", e);
            fail(e.getMessage());
        } catch (IllegalArgumentException | IllegalStateException e) {
            fail(e.getMessage());
        }
    }

    /**
     * 在已打开的仓库存储上执行命令。
     */
    protected abstract void execute(StorageAdapter storage) throws IOException;

    /**
     * 条目（含符号链接本身）是否存在；不存在以外的错误照常抛出。
     */
    protected static boolean exists(StorageAdapter storage, String path) throws IOException {
        try {
            storage.lstat(path);
            return true;
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    protected void fail(String message) {
        System.err.println("fatal: " + message);
        exitCode = 1;
    }

    /** 返回本命令的退出码（0 成功，1 失败）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
