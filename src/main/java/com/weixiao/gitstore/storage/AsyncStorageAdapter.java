package com.weixiao.gitstore.storage;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 非阻塞门面：把任意 {@link StorageAdapter} 的调用派发到 executor，返回 CompletableFuture。
 * <p>
 * 失败时 future 以 CompletionException 异常完成，cause 为底层抛出的原始异常
 * （PathTraversalException、NoSuchFileException 等），调用方可按类型分支。
 * 每次调用各自解析路径、各自做 I/O，不共享可变状态，也不加锁。
 */
public final class AsyncStorageAdapter {

    private final StorageAdapter delegate;
    private final Executor executor;

    public AsyncStorageAdapter(StorageAdapter delegate, Executor executor) {
        this.delegate = delegate;
        this.executor = executor;
    }

    public CompletableFuture<byte[]> readFile(String path) {
        return submit(() -> delegate.readFile(path));
    }

    public CompletableFuture<Void> writeFile(String path, byte[] data) {
        return writeFile(path, data, null);
    }

    public CompletableFuture<Void> writeFile(String path, byte[] data, Integer mode) {
        return submit(() -> {
            delegate.writeFile(path, data, mode);
            return null;
        });
    }

    public CompletableFuture<Void> unlink(String path) {
        return submit(() -> {
            delegate.unlink(path);
            return null;
        });
    }

    public CompletableFuture<List<String>> readdir(String path) {
        return submit(() -> delegate.readdir(path));
    }

    public CompletableFuture<Void> mkdir(String path, boolean recursive) {
        return submit(() -> {
            delegate.mkdir(path, recursive);
            return null;
        });
    }

    public CompletableFuture<Void> rmdir(String path) {
        return submit(() -> {
            delegate.rmdir(path);
            return null;
        });
    }

    public CompletableFuture<EntryStats> stat(String path) {
        return submit(() -> delegate.stat(path));
    }

    public CompletableFuture<EntryStats> lstat(String path) {
        return submit(() -> delegate.lstat(path));
    }

    public CompletableFuture<String> readlink(String path) {
        return submit(() -> delegate.readlink(path));
    }

    public CompletableFuture<Void> symlink(String target, String path) {
        return submit(() -> {
            delegate.symlink(target, path);
            return null;
        });
    }

    /**
     * 被包装的同步实现。
     */
    public StorageAdapter getDelegate() {
        return delegate;
    }

    private <T> CompletableFuture<T> submit(StorageCall<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @FunctionalInterface
    private interface StorageCall<T> {
        T call() throws IOException;
    }
}
