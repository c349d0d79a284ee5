package com.weixiao.gitstore.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.LongConsumer;

/**
 * 单个流的字节预算：累计每个数据块的长度，超过 maxSize 的那一块不再放行并抛出 {@link PayloadTooLargeException}。
 * <p>
 * 一旦超限即进入终止状态，之后的数据块一律拒绝；onLimitExceeded 回调只在首次超限时触发一次，
 * 参数为超限时的累计字节数，供传输层立即断开连接。
 * 非线程安全：每个在途的流各自创建一个实例，不可在并发流之间共享。
 */
public final class StreamSizeCounter {

    private static final Logger log = LoggerFactory.getLogger(StreamSizeCounter.class);

    private final long maxSize;
    private final String operationName;
    private final LongConsumer onLimitExceeded;

    private long bytesReceived;
    private boolean exceeded;

    public StreamSizeCounter(long maxSize, String operationName) {
        this(maxSize, operationName, null);
    }

    /**
     * @param maxSize         最大允许字节数（含），恰好等于时仍放行
     * @param operationName   用于日志与错误消息，如 "git receive-pack"
     * @param onLimitExceeded 首次超限时的回调，可为 null
     */
    public StreamSizeCounter(long maxSize, String operationName, LongConsumer onLimitExceeded) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        }
        this.maxSize = maxSize;
        this.operationName = operationName;
        this.onLimitExceeded = onLimitExceeded;
    }

    /**
     * 记录一个数据块。正常返回表示该块可以继续传给下游。
     * 例：maxSize=50，依次 count(30)、count(30) → 第二次抛出异常，getBytesReceived()==60。
     *
     * @throws PayloadTooLargeException 累计字节数超过 maxSize，或此前已超限
     */
    public void count(long chunkLength) throws PayloadTooLargeException {
        bytesReceived += chunkLength;
        checkWithinLimit();
    }

    /**
     * 已超限时抛出异常；首次发现超限时记录日志并触发回调。
     */
    public void checkWithinLimit() throws PayloadTooLargeException {
        if (exceeded) {
            throw new PayloadTooLargeException(operationName, maxSize, bytesReceived);
        }
        if (bytesReceived > maxSize) {
            exceeded = true;
            log.warn("{}: Size limit exceeded - {} > {}", operationName, formatBytes(bytesReceived), formatBytes(maxSize));
            if (onLimitExceeded != null) {
                onLimitExceeded.accept(bytesReceived);
            }
            throw new PayloadTooLargeException(operationName, maxSize, bytesReceived);
        }
    }

    /** 目前为止观察到的累计字节数（超限后可能大于 maxSize）。 */
    public long getBytesReceived() {
        return bytesReceived;
    }

    public long getMaxSize() {
        return maxSize;
    }

    public String getOperationName() {
        return operationName;
    }

    public boolean isExceeded() {
        return exceeded;
    }

    /**
     * 可读的字节数，如 13 B、1.50 KB、10.00 MB、2.00 GB。
     */
    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024L * 1024) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
        }
        if (bytes < 1024L * 1024 * 1024) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024));
        }
        return String.format(Locale.ROOT, "%.2f GB", bytes / (1024.0 * 1024 * 1024));
    }
}
