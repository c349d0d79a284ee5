package com.weixiao.gitstore.stream;

import java.io.IOException;

/**
 * 流经 {@link StreamSizeCounter} 的字节数超过预算。对该流而言是终止性错误，
 * 传输层应映射为 413 Payload Too Large，而不是一般的 I/O 错误。
 */
public class PayloadTooLargeException extends IOException {

    private final String operationName;
    private final long maxSize;
    private final long bytesReceived;

    public PayloadTooLargeException(String operationName, long maxSize, long bytesReceived) {
        super(operationName + ": Stream size limit exceeded. Received "
                + StreamSizeCounter.formatBytes(bytesReceived) + ", maximum allowed is "
                + StreamSizeCounter.formatBytes(maxSize));
        this.operationName = operationName;
        this.maxSize = maxSize;
        this.bytesReceived = bytesReceived;
    }

    public String getOperationName() {
        return operationName;
    }

    public long getMaxSize() {
        return maxSize;
    }

    /** 拒绝时实际观察到的累计字节数，可能大于 maxSize。 */
    public long getBytesReceived() {
        return bytesReceived;
    }
}
