package com.weixiao.gitstore.stream;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * 写入侧的计数阶段：每次 write 先计数，未超限才转发给下游；超限的那一块及之后的数据都不会写出。
 */
public class SizeLimitedOutputStream extends FilterOutputStream {

    private final StreamSizeCounter counter;

    public SizeLimitedOutputStream(OutputStream out, StreamSizeCounter counter) {
        super(out);
        this.counter = counter;
    }

    @Override
    public void write(int b) throws IOException {
        counter.count(1);
        out.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        counter.count(len);
        out.write(b, off, len);
    }

    public StreamSizeCounter getCounter() {
        return counter;
    }
}
