package com.weixiao.gitstore.stream;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * 读取侧的计数阶段：从底层流读到的每一块都先交给 {@link StreamSizeCounter}，超限的那一块不会返回给调用方。
 * 超限后不再从底层流读取任何字节。
 */
public class SizeLimitedInputStream extends FilterInputStream {

    private final StreamSizeCounter counter;

    public SizeLimitedInputStream(InputStream in, StreamSizeCounter counter) {
        super(in);
        this.counter = counter;
    }

    @Override
    public int read() throws IOException {
        counter.checkWithinLimit();
        int b = super.read();
        if (b != -1) {
            counter.count(1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        counter.checkWithinLimit();
        int n = super.read(b, off, len);
        if (n > 0) {
            counter.count(n);
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        counter.checkWithinLimit();
        long skipped = super.skip(n);
        if (skipped > 0) {
            counter.count(skipped);
        }
        return skipped;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    public StreamSizeCounter getCounter() {
        return counter;
    }
}
