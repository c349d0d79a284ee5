package com.weixiao.gitstore.command;

import com.weixiao.gitstore.config.StorageAdapters;
import com.weixiao.gitstore.storage.StorageAdapter;
import com.weixiao.gitstore.stream.SizeLimitedInputStream;
import com.weixiao.gitstore.stream.StreamSizeCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * gitstore receive - 读取推送数据（标准输入或 --input 文件）并原子写入仓库中的 PATH。
 * 读取经过 push 预算计数，超限时立即停止读取，不写入任何内容。
 */
@Command(name = "receive", mixinStandardHelpOptions = true, description = "接收推送数据并写入仓库")
public class ReceiveCommand extends StorageCommand {

    private static final Logger log = LoggerFactory.getLogger(ReceiveCommand.class);

    @Parameters(index = "0", paramLabel = "PATH", description = "写入的目标路径，如 objects/pack/incoming.pack")
    private String path;

    @Option(names = {"-i", "--input"}, paramLabel = "FILE", description = "从文件读取，默认读取标准输入")
    private Path input;

    @Option(names = {"--max-bytes"}, paramLabel = "N", description = "覆盖配置中的 push 上限（字节）")
    private Long maxBytes;

    @Override
    protected void execute(StorageAdapter storage) throws IOException {
        StreamSizeCounter counter = maxBytes != null
                ? new StreamSizeCounter(maxBytes, "git receive-pack", this::onLimitExceeded)
                : new StorageAdapters(parent.getConfig()).pushCounter(this::onLimitExceeded);

        InputStream source = input != null ? Files.newInputStream(input) : System.in;
        byte[] payload;
        try {
            payload = new SizeLimitedInputStream(source, counter).readAllBytes();
        } finally {
            if (input != null) {
                source.close();
            }
        }
        storage.writeFile(path, payload);
        log.info("received {} into {}", StreamSizeCounter.formatBytes(counter.getBytesReceived()), path);
        System.out.println("received " + counter.getBytesReceived() + " bytes");
    }

    private void onLimitExceeded(long bytesReceived) {
        log.warn("push aborted after {} bytes", bytesReceived);
    }
}
