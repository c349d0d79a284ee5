package com.weixiao.gitstore.command;

import com.weixiao.gitstore.storage.EntryStats;
import com.weixiao.gitstore.storage.StorageAdapter;
import picocli.CommandLine.*;

import java.io.IOException;
import java.time.Instant;
import java.util.Locale;

/**
 * gitstore stat - 输出条目的类型、八进制 mode、大小与修改时间，如 "file 100644 5 2024-01-01T00:00:00Z"。
 */
@Command(name = "stat", mixinStandardHelpOptions = true, description = "显示条目信息")
public class StatCommand extends StorageCommand {

    @Parameters(index = "0", paramLabel = "PATH", description = "仓库内的相对路径")
    private String path;

    @Option(names = {"--no-follow"}, description = "不跟随末端的符号链接（lstat）")
    private boolean noFollow;

    @Override
    protected void execute(StorageAdapter storage) throws IOException {
        EntryStats stats = noFollow ? storage.lstat(path) : storage.stat(path);
        System.out.println(String.format(Locale.ROOT, "%s %06o %d %s",
                stats.getType().name().toLowerCase(Locale.ROOT),
                stats.getMode(),
                stats.getSize(),
                Instant.ofEpochMilli(stats.getMtimeMs())));
    }
}
