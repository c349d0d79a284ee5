package com.weixiao.gitstore.command;

import com.weixiao.gitstore.storage.StorageAdapter;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * gitstore ls - 列出目录下的条目名称，每行一个。
 */
@Command(name = "ls", mixinStandardHelpOptions = true, description = "列出目录条目")
public class ListCommand extends StorageCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "PATH", defaultValue = "", description = "目录路径，默认为仓库根")
    private String path;

    @Override
    protected void execute(StorageAdapter storage) throws IOException {
        for (String name : storage.readdir(path)) {
            System.out.println(name);
        }
    }
}
