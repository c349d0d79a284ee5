package com.weixiao.gitstore.command;

import com.weixiao.gitstore.storage.StorageAdapter;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * gitstore cat - 把仓库中某个文件的原始字节写到标准输出。
 */
@Command(name = "cat", mixinStandardHelpOptions = true, description = "输出文件内容")
public class CatCommand extends StorageCommand {

    @Parameters(index = "0", paramLabel = "PATH", description = "仓库内的相对路径")
    private String path;

    @Override
    protected void execute(StorageAdapter storage) throws IOException {
        byte[] data = storage.readFile(path);
        System.out.write(data);
        System.out.flush();
    }
}
