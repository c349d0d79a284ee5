package com.weixiao.gitstore.command;

import com.weixiao.gitstore.storage.EntryStats;
import com.weixiao.gitstore.storage.StorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * gitstore rm - 删除文件或符号链接；加 -r 时递归删除目录。
 * 递归删除在命令一侧完成（readdir + unlink + rmdir），对两种后端行为一致。
 */
@Command(name = "rm", mixinStandardHelpOptions = true, description = "删除文件或目录")
public class RemoveCommand extends StorageCommand {

    private static final Logger log = LoggerFactory.getLogger(RemoveCommand.class);

    @Parameters(index = "0", paramLabel = "PATH", description = "仓库内的相对路径")
    private String path;

    @Option(names = {"-r", "--recursive"}, description = "递归删除目录")
    private boolean recursive;

    @Override
    protected void execute(StorageAdapter storage) throws IOException {
        EntryStats stats = storage.lstat(path);
        if (!stats.isDirectory()) {
            storage.unlink(path);
        } else if (recursive) {
            int removed = removeTree(storage, path);
            log.info("removed {} entries under {}", removed, path);
        } else {
            fail("not removing '" + path + "' recursively without -r");
            return;
        }
        System.out.println("rm '" + path + "'");
    }

    /**
     * 先删子条目再删目录本身。对象存储上目录随最后一个子条目消失，因此 rmdir 前再确认一次是否存在。
     */
    private int removeTree(StorageAdapter storage, String dir) throws IOException {
        int removed = 0;
        for (String name : storage.readdir(dir)) {
            String child = dir.isEmpty() ? name : dir + "/" + name;
            if (storage.lstat(child).isDirectory()) {
                removed += removeTree(storage, child);
            } else {
                storage.unlink(child);
                removed++;
            }
        }
        if (exists(storage, dir)) {
            storage.rmdir(dir);
        }
        return removed + 1;
    }
}
