package com.weixiao.gitstore.command;

import com.weixiao.gitstore.storage.StorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * gitstore init - 在仓库存储中创建空的裸仓库结构。
 * 创建 objects/info、objects/pack、refs/heads、refs/tags，写入 config 与指向初始分支的 HEAD。
 * 对已初始化的仓库再次执行不会改写 HEAD。
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "创建空的裸仓库")
public class InitCommand extends StorageCommand {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    private static final List<String> DIRS = Arrays.asList("objects/info", "objects/pack", "refs/heads", "refs/tags");
    private static final String HEAD = "HEAD";
    private static final String CONFIG = "config";
    private static final String CONFIG_CONTENT = "[core]\n"
            + "\trepositoryformatversion = 0\n"
            + "\tfilemode = true\n"
            + "\tbare = true\n";

    @Option(names = {"--initial-branch"}, paramLabel = "NAME", defaultValue = "main", description = "初始分支名，默认 main")
    private String initialBranch;

    /** 创建目录与 HEAD/config，成功时输出一行提示。 */
    @Override
    protected void execute(StorageAdapter storage) throws IOException {
        boolean reinit = exists(storage, HEAD);
        for (String dir : DIRS) {
            storage.mkdir(dir, true);
            log.debug("created dir {}", dir);
        }
        if (!exists(storage, CONFIG)) {
            storage.writeFile(CONFIG, CONFIG_CONTENT.getBytes(StandardCharsets.UTF_8));
        }
        if (!reinit) {
            String headRef = "ref: refs/heads/" + initialBranch + "\n";
            storage.writeFile(HEAD, headRef.getBytes(StandardCharsets.UTF_8));
            log.debug("wrote HEAD -> {}", headRef.trim());
        }

        String location = parent.describeLocation();
        log.info("repository {} at {}", reinit ? "reinitialized" : "initialized", location);
        if (reinit) {
            System.out.println("Reinitialized existing Git repository in " + location);
        } else {
            System.out.println("Initialized empty Git repository in " + location);
        }
    }
}
