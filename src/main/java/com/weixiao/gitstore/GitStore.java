package com.weixiao.gitstore;

import com.weixiao.gitstore.command.CatCommand;
import com.weixiao.gitstore.command.InitCommand;
import com.weixiao.gitstore.command.ListCommand;
import com.weixiao.gitstore.command.ReceiveCommand;
import com.weixiao.gitstore.command.RemoveCommand;
import com.weixiao.gitstore.command.StatCommand;
import com.weixiao.gitstore.config.RepositoryIds;
import com.weixiao.gitstore.config.StorageAdapters;
import com.weixiao.gitstore.config.StorageBackend;
import com.weixiao.gitstore.config.StorageConfig;
import com.weixiao.gitstore.storage.StorageAdapter;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Path;

/**
 * gitstore - 仓库存储后端的命令行入口，用配置好的后端（本地目录或 S3）读写某个仓库的存储。
 * <p>
 * 仓库 id、后端与本地根目录由本类的全局选项统一提供，子命令通过 {@link #openRepository()} 获取适配器。
 * 未指定的部分取自 {@link StorageConfig#load()}（系统属性、环境变量、gitstore.properties）。
 */
@Command(name = "gitstore", mixinStandardHelpOptions = true, description = "gitstore - Git 仓库存储后端")
public class GitStore implements Runnable {

    @Option(names = {"-r", "--repo"}, paramLabel = "ID", description = "仓库 id（字母、数字、连字符）")
    private String repositoryId;

    @Option(names = {"-b", "--backend"}, paramLabel = "BACKEND", description = "存储后端：local 或 s3，默认取配置")
    private String backend;

    @Option(names = {"-d", "--base-dir"}, paramLabel = "DIR", description = "本地后端的仓库根目录，默认取配置")
    private Path baseDir;

    /**
     * 未指定子命令时打印用法说明。
     */
    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * 合并全局选项后的配置。
     */
    public StorageConfig getConfig() {
        StorageConfig config = StorageConfig.load();
        if (backend != null) {
            config = config.withBackend(StorageBackend.parse(backend));
        }
        if (baseDir != null) {
            config = config.withLocalBaseDir(baseDir.toAbsolutePath().normalize());
        }
        return config;
    }

    /**
     * 按全局选项打开仓库存储。
     *
     * @throws IllegalArgumentException 未指定或不合法的仓库 id
     */
    public StorageAdapter openRepository() throws IOException {
        return new StorageAdapters(getConfig()).open(requireRepositoryId());
    }

    /**
     * 仓库的存储位置描述：本地为目录，S3 为 s3://bucket/prefix。
     */
    public String describeLocation() {
        StorageConfig config = getConfig();
        String id = requireRepositoryId();
        if (config.getBackend() == StorageBackend.S3) {
            String prefix = config.getS3KeyPrefix().isEmpty() ? id : config.getS3KeyPrefix() + "/" + id;
            return "s3://" + config.getS3Bucket() + "/" + prefix;
        }
        return new StorageAdapters(config).repositoryDir(id).toString();
    }

    private String requireRepositoryId() {
        if (repositoryId == null) {
            throw new IllegalArgumentException("no repository specified (use --repo)");
        }
        return RepositoryIds.validate(repositoryId);
    }

    /**
     * 创建配置好的 CommandLine 实例，包含所有已注册的子命令。
     * 这是执行 gitstore 命令的统一入口点，供 main() 和测试使用。
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new GitStore())
                .addSubcommand("init", new InitCommand())
                .addSubcommand("cat", new CatCommand())
                .addSubcommand("ls", new ListCommand())
                .addSubcommand("stat", new StatCommand())
                .addSubcommand("receive", new ReceiveCommand())
                .addSubcommand("rm", new RemoveCommand());
    }

    /**
     * 主入口方法。
     * 若需调试日志：-Dgitstore.debug=true 或环境变量 GITSTORE_DEBUG=true，或 -Dgitstore.log.level=DEBUG。
     */
    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getProperty("gitstore.debug"))
                || "true".equalsIgnoreCase(System.getenv("GITSTORE_DEBUG"))) {
            System.setProperty("gitstore.log.level", "DEBUG");
        }
        CommandLine cli = createCommandLine();
        String[] runArgs = args != null && args.length > 0 ? args : new String[]{"--help"};
        int exitCode = cli.execute(runArgs);
        System.exit(exitCode);
    }
}
