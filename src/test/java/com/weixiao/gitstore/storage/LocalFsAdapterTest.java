package com.weixiao.gitstore.storage;

import com.weixiao.gitstore.path.PathTraversalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * LocalFsAdapter 测试：通用行为之外，验证磁盘布局、权限位与错误消息。
 */
@DisplayName("LocalFsAdapter 测试")
class LocalFsAdapterTest extends StorageAdapterContractTest {

    private Path repoDir;

    @Override
    protected StorageAdapter createAdapter(Path tempDir) throws Exception {
        repoDir = tempDir.resolve("repo-42");
        Files.createDirectories(repoDir);
        return new LocalFsAdapter(repoDir);
    }

    private static boolean posixSupported() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }

    @Test
    @DisplayName("文件按相对路径落在仓库目录下，与原生裸仓库布局一致")
    void writeFile_layoutOnDisk() throws Exception {
        storage.writeFile("refs/heads/main", "abc\n".getBytes(StandardCharsets.UTF_8));

        Path file = repoDir.resolve("refs").resolve("heads").resolve("main");
        assertThat(file).isRegularFile();
        assertThat(Files.readAllBytes(file)).isEqualTo("abc\n".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("写入完成后目录中不残留临时文件")
    void writeFile_leavesNoTempFiles() throws Exception {
        for (int i = 0; i < 5; i++) {
            storage.writeFile("objects/pack/pack-1.idx", new byte[]{(byte) i});
        }
        try (Stream<Path> files = Files.list(repoDir.resolve("objects/pack"))) {
            List<String> names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
            assertThat(names).containsExactly("pack-1.idx");
        }
    }

    @Test
    @DisplayName("writeFile 指定 mode 时设置权限位，stat 返回完整 mode")
    void writeFile_withMode() throws Exception {
        assumeTrue(posixSupported());
        storage.writeFile("hooks/post-receive", "#!/bin/sh\n".getBytes(StandardCharsets.UTF_8), 0755);
        storage.writeFile("description", "repo\n".getBytes(StandardCharsets.UTF_8), 0600);

        assertThat(storage.stat("hooks/post-receive").getMode()).isEqualTo(EntryStats.S_IFREG | 0755);
        assertThat(storage.stat("hooks/post-receive").getPermissions()).isEqualTo(0755);
        assertThat(storage.stat("description").getMode()).isEqualTo(EntryStats.S_IFREG | 0600);
        assertThat(Files.getPosixFilePermissions(repoDir.resolve("description")))
                .isEqualTo(PosixFilePermissions.fromString("rw-------"));
    }

    @Test
    @DisplayName("权限集合与八进制权限位互相转换")
    void permissionConversion() {
        Set<PosixFilePermission> rwxrxrx = PosixFilePermissions.fromString("rwxr-xr-x");
        assertThat(LocalFsAdapter.permissionsToMode(rwxrxrx)).isEqualTo(0755);
        assertThat(LocalFsAdapter.permissionsToMode(PosixFilePermissions.fromString("rw-r--r--"))).isEqualTo(0644);
        assertThat(LocalFsAdapter.modeToPermissions(0100755)).isEqualTo(rwxrxrx);
        assertThat(LocalFsAdapter.modeToPermissions(0)).isEmpty();
    }

    @Test
    @DisplayName("rmdir 非空目录抛出 DirectoryNotEmptyException，内容保持不变")
    void rmdir_nonEmpty() throws Exception {
        storage.writeFile("refs/heads/main", new byte[]{1});
        assertThatThrownBy(() -> storage.rmdir("refs/heads")).isInstanceOf(DirectoryNotEmptyException.class);
        assertThat(storage.readFile("refs/heads/main")).containsExactly(1);
    }

    @Test
    @DisplayName("错误消息只含仓库内相对路径，不暴露本地目录")
    void errors_doNotLeakBaseDir() {
        assertThatThrownBy(() -> storage.readFile("objects/missing"))
                .isInstanceOf(NoSuchFileException.class)
                .satisfies(e -> {
                    assertThat(e.getMessage()).contains("objects/missing");
                    assertThat(e.getMessage()).doesNotContain(repoDir.toString());
                });
        assertThatThrownBy(() -> storage.rmdir("nope"))
                .satisfies(e -> assertThat(e.getMessage()).doesNotContain(repoDir.toString()));
    }

    @Test
    @DisplayName("仓库外的同级目录无法通过 .. 访问")
    void siblingRepository_notReachable() throws Exception {
        Path sibling = repoDir.resolveSibling("repo-420");
        Files.createDirectories(sibling);
        Files.write(sibling.resolve("HEAD"), "secret".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> storage.readFile("../repo-420/HEAD")).isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.readFile(sibling.resolve("HEAD").toString()))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("链接所在目录经过指向上层的链接时，按真实位置校验目标")
    void symlink_throughDirectoryLink_cannotEscape() throws Exception {
        Files.write(tempDir.resolve("secret.txt"), "TOP-SECRET".getBytes(StandardCharsets.UTF_8));
        storage.writeFile("HEAD", "ref: refs/heads/main\n".getBytes(StandardCharsets.UTF_8));
        storage.mkdir("x/y");
        storage.symlink("..", "x/y/d");

        assertThatThrownBy(() -> storage.symlink("../../../secret.txt", "x/y/d/l"))
                .isInstanceOf(PathTraversalException.class);
        assertThat(Files.exists(repoDir.resolve("x").resolve("l"), LinkOption.NOFOLLOW_LINKS)).isFalse();

        storage.symlink("../HEAD", "x/y/d/head");
        assertThat(storage.readFile("x/head")).isEqualTo("ref: refs/heads/main\n".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("仓库内已有指向外部的链接时，跟随链接的操作抛出 PathTraversalException")
    void existingOutsideLink_notFollowed() throws Exception {
        Path secret = tempDir.resolve("secret.txt");
        Files.write(secret, "TOP-SECRET".getBytes(StandardCharsets.UTF_8));
        Files.createSymbolicLink(repoDir.resolve("leak"), secret);
        Files.createSymbolicLink(repoDir.resolve("outside"), tempDir);

        assertThatThrownBy(() -> storage.readFile("leak")).isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.stat("leak")).isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.readdir("outside")).isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.writeFile("outside/planted", new byte[]{1}))
                .isInstanceOf(PathTraversalException.class);
        assertThat(tempDir.resolve("planted")).doesNotExist();
        assertThat(storage.lstat("leak").isSymbolicLink()).isTrue();
    }

    @Test
    @DisplayName("在磁盘上创建的是相对链接")
    void symlink_createsRelativeLinkOnDisk() throws Exception {
        storage.writeFile("refs/heads/main", new byte[]{1});
        storage.symlink("refs/heads/main", "HEAD");

        Path link = repoDir.resolve("HEAD");
        assertThat(Files.isSymbolicLink(link)).isTrue();
        assertThat(Files.readSymbolicLink(link).isAbsolute()).isFalse();
    }

    @Test
    @DisplayName("根目录不存在时由 writeFile 按需创建")
    void baseDirCreatedOnDemand() throws Exception {
        Path fresh = tempDir.resolve("not-yet").resolve("repo");
        LocalFsAdapter adapter = new LocalFsAdapter(fresh);
        adapter.writeFile("HEAD", "ref: refs/heads/main\n".getBytes(StandardCharsets.UTF_8));

        assertThat(fresh.resolve("HEAD")).isRegularFile();
        assertThat(adapter.getBaseDir()).isEqualTo(fresh.toAbsolutePath().normalize());
    }
}
