package com.weixiao.gitstore.storage;

import com.weixiao.gitstore.path.PathTraversalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.NotLinkException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 两种适配器共同遵守的行为。子类只需提供被测实例。
 */
abstract class StorageAdapterContractTest {

    @TempDir
    Path tempDir;

    protected StorageAdapter storage;

    /** 创建一个空仓库对应的适配器。 */
    protected abstract StorageAdapter createAdapter(Path tempDir) throws Exception;

    @BeforeEach
    void setUp() throws Exception {
        storage = createAdapter(tempDir);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("写入后读取得到相同字节，父目录自动创建")
    void writeThenRead_returnsSameBytes() throws Exception {
        byte[] data = {0, 1, 2, (byte) 0xff, 10, 13};
        storage.writeFile("objects/ab/cdef0123", data);

        assertThat(storage.readFile("objects/ab/cdef0123")).isEqualTo(data);
        assertThat(storage.stat("objects/ab").isDirectory()).isTrue();
        assertThat(storage.readdir("objects")).containsExactly("ab");
    }

    @Test
    @DisplayName("覆盖写入替换全部内容")
    void writeFile_overwrites() throws Exception {
        storage.writeFile("HEAD", bytes("ref: refs/heads/master\n"));
        storage.writeFile("HEAD", bytes("ref: refs/heads/main\n"));

        assertThat(new String(storage.readFile("HEAD"), StandardCharsets.UTF_8)).isEqualTo("ref: refs/heads/main\n");
        assertThat(storage.stat("HEAD").getSize()).isEqualTo(21L);
    }

    @Test
    @DisplayName("写入空内容得到零字节文件")
    void writeFile_empty() throws Exception {
        storage.writeFile("objects/info/packs", new byte[0]);
        assertThat(storage.readFile("objects/info/packs")).isEmpty();
        assertThat(storage.stat("objects/info/packs").isFile()).isTrue();
    }

    @Test
    @DisplayName("读取不存在的文件抛出 NoSuchFileException，消息中是仓库内相对路径")
    void readFile_missing() {
        assertThatThrownBy(() -> storage.readFile("refs/heads/nope"))
                .isInstanceOf(NoSuchFileException.class)
                .hasMessageContaining("refs/heads/nope");
    }

    @Test
    @DisplayName("读取目录抛出 Is a directory")
    void readFile_directory() throws Exception {
        storage.mkdir("refs/heads");
        assertThatThrownBy(() -> storage.readFile("refs/heads"))
                .isInstanceOf(FileSystemException.class)
                .matches(StorageErrors::isDirectoryError);
    }

    @Test
    @DisplayName("写入已存在的目录或仓库根抛出 Is a directory")
    void writeFile_onDirectory() throws Exception {
        storage.mkdir("refs");
        assertThatThrownBy(() -> storage.writeFile("refs", bytes("x"))).matches(StorageErrors::isDirectoryError);
        assertThatThrownBy(() -> storage.writeFile("", bytes("x"))).matches(StorageErrors::isDirectoryError);
    }

    @Test
    @DisplayName("父路径是普通文件时写入抛出 NotDirectoryException")
    void writeFile_underRegularFile() throws Exception {
        storage.writeFile("HEAD", bytes("x"));
        assertThatThrownBy(() -> storage.writeFile("HEAD/child", bytes("y")))
                .isInstanceOf(NotDirectoryException.class);
        assertThatThrownBy(() -> storage.writeFile("HEAD/a/b", bytes("y")))
                .isInstanceOf(NotDirectoryException.class);
    }

    @Test
    @DisplayName("mkdir 后在其中写文件，readdir 恰好列出一次")
    void mkdirThenWrite_childListedOnce() throws Exception {
        storage.mkdir("refs/tags");
        storage.writeFile("refs/tags/v1.0", bytes("abc"));

        assertThat(storage.readdir("refs/tags")).containsExactly("v1.0");
        assertThat(storage.readdir("refs")).containsExactly("tags");
    }

    @Test
    @DisplayName("readdir 列出文件与子目录，按名称排序")
    void readdir_listsFilesAndDirectories() throws Exception {
        storage.writeFile("b.txt", bytes("b"));
        storage.writeFile("a.txt", bytes("a"));
        storage.writeFile("sub/deep/c.txt", bytes("c"));
        storage.mkdir("empty");

        assertThat(storage.readdir("")).containsExactly("a.txt", "b.txt", "empty", "sub");
        assertThat(storage.readdir("empty")).isEmpty();
    }

    @Test
    @DisplayName("readdir 不存在的目录抛出 NoSuchFileException，普通文件抛出 NotDirectoryException")
    void readdir_errors() throws Exception {
        storage.writeFile("HEAD", bytes("x"));
        assertThatThrownBy(() -> storage.readdir("missing")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> storage.readdir("HEAD")).isInstanceOf(NotDirectoryException.class);
    }

    @Test
    @DisplayName("默认 mkdir 递归创建，已存在时不报错")
    void mkdir_recursiveIsIdempotent() throws Exception {
        storage.mkdir("objects/info");
        storage.mkdir("objects/info");
        storage.mkdir("objects");

        assertThat(storage.stat("objects").isDirectory()).isTrue();
        assertThat(storage.readdir("objects")).containsExactly("info");
    }

    @Test
    @DisplayName("非递归 mkdir：父目录不存在抛出 NoSuchFileException，目标已存在抛出 FileAlreadyExistsException")
    void mkdir_nonRecursive() throws Exception {
        assertThatThrownBy(() -> storage.mkdir("a/b", false)).isInstanceOf(NoSuchFileException.class);

        storage.mkdir("a", false);
        storage.mkdir("a/b", false);
        assertThat(storage.readdir("a")).containsExactly("b");
        assertThatThrownBy(() -> storage.mkdir("a/b", false)).isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    @DisplayName("mkdir 的目标是普通文件时抛出 FileAlreadyExistsException")
    void mkdir_onRegularFile() throws Exception {
        storage.writeFile("config", bytes("x"));
        assertThatThrownBy(() -> storage.mkdir("config")).isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    @DisplayName("rmdir 删除空目录")
    void rmdir_emptyDirectory() throws Exception {
        storage.mkdir("refs");
        storage.mkdir("refs/remotes");
        storage.rmdir("refs/remotes");

        assertThatThrownBy(() -> storage.stat("refs/remotes")).isInstanceOf(NoSuchFileException.class);
        assertThat(storage.stat("refs").isDirectory()).isTrue();
    }

    @Test
    @DisplayName("递归 mkdir 创建的祖先目录在 rmdir 子目录后仍然存在")
    void rmdir_keepsAncestorsOfRecursiveMkdir() throws Exception {
        storage.mkdir("a/b/c");
        storage.rmdir("a/b/c");

        assertThat(storage.readdir("a/b")).isEmpty();
        assertThat(storage.readdir("a")).containsExactly("b");
        assertThat(storage.stat("a/b").isDirectory()).isTrue();
    }

    @Test
    @DisplayName("路径的某一级是普通文件时，各操作都抛出 NotDirectoryException")
    void pathBelowRegularFile_notADirectory() throws Exception {
        storage.writeFile("HEAD", bytes("ref: refs/heads/main\n"));

        assertThatThrownBy(() -> storage.readFile("HEAD/x")).isInstanceOf(NotDirectoryException.class);
        assertThatThrownBy(() -> storage.stat("HEAD/x")).isInstanceOf(NotDirectoryException.class);
        assertThatThrownBy(() -> storage.lstat("HEAD/x")).isInstanceOf(NotDirectoryException.class);
        assertThatThrownBy(() -> storage.unlink("HEAD/x")).isInstanceOf(NotDirectoryException.class);
        assertThatThrownBy(() -> storage.readdir("HEAD/x")).isInstanceOf(NotDirectoryException.class);
        assertThatThrownBy(() -> storage.readFile("HEAD/x"))
                .satisfies(e -> assertThat(e.getMessage()).isEqualTo("HEAD/x"));
    }

    @Test
    @DisplayName("rmdir 普通文件抛出 NotDirectoryException，不存在时抛出 NoSuchFileException")
    void rmdir_errors() throws Exception {
        storage.writeFile("HEAD", bytes("x"));
        assertThatThrownBy(() -> storage.rmdir("HEAD")).isInstanceOf(NotDirectoryException.class);
        assertThatThrownBy(() -> storage.rmdir("missing")).isInstanceOf(NoSuchFileException.class);
        assertThat(storage.readFile("HEAD")).isEqualTo(bytes("x"));
    }

    @Test
    @DisplayName("unlink 删除文件；不存在抛出 NoSuchFileException；目录抛出 Is a directory")
    void unlink() throws Exception {
        storage.writeFile("refs/heads/topic", bytes("x"));
        storage.unlink("refs/heads/topic");

        assertThatThrownBy(() -> storage.readFile("refs/heads/topic")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> storage.unlink("refs/heads/topic")).isInstanceOf(NoSuchFileException.class);
        storage.mkdir("refs/tags");
        assertThatThrownBy(() -> storage.unlink("refs/tags")).matches(StorageErrors::isDirectoryError);
    }

    @Test
    @DisplayName("stat 普通文件：类型、大小与类型位")
    void stat_regularFile() throws Exception {
        storage.writeFile("packed-refs", bytes("12345"));
        EntryStats stats = storage.stat("packed-refs");

        assertThat(stats.getType()).isEqualTo(EntryType.FILE);
        assertThat(stats.isFile()).isTrue();
        assertThat(stats.isDirectory()).isFalse();
        assertThat(stats.isSymbolicLink()).isFalse();
        assertThat(stats.getSize()).isEqualTo(5L);
        assertThat(stats.getMode() & EntryStats.S_IFMT).isEqualTo(EntryStats.S_IFREG);
        assertThat(stats.getMtimeMs()).isPositive();
    }

    @Test
    @DisplayName("stat 目录与仓库根")
    void stat_directoryAndRoot() throws Exception {
        storage.mkdir("objects/pack");
        EntryStats dir = storage.stat("objects/pack");
        assertThat(dir.isDirectory()).isTrue();
        assertThat(dir.getMode() & EntryStats.S_IFMT).isEqualTo(EntryStats.S_IFDIR);

        assertThat(storage.stat("").isDirectory()).isTrue();
        assertThat(storage.lstat("/").isDirectory()).isTrue();
    }

    @Test
    @DisplayName("stat 不存在的路径抛出 NoSuchFileException")
    void stat_missing() {
        assertThatThrownBy(() -> storage.stat("nope")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> storage.lstat("nope")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("symlink 后 readlink 返回原目标，lstat 报告链接，stat 与 readFile 跟随链接")
    void symlink_roundTrip() throws Exception {
        storage.writeFile("refs/heads/main", bytes("0123456789"));
        storage.symlink("refs/heads/main", "HEAD");

        assertThat(storage.readlink("HEAD")).isEqualTo("refs/heads/main");
        EntryStats link = storage.lstat("HEAD");
        assertThat(link.isSymbolicLink()).isTrue();
        assertThat(link.getType()).isEqualTo(EntryType.SYMLINK);
        assertThat(link.getMode() & EntryStats.S_IFMT).isEqualTo(EntryStats.S_IFLNK);

        EntryStats target = storage.stat("HEAD");
        assertThat(target.isFile()).isTrue();
        assertThat(target.getSize()).isEqualTo(10L);
        assertThat(storage.readFile("HEAD")).isEqualTo(bytes("0123456789"));
    }

    @Test
    @DisplayName("链接目标相对链接所在目录解析")
    void symlink_relativeToLinkDirectory() throws Exception {
        storage.writeFile("refs/heads/main", bytes("abc"));
        storage.mkdir("refs/tags");
        storage.symlink("../heads/main", "refs/tags/latest-main");

        assertThat(storage.readFile("refs/tags/latest-main")).isEqualTo(bytes("abc"));
        assertThat(storage.readdir("refs/tags")).containsExactly("latest-main");
    }

    @Test
    @DisplayName("目标指向仓库外或为绝对路径的链接被拒绝，且不会创建")
    void symlink_escapingTarget_rejected() throws Exception {
        assertThatThrownBy(() -> storage.symlink("../../../etc/passwd", "refs/evil"))
                .isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.symlink("/etc/passwd", "evil"))
                .isInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.lstat("refs/evil")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> storage.lstat("evil")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("在已存在的路径上创建链接抛出 FileAlreadyExistsException")
    void symlink_existingPath() throws Exception {
        storage.writeFile("HEAD", bytes("x"));
        assertThatThrownBy(() -> storage.symlink("refs/heads/main", "HEAD"))
                .isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    @DisplayName("链接所在目录不存在时抛出 NoSuchFileException")
    void symlink_missingParent() {
        assertThatThrownBy(() -> storage.symlink("../HEAD", "refs/missing/link"))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("readlink 普通文件抛出 NotLinkException，不存在抛出 NoSuchFileException")
    void readlink_errors() throws Exception {
        storage.writeFile("HEAD", bytes("x"));
        assertThatThrownBy(() -> storage.readlink("HEAD")).isInstanceOf(NotLinkException.class);
        assertThatThrownBy(() -> storage.readlink("missing")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("悬空链接：lstat 成功，readFile 与 stat 抛出 NoSuchFileException")
    void symlink_dangling() throws Exception {
        storage.symlink("refs/heads/later", "HEAD");

        assertThat(storage.lstat("HEAD").isSymbolicLink()).isTrue();
        assertThatThrownBy(() -> storage.readFile("HEAD")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> storage.stat("HEAD")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("unlink 删除链接本身，不影响目标")
    void unlink_symlink() throws Exception {
        storage.writeFile("refs/heads/main", bytes("abc"));
        storage.symlink("refs/heads/main", "HEAD");
        storage.unlink("HEAD");

        assertThatThrownBy(() -> storage.lstat("HEAD")).isInstanceOf(NoSuchFileException.class);
        assertThat(storage.readFile("refs/heads/main")).isEqualTo(bytes("abc"));
    }

    @Test
    @DisplayName("每个操作都拒绝越界路径，抛出 PathTraversalException 而不是 NoSuchFileException")
    void everyOperation_rejectsTraversal() {
        String evil = "../../etc/passwd";
        assertThatThrownBy(() -> storage.readFile(evil)).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.writeFile(evil, bytes("x"))).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.unlink(evil)).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.readdir("..")).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.mkdir("../outside")).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.rmdir("..")).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.stat(evil)).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.lstat(evil)).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.readlink(evil)).isExactlyInstanceOf(PathTraversalException.class);
        assertThatThrownBy(() -> storage.symlink("HEAD", "../link")).isExactlyInstanceOf(PathTraversalException.class);
    }

    @Test
    @DisplayName("开头带分隔符与反斜杠的路径与普通相对路径等价")
    void separatorsNormalized() throws Exception {
        storage.writeFile("\\refs\\heads\\main", bytes("abc"));
        assertThat(storage.readFile("/refs/heads/main")).isEqualTo(bytes("abc"));
        assertThat(storage.readFile("refs//heads/./main")).isEqualTo(bytes("abc"));
    }

    @Test
    @DisplayName("写入已存在的链接时替换链接本身")
    void writeFile_replacesSymlink() throws Exception {
        storage.writeFile("refs/heads/main", bytes("target"));
        storage.symlink("refs/heads/main", "HEAD");
        storage.writeFile("HEAD", bytes("plain"));

        assertThat(storage.lstat("HEAD").isFile()).isTrue();
        assertThat(storage.readFile("HEAD")).isEqualTo(bytes("plain"));
        assertThat(storage.readFile("refs/heads/main")).isEqualTo(bytes("target"));
    }
}
