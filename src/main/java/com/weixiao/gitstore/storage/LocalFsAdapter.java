package com.weixiao.gitstore.storage;

import com.weixiao.gitstore.path.PathSanitizer;
import com.weixiao.gitstore.path.PathTraversalException;
import com.weixiao.gitstore.path.ResolvedPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 本地文件系统实现：路径经 PathSanitizer 解析后直接映射到 java.nio.file 操作。
 * 仓库根为 baseDir，布局与 git 原生的裸仓库一致。
 * <p>
 * 文本校验之外还按真实路径校验：跟随链接的操作（readFile、stat、readdir，以及 writeFile、mkdir 要建目录的位置）
 * 解析后的真实位置必须在 baseDir 的真实路径之下；symlink 的目标按链接所在目录的真实位置校验。
 */
public final class LocalFsAdapter implements StorageAdapter {

    private static final Logger log = LoggerFactory.getLogger(LocalFsAdapter.class);
    private static final Logger securityLog = LoggerFactory.getLogger("com.weixiao.gitstore.security");

    private static final LinkOption[] NOFOLLOW = {LinkOption.NOFOLLOW_LINKS};
    private static final LinkOption[] FOLLOW = {};

    private final Path baseDir;

    /**
     * 以给定目录为仓库根；目录不必已存在（writeFile/mkdir 会按需创建）。
     */
    public LocalFsAdapter(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    @Override
    public byte[] readFile(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        Path file = resolved.toPath();
        try {
            checkRealPathInside(resolved, file);
            if (Files.isDirectory(file)) {
                throw StorageErrors.isADirectory(resolved);
            }
            byte[] data = Files.readAllBytes(file);
            log.debug("readFile {} size={}", resolved.getRelative(), data.length);
            return data;
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    /**
     * 先写入同目录下的临时文件，再原子移动到目标位置，中途失败不会留下半个文件。
     */
    @Override
    public void writeFile(String path, byte[] data, Integer mode) throws IOException {
        ResolvedPath resolved = resolve(path);
        Path target = resolved.toPath();
        if (resolved.isRoot() || Files.isDirectory(target, NOFOLLOW)) {
            throw StorageErrors.isADirectory(resolved);
        }
        Path dir = target.getParent();
        try {
            checkNearestExistingAncestor(resolved, dir);
            if (!Files.isDirectory(dir)) {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
        Path temp = dir.resolve(".tmp_" + target.getFileName() + "_" + System.nanoTime() + "_" + Thread.currentThread().getId());
        try {
            Files.write(temp, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            if (mode != null) {
                applyMode(temp, mode);
            }
            moveIntoPlace(temp, target);
            log.debug("writeFile {} size={} mode={}", resolved.getRelative(), data.length,
                    mode == null ? "default" : Integer.toOctalString(mode));
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void unlink(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        Path file = resolved.toPath();
        if (Files.isDirectory(file, NOFOLLOW)) {
            throw StorageErrors.isADirectory(resolved);
        }
        try {
            Files.delete(file);
            log.debug("unlink {}", resolved.getRelative());
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    @Override
    public List<String> readdir(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        List<String> names = new ArrayList<>();
        try {
            checkRealPathInside(resolved, resolved.toPath());
            try (Stream<Path> stream = Files.list(resolved.toPath())) {
                for (Path p : (Iterable<Path>) stream::iterator) {
                    names.add(p.getFileName().toString());
                }
            }
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
        names.sort(null);
        log.debug("readdir {} count={}", resolved.getRelative(), names.size());
        return names;
    }

    @Override
    public void mkdir(String path, boolean recursive) throws IOException {
        ResolvedPath resolved = resolve(path);
        try {
            checkNearestExistingAncestor(resolved, resolved.toPath().getParent());
            if (recursive) {
                Files.createDirectories(resolved.toPath());
            } else {
                Files.createDirectory(resolved.toPath());
            }
            log.debug("mkdir {} recursive={}", resolved.getRelative(), recursive);
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    /**
     * 只删除空目录；非空目录抛出 DirectoryNotEmptyException，递归删除由调用方负责。
     */
    @Override
    public void rmdir(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        Path dir = resolved.toPath();
        try {
            BasicFileAttributes attrs = Files.readAttributes(dir, BasicFileAttributes.class, NOFOLLOW);
            if (!attrs.isDirectory()) {
                throw new NotDirectoryException(dir.toString());
            }
            Files.delete(dir);
            log.debug("rmdir {}", resolved.getRelative());
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    @Override
    public EntryStats stat(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        try {
            checkRealPathInside(resolved, resolved.toPath());
            return toStats(resolved.toPath(), FOLLOW);
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    @Override
    public EntryStats lstat(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        try {
            return toStats(resolved.toPath(), NOFOLLOW);
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    @Override
    public String readlink(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        try {
            return Files.readSymbolicLink(resolved.toPath()).toString().replace('\\', '/');
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    @Override
    public void symlink(String target, String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        LinkTargets.resolve(resolved, target);
        Path linkTarget = Paths.get(target.replace('\\', '/'));
        try {
            if (!resolved.isRoot()) {
                checkLinkTargetInside(resolved, linkTarget, target);
            }
            Files.createSymbolicLink(resolved.toPath(), linkTarget);
            log.debug("symlink {} -> {}", resolved.getRelative(), target);
        } catch (IOException e) {
            throw StorageErrors.relativize(e, resolved);
        }
    }

    /**
     * 仓库根目录路径。
     */
    public Path getBaseDir() {
        return baseDir;
    }

    private ResolvedPath resolve(String path) throws IOException {
        return PathSanitizer.resolve(baseDir, path);
    }

    /**
     * 已存在的路径跟随所有链接后，真实位置必须仍在仓库根之下；不存在的路径交给后续操作报错。
     */
    private void checkRealPathInside(ResolvedPath resolved, Path p) throws IOException {
        if (!Files.exists(p)) {
            return;
        }
        if (!p.toRealPath().startsWith(baseDir.toRealPath())) {
            securityLog.warn("path resolves outside repository root through a link: requested=\"{}\"",
                    PathSanitizer.printable(resolved.getRelative()));
            throw new PathTraversalException(resolved.getRelative());
        }
    }

    /**
     * 相对链接所在目录的真实位置解析目标。所在目录经过指向上层的链接时，文本上合法的 ".." 也可能越出仓库根。
     */
    private void checkLinkTargetInside(ResolvedPath resolved, Path linkTarget, String target) throws IOException {
        Path realParent = resolved.toPath().getParent().toRealPath();
        if (!realParent.resolve(linkTarget).normalize().startsWith(baseDir.toRealPath())) {
            securityLog.warn("symlink target escapes repository root: link=\"{}\" target=\"{}\"",
                    PathSanitizer.printable(resolved.getRelative()), PathSanitizer.printable(target));
            throw new PathTraversalException(target);
        }
    }

    /**
     * 从 dir 向上找到第一个已存在的路径，它必须是目录（或指向目录的链接），否则抛出 NotDirectoryException。
     * 与 ENOTDIR 一致，避免 createDirectories 在不同层级给出不同的异常类型。
     * 该路径在仓库根之下时，其真实位置也必须在仓库根之下，新目录只会建在仓库内。
     */
    private void checkNearestExistingAncestor(ResolvedPath resolved, Path dir) throws IOException {
        Path p = dir;
        while (p != null && !Files.exists(p, NOFOLLOW)) {
            p = p.getParent();
        }
        if (p == null) {
            return;
        }
        if (!Files.isDirectory(p)) {
            throw new NotDirectoryException(p.toString());
        }
        if (p.startsWith(baseDir)) {
            checkRealPathInside(resolved, p);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * 把原生属性翻译为 EntryStats。
     * 优先读取 unix:mode；不支持时（如 Windows）由类型与 POSIX 权限合成，仍不支持则按是否可执行给出默认值。
     */
    private static EntryStats toStats(Path p, LinkOption[] options) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class, options);
        EntryType type;
        int typeBits;
        if (attrs.isSymbolicLink()) {
            type = EntryType.SYMLINK;
            typeBits = EntryStats.S_IFLNK;
        } else if (attrs.isDirectory()) {
            type = EntryType.DIRECTORY;
            typeBits = EntryStats.S_IFDIR;
        } else {
            type = EntryType.FILE;
            typeBits = EntryStats.S_IFREG;
        }
        return EntryStats.of(type, readMode(p, type, typeBits, options), attrs.size(), attrs.lastModifiedTime().toMillis());
    }

    private static int readMode(Path p, EntryType type, int typeBits, LinkOption[] options) throws IOException {
        try {
            Object mode = Files.getAttribute(p, "unix:mode", options);
            if (mode instanceof Number) {
                return ((Number) mode).intValue();
            }
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            log.debug("unix:mode not available for {}: {}", p, e.getMessage());
        }
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(p, options);
            return typeBits | permissionsToMode(permissions);
        } catch (UnsupportedOperationException e) {
            switch (type) {
                case DIRECTORY:
                    return typeBits | 0755;
                case SYMLINK:
                    return typeBits | 0777;
                default:
                    return typeBits | (Files.isExecutable(p) ? 0755 : 0644);
            }
        }
    }

    /**
     * 设置 POSIX 权限；文件系统不支持时忽略权限位。
     */
    private static void applyMode(Path p, int mode) throws IOException {
        try {
            Files.setPosixFilePermissions(p, modeToPermissions(mode));
        } catch (UnsupportedOperationException e) {
            log.debug("posix permissions not supported, mode {} ignored for {}", Integer.toOctalString(mode), p);
        }
    }

    private static final PosixFilePermission[] PERMISSION_BITS = {
            PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE,
            PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE,
    };

    /**
     * POSIX 权限集合转为八进制权限位，如 rw-r--r-- → 0644。
     */
    static int permissionsToMode(Set<PosixFilePermission> permissions) {
        int mode = 0;
        for (int i = 0; i < PERMISSION_BITS.length; i++) {
            if (permissions.contains(PERMISSION_BITS[i])) {
                mode |= 1 << (8 - i);
            }
        }
        return mode;
    }

    static Set<PosixFilePermission> modeToPermissions(int mode) {
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < PERMISSION_BITS.length; i++) {
            if ((mode & (1 << (8 - i))) != 0) {
                permissions.add(PERMISSION_BITS[i]);
            }
        }
        return permissions;
    }
}
