package com.weixiao.gitstore.storage;

import com.weixiao.gitstore.objectstore.ObjectInfo;
import com.weixiao.gitstore.objectstore.ObjectStore;
import com.weixiao.gitstore.objectstore.StoredObject;
import com.weixiao.gitstore.path.PathSanitizer;
import com.weixiao.gitstore.path.ResolvedPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.NotLinkException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * 对象存储实现：在扁平 key 空间上模拟目录、符号链接与 POSIX 元数据。
 * <p>
 * 路径映射：仓库内路径 p 对应 key "keyPrefix/p"，分隔符保持 '/'。
 * <ul>
 *   <li>目录不是对象。mkdir 为目录及其尚无 key 的祖先各写一个零字节的标记 key "dir/"，让空目录也能被 readdir/stat 看到；
 *       readdir 列出 "dir/" 下所有 key，取前缀后的第一段并去重；rmdir 删除前缀下的全部 key。</li>
 *   <li>符号链接是内容为目标路径、带 {@value #TYPE_METADATA}={@value #SYMLINK_TYPE} 元数据的对象。
 *       只支持末端为链接的路径，中间段为链接的路径不会被解析。</li>
 *   <li>权限位无法持久化，stat 返回固定值（文件 0100644、链接 0120777、目录 040755），writeFile 的 mode 被忽略。
 *       这是有损的转换。</li>
 * </ul>
 * 底层存储必须对单个 key 提供强一致的写后读。
 */
public final class ObjectStoreAdapter implements StorageAdapter {

    private static final Logger log = LoggerFactory.getLogger(ObjectStoreAdapter.class);

    public static final String TYPE_METADATA = "gitstore-type";
    public static final String SYMLINK_TYPE = "symlink";

    static final int FILE_MODE = EntryStats.S_IFREG | 0644;
    static final int SYMLINK_MODE = EntryStats.S_IFLNK | 0777;
    static final int DIRECTORY_MODE = EntryStats.S_IFDIR | 0755;

    /** 与 Linux 的 MAXSYMLINKS 一致。 */
    private static final int MAX_SYMLINK_HOPS = 40;

    private static final byte[] EMPTY = new byte[0];

    private final ObjectStore store;
    private final String keyPrefix;
    private final String virtualRoot;

    /**
     * @param store     底层对象存储
     * @param keyPrefix 本仓库的 key 前缀，如 "repos/repo-42"；空串表示整个存储就是一个仓库
     */
    public ObjectStoreAdapter(ObjectStore store, String keyPrefix) {
        String canonical = PathSanitizer.canonicalize(keyPrefix == null ? "" : keyPrefix);
        while (canonical.startsWith("/")) {
            canonical = canonical.substring(1);
        }
        if (canonical.equals("..") || canonical.startsWith("../")) {
            throw new IllegalArgumentException("invalid key prefix: " + keyPrefix);
        }
        this.store = store;
        this.keyPrefix = canonical;
        this.virtualRoot = "/" + canonical;
    }

    @Override
    public byte[] readFile(String path) throws IOException {
        ResolvedPath requested = resolve(path);
        ResolvedPath current = requested;
        for (int hop = 0; hop <= MAX_SYMLINK_HOPS; hop++) {
            Optional<StoredObject> object = current.isRoot() ? Optional.empty() : store.get(key(current));
            if (!object.isPresent()) {
                if (isDirectory(current)) {
                    throw StorageErrors.isADirectory(requested);
                }
                throw notFound(current, requested);
            }
            StoredObject stored = object.get();
            if (!isSymlink(stored.getInfo())) {
                log.debug("readFile {} size={}", requested.getRelative(), stored.getData().length);
                return stored.getData();
            }
            current = LinkTargets.resolve(current, new String(stored.getData(), StandardCharsets.UTF_8));
        }
        throw new FileSystemLoopException(StorageErrors.display(requested));
    }

    /**
     * 单次 put 写入，对象要么完整可见要么不存在。已存在的符号链接会被替换为普通文件（与本地实现的原子移动一致）。
     */
    @Override
    public void writeFile(String path, byte[] data, Integer mode) throws IOException {
        ResolvedPath resolved = resolve(path);
        if (resolved.isRoot() || isDirectory(resolved)) {
            throw StorageErrors.isADirectory(resolved);
        }
        checkAncestorsAreDirectories(resolved);
        store.put(key(resolved), data, Collections.emptyMap());
        log.debug("writeFile {} size={} mode={}", resolved.getRelative(), data.length,
                mode == null ? "default" : Integer.toOctalString(mode) + " (ignored)");
    }

    @Override
    public void unlink(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        if (!resolved.isRoot() && store.head(key(resolved)).isPresent()) {
            store.delete(key(resolved));
            log.debug("unlink {}", resolved.getRelative());
            return;
        }
        if (isDirectory(resolved)) {
            throw StorageErrors.isADirectory(resolved);
        }
        throw notFound(resolved, resolved);
    }

    /**
     * 列出 "dir/" 前缀下的所有 key，取前缀之后的第一段并去重：既包含直接文件，也包含下一级子目录名。
     */
    @Override
    public List<String> readdir(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        if (!resolved.isRoot() && store.head(key(resolved)).isPresent()) {
            throw new NotDirectoryException(StorageErrors.display(resolved));
        }
        String prefix = directoryPrefix(resolved);
        List<ObjectInfo> objects = store.list(prefix);
        if (objects.isEmpty() && !resolved.isRoot()) {
            throw notFound(resolved, resolved);
        }
        TreeSet<String> names = new TreeSet<>();
        for (ObjectInfo info : objects) {
            String rest = info.getKey().substring(prefix.length());
            if (rest.isEmpty()) {
                continue;
            }
            int slash = rest.indexOf('/');
            names.add(slash < 0 ? rest : rest.substring(0, slash));
        }
        log.debug("readdir {} count={}", resolved.getRelative(), names.size());
        return new ArrayList<>(names);
    }

    /**
     * 写入目录标记 key。非递归时父目录必须已存在；递归时为还没有任何 key 的祖先也写入标记，
     * 这样 rmdir 子目录后祖先目录仍然存在，与本地实现一致。
     */
    @Override
    public void mkdir(String path, boolean recursive) throws IOException {
        ResolvedPath resolved = resolve(path);
        if (resolved.isRoot()) {
            if (recursive) {
                return;
            }
            throw new FileAlreadyExistsException(StorageErrors.display(resolved));
        }
        if (store.head(key(resolved)).isPresent()) {
            throw new FileAlreadyExistsException(StorageErrors.display(resolved));
        }
        if (isDirectory(resolved)) {
            if (recursive) {
                return;
            }
            throw new FileAlreadyExistsException(StorageErrors.display(resolved));
        }
        checkAncestorsAreDirectories(resolved);
        if (!recursive) {
            ResolvedPath parent = PathSanitizer.resolve(virtualRoot, resolved.getParentRelative());
            if (!isDirectory(parent)) {
                throw new NoSuchFileException(StorageErrors.display(resolved));
            }
        }
        if (recursive) {
            String relative = resolved.getRelative();
            for (int slash = relative.indexOf('/'); slash >= 0; slash = relative.indexOf('/', slash + 1)) {
                ResolvedPath ancestor = PathSanitizer.resolve(virtualRoot, relative.substring(0, slash));
                if (!isDirectory(ancestor)) {
                    store.put(directoryPrefix(ancestor), EMPTY, Collections.emptyMap());
                }
            }
        }
        store.put(directoryPrefix(resolved), EMPTY, Collections.emptyMap());
        log.debug("mkdir {} recursive={}", resolved.getRelative(), recursive);
    }

    /**
     * 对象存储没有"目录必须为空"的概念，这里删除前缀下的全部 key（含目录标记）。
     */
    @Override
    public void rmdir(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        if (!resolved.isRoot() && store.head(key(resolved)).isPresent()) {
            throw new NotDirectoryException(StorageErrors.display(resolved));
        }
        List<ObjectInfo> objects = store.list(directoryPrefix(resolved));
        if (objects.isEmpty()) {
            if (resolved.isRoot()) {
                return;
            }
            throw notFound(resolved, resolved);
        }
        List<String> keys = new ArrayList<>(objects.size());
        for (ObjectInfo info : objects) {
            keys.add(info.getKey());
        }
        store.deleteAll(keys);
        log.debug("rmdir {} removed={}", resolved.getRelative(), keys.size());
    }

    @Override
    public EntryStats stat(String path) throws IOException {
        ResolvedPath requested = resolve(path);
        ResolvedPath current = requested;
        for (int hop = 0; hop <= MAX_SYMLINK_HOPS; hop++) {
            Optional<ObjectInfo> info = current.isRoot() ? Optional.empty() : store.head(key(current));
            if (!info.isPresent()) {
                return directoryStats(current, requested);
            }
            if (!isSymlink(info.get())) {
                return EntryStats.of(EntryType.FILE, FILE_MODE, info.get().getSize(), info.get().getLastModifiedMillis());
            }
            current = LinkTargets.resolve(current, readTarget(current, requested));
        }
        throw new FileSystemLoopException(StorageErrors.display(requested));
    }

    /**
     * 先检查符号链接标记再决定类型，不解引用链接。
     */
    @Override
    public EntryStats lstat(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        Optional<ObjectInfo> info = resolved.isRoot() ? Optional.empty() : store.head(key(resolved));
        if (!info.isPresent()) {
            return directoryStats(resolved, resolved);
        }
        ObjectInfo object = info.get();
        if (isSymlink(object)) {
            return EntryStats.of(EntryType.SYMLINK, SYMLINK_MODE, object.getSize(), object.getLastModifiedMillis());
        }
        return EntryStats.of(EntryType.FILE, FILE_MODE, object.getSize(), object.getLastModifiedMillis());
    }

    @Override
    public String readlink(String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        return readTarget(resolved, resolved);
    }

    /**
     * 与 symlink(2) 一致，所在目录必须已存在。
     */
    @Override
    public void symlink(String target, String path) throws IOException {
        ResolvedPath resolved = resolve(path);
        LinkTargets.resolve(resolved, target);
        if (resolved.isRoot() || store.head(key(resolved)).isPresent() || isDirectory(resolved)) {
            throw new FileAlreadyExistsException(StorageErrors.display(resolved));
        }
        checkAncestorsAreDirectories(resolved);
        if (!isDirectory(PathSanitizer.resolve(virtualRoot, resolved.getParentRelative()))) {
            throw new NoSuchFileException(StorageErrors.display(resolved));
        }
        store.put(key(resolved), target.getBytes(StandardCharsets.UTF_8), Map.of(TYPE_METADATA, SYMLINK_TYPE));
        log.debug("symlink {} -> {}", resolved.getRelative(), target);
    }

    /**
     * 本仓库的 key 前缀。
     */
    public String getKeyPrefix() {
        return keyPrefix;
    }

    private ResolvedPath resolve(String path) throws IOException {
        return PathSanitizer.resolve(virtualRoot, path);
    }

    private String key(ResolvedPath path) {
        if (path.isRoot()) {
            return keyPrefix;
        }
        return keyPrefix.isEmpty() ? path.getRelative() : keyPrefix + "/" + path.getRelative();
    }

    private String directoryPrefix(ResolvedPath path) {
        String key = key(path);
        return key.isEmpty() ? "" : key + "/";
    }

    private boolean isDirectory(ResolvedPath path) throws IOException {
        return path.isRoot() || store.anyWithPrefix(directoryPrefix(path));
    }

    private static boolean isSymlink(ObjectInfo info) {
        return SYMLINK_TYPE.equals(info.getMetadata().get(TYPE_METADATA));
    }

    /**
     * 读取链接对象并校验标记；普通文件或目录抛出 NotLinkException，与本地实现一致。
     */
    private String readTarget(ResolvedPath link, ResolvedPath requested) throws IOException {
        Optional<StoredObject> object = link.isRoot() ? Optional.empty() : store.get(key(link));
        if (!object.isPresent()) {
            if (isDirectory(link)) {
                throw new NotLinkException(StorageErrors.display(requested));
            }
            throw notFound(link, requested);
        }
        if (!isSymlink(object.get().getInfo())) {
            throw new NotLinkException(StorageErrors.display(requested));
        }
        return new String(object.get().getData(), StandardCharsets.UTF_8);
    }

    /**
     * 目录的 stat：大小 0，修改时间取目录标记的时间（没有标记则为 0）。
     */
    private EntryStats directoryStats(ResolvedPath path, ResolvedPath requested) throws IOException {
        if (!isDirectory(path)) {
            throw notFound(path, requested);
        }
        long mtime = 0L;
        if (!path.isRoot()) {
            Optional<ObjectInfo> marker = store.head(directoryPrefix(path));
            if (marker.isPresent()) {
                mtime = marker.get().getLastModifiedMillis();
            }
        }
        return EntryStats.of(EntryType.DIRECTORY, DIRECTORY_MODE, 0L, mtime);
    }

    /**
     * 任一祖先是已存在的对象（文件或链接）时，路径无法作为目录使用，与 ENOTDIR 一致。
     */
    private void checkAncestorsAreDirectories(ResolvedPath path) throws IOException {
        if (hasObjectAncestor(path)) {
            throw new NotDirectoryException(StorageErrors.display(path));
        }
    }

    /**
     * 路径不存在时的异常：祖先是文件或链接时为 NotDirectoryException（ENOTDIR），否则为 NoSuchFileException。
     */
    private IOException notFound(ResolvedPath path, ResolvedPath requested) throws IOException {
        if (hasObjectAncestor(path)) {
            return new NotDirectoryException(StorageErrors.display(requested));
        }
        return new NoSuchFileException(StorageErrors.display(requested));
    }

    private boolean hasObjectAncestor(ResolvedPath path) throws IOException {
        String relative = path.getRelative();
        for (int slash = relative.indexOf('/'); slash >= 0; slash = relative.indexOf('/', slash + 1)) {
            ResolvedPath ancestor = PathSanitizer.resolve(virtualRoot, relative.substring(0, slash));
            if (store.head(key(ancestor)).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
