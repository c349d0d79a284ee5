package com.weixiao.gitstore.storage;

import lombok.Value;

/**
 * stat/lstat 的结果：类型、权限位（含类型位，如 0100644）、字节大小、最后修改时间（毫秒）。
 * isFile/isDirectory/isSymbolicLink 在构造时一次算好，不会再去查询存储。
 */
@Value
public class EntryStats {

    /** 类型位掩码与取值，与 POSIX st_mode 一致。 */
    public static final int S_IFMT = 0170000;
    public static final int S_IFREG = 0100000;
    public static final int S_IFDIR = 0040000;
    public static final int S_IFLNK = 0120000;

    EntryType type;
    int mode;
    long size;
    long mtimeMs;
    boolean file;
    boolean directory;
    boolean symbolicLink;

    public static EntryStats of(EntryType type, int mode, long size, long mtimeMs) {
        return new EntryStats(type, mode, size, mtimeMs,
                type == EntryType.FILE, type == EntryType.DIRECTORY, type == EntryType.SYMLINK);
    }

    /** 仅权限部分（低 12 位），如 0644。 */
    public int getPermissions() {
        return mode & 07777;
    }
}
