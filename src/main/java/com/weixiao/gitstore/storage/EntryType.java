package com.weixiao.gitstore.storage;

/**
 * 条目类型：普通文件、目录、符号链接。
 */
public enum EntryType {
    FILE,
    DIRECTORY,
    SYMLINK
}
