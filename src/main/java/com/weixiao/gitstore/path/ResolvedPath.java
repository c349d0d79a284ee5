package com.weixiao.gitstore.path;

import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 经 {@link PathSanitizer} 校验后的路径：保证等于仓库根或位于仓库根之下。
 * 所有字段均为规范化后的字符串，分隔符统一为 '/'。
 */
@Value
public class ResolvedPath {

    /** 规范化后的仓库根，如 "/data/repo-42"。 */
    String root;

    /** 规范化后的绝对路径，如 "/data/repo-42/refs/heads/main"。 */
    String value;

    /** 相对仓库根的部分，如 "refs/heads/main"；指向根本身时为空串。 */
    String relative;

    public boolean isRoot() {
        return relative.isEmpty();
    }

    /** 最后一段名称；根返回空串。 */
    public String getName() {
        int slash = relative.lastIndexOf('/');
        return slash < 0 ? relative : relative.substring(slash + 1);
    }

    /** 父目录的相对路径；根及根下一级条目返回空串。 */
    public String getParentRelative() {
        int slash = relative.lastIndexOf('/');
        return slash < 0 ? "" : relative.substring(0, slash);
    }

    /** 转为本地文件系统路径。 */
    public Path toPath() {
        return Paths.get(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
