package com.weixiao.gitstore.storage;

import com.weixiao.gitstore.path.PathSanitizer;
import com.weixiao.gitstore.path.PathTraversalException;
import com.weixiao.gitstore.path.ResolvedPath;
import lombok.experimental.UtilityClass;

/**
 * 符号链接目标的解析：目标必须是相对路径，相对链接所在目录解析后仍在仓库根内。
 */
@UtilityClass
class LinkTargets {

    /**
     * 例：链接 refs/current，目标 "heads/main" → refs/heads/main；目标 "../../x" → 越界；目标 "/etc" → 越界。
     */
    static ResolvedPath resolve(ResolvedPath link, String target) throws PathTraversalException {
        if (target == null || target.isEmpty() || target.indexOf('\0') >= 0) {
            throw new PathTraversalException(target);
        }
        String normalized = target.replace('\\', '/');
        if (normalized.charAt(0) == '/' || normalized.matches("^[A-Za-z]:.*")) {
            throw new PathTraversalException(target);
        }
        String parent = link.getParentRelative();
        return PathSanitizer.resolve(link.getRoot(), parent.isEmpty() ? normalized : parent + "/" + normalized);
    }
}
