package com.weixiao.gitstore.path;

import java.io.IOException;

/**
 * 路径越界：请求的相对路径在规范化后落到仓库根之外。
 * 与 {@link java.nio.file.NoSuchFileException} 等"不存在"类错误严格区分，调用方应按安全事件处理，不可重试。
 * 消息中只包含请求的相对路径（已转义控制字符），不包含仓库根等内部布局。
 */
public class PathTraversalException extends IOException {

    private final String requestedPath;

    public PathTraversalException(String requestedPath) {
        super("path escapes repository root: \"" + PathSanitizer.printable(requestedPath) + "\"");
        this.requestedPath = requestedPath;
    }

    /** 调用方传入的原始路径（未清洗）。 */
    public String getRequestedPath() {
        return requestedPath;
    }
}
