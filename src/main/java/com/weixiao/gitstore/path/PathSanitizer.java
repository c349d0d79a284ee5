package com.weixiao.gitstore.path;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * 路径清洗：把不可信的相对路径解析为仓库根之下的绝对路径，越界则抛出 {@link PathTraversalException}。
 * <p>
 * 只在字符串层面规范化（'.'、'..'、重复分隔符），不访问磁盘、不解引用符号链接。
 * '\\' 与 '/' 在所有平台上都视为同一分隔符，保证同一输入在不同平台得到相同结果。
 */
@UtilityClass
public class PathSanitizer {

    private static final Logger securityLog = LoggerFactory.getLogger("com.weixiao.gitstore.security");

    private static final char SEPARATOR = '/';
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:(/|$)");

    /**
     * 以本地目录为根解析。
     */
    public static ResolvedPath resolve(Path root, String relativePath) throws PathTraversalException {
        return resolve(root.toAbsolutePath().toString(), relativePath);
    }

    /**
     * 将 relativePath 解析到 root 之下。
     * 步骤：去掉 NUL 字符；开头的分隔符视为"相对仓库根"而非文件系统绝对路径；拼接后规范化；
     * 结果必须等于规范化后的 root 或以 root + "/" 开头。
     * 例：root=/data/repo-42，"refs/heads/main" → /data/repo-42/refs/heads/main；"../../etc/passwd" → 拒绝。
     *
     * @param root         仓库根，必须是绝对路径（"/..." 或 "C:/..."）
     * @param relativePath 不可信输入；null 视为空串
     * @throws PathTraversalException 规范化结果不在 root 之内
     */
    public static ResolvedPath resolve(String root, String relativePath) throws PathTraversalException {
        String canonicalRoot = canonicalize(root);
        if (!isAbsolute(canonicalRoot)) {
            throw new IllegalArgumentException("repository root must be absolute: " + root);
        }
        String cleaned = relativePath == null ? "" : relativePath.replace("\0", "").replace('\\', SEPARATOR);

        // 已解析过的绝对路径再次解析时保持不变
        if (!cleaned.isEmpty() && cleaned.charAt(0) == SEPARATOR) {
            String asAbsolute = canonicalize(cleaned);
            if (isWithin(asAbsolute, canonicalRoot)) {
                return toResolved(canonicalRoot, asAbsolute);
            }
        }

        int start = 0;
        while (start < cleaned.length() && cleaned.charAt(start) == SEPARATOR) {
            start++;
        }
        String stripped = cleaned.substring(start);
        String candidate = canonicalize(stripped.isEmpty() ? canonicalRoot : canonicalRoot + SEPARATOR + stripped);
        if (!isWithin(candidate, canonicalRoot)) {
            securityLog.warn("path traversal rejected: requested=\"{}\" root={}", printable(relativePath), canonicalRoot);
            throw new PathTraversalException(relativePath);
        }
        return toResolved(canonicalRoot, candidate);
    }

    /**
     * 字符串层面的规范化：统一分隔符，去掉空段与 '.'，折叠 '..'。
     * 绝对路径越过根的 '..' 被丢弃（与 "/.." == "/" 一致）；相对路径开头无法折叠的 '..' 保留。
     * 例："/a/./b//../c" → "/a/c"；"a/../../b" → "../b"；"C:\\x\\..\\y" → "C:/y"。
     */
    public static String canonicalize(String path) {
        String p = path.replace('\\', SEPARATOR);
        String prefix;
        String rest;
        if (DRIVE_PREFIX.matcher(p).find()) {
            prefix = p.substring(0, 2) + SEPARATOR;
            rest = p.substring(2);
        } else if (!p.isEmpty() && p.charAt(0) == SEPARATOR) {
            prefix = String.valueOf(SEPARATOR);
            rest = p;
        } else {
            prefix = "";
            rest = p;
        }

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : rest.split(String.valueOf(SEPARATOR))) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
                    segments.removeLast();
                } else if (prefix.isEmpty()) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }
        return prefix + String.join(String.valueOf(SEPARATOR), segments);
    }

    /**
     * 日志与错误消息用：把控制字符替换为 \\uXXXX，避免日志注入。
     */
    public static String printable(String input) {
        if (input == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (Character.isISOControl(c)) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isAbsolute(String canonical) {
        return (!canonical.isEmpty() && canonical.charAt(0) == SEPARATOR) || DRIVE_PREFIX.matcher(canonical).find();
    }

    private static boolean isWithin(String candidate, String root) {
        if (candidate.equals(root)) {
            return true;
        }
        String rootWithSeparator = root.charAt(root.length() - 1) == SEPARATOR ? root : root + SEPARATOR;
        return candidate.startsWith(rootWithSeparator);
    }

    private static ResolvedPath toResolved(String root, String value) {
        String relative;
        if (value.equals(root)) {
            relative = "";
        } else if (root.charAt(root.length() - 1) == SEPARATOR) {
            relative = value.substring(root.length());
        } else {
            relative = value.substring(root.length() + 1);
        }
        return new ResolvedPath(root, value, relative);
    }
}
