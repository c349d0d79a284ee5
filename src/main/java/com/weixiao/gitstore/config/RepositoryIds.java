package com.weixiao.gitstore.config;

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * 仓库 id 校验：只允许字母、数字与连字符，保证由 id 拼出的目录名或 key 前缀不含分隔符与 '..'。
 */
@UtilityClass
public class RepositoryIds {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9-]{1,128}$");

    public static boolean isValid(String id) {
        return id != null && VALID.matcher(id).matches();
    }

    /**
     * 校验并返回 id。
     *
     * @throws IllegalArgumentException id 不合法
     */
    public static String validate(String id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException("invalid repository id - only alphanumeric characters and hyphens allowed");
        }
        return id;
    }
}
