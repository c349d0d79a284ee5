package com.weixiao.gitstore.config;

import java.util.Locale;

/**
 * 存储后端：本地文件系统或 S3 兼容对象存储。
 */
public enum StorageBackend {
    LOCAL("local"),
    S3("s3");

    private final String id;

    StorageBackend(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * 按配置值解析，大小写不敏感；"minio"、"object-store" 视为 s3。
     */
    public static StorageBackend parse(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "local":
            case "fs":
                return LOCAL;
            case "s3":
            case "minio":
            case "object-store":
                return S3;
            default:
                throw new IllegalArgumentException("unknown storage backend: " + value);
        }
    }
}
