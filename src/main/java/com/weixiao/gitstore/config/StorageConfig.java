package com.weixiao.gitstore.config;

import lombok.Value;
import lombok.With;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 存储配置：选择后端、本地根目录、S3 连接参数与字节预算。
 * <p>
 * 取值优先级：JVM 系统属性 &gt; 环境变量 &gt; classpath 上的 gitstore.properties &gt; 内置默认值。
 * 环境变量名由属性名转换而来（gitstore.s3.endpoint → GITSTORE_S3_ENDPOINT），
 * 另外兼容 GIT_STORAGE_PATH 与 MINIO_* 这些部署中已有的变量名。
 */
@Value
@With
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    public static final String RESOURCE = "gitstore.properties";

    public static final String BACKEND = "gitstore.backend";
    public static final String LOCAL_BASE_DIR = "gitstore.local.base-dir";
    public static final String S3_ENDPOINT = "gitstore.s3.endpoint";
    public static final String S3_PORT = "gitstore.s3.port";
    public static final String S3_USE_SSL = "gitstore.s3.use-ssl";
    public static final String S3_ACCESS_KEY = "gitstore.s3.access-key";
    public static final String S3_SECRET_KEY = "gitstore.s3.secret-key";
    public static final String S3_BUCKET = "gitstore.s3.bucket";
    public static final String S3_KEY_PREFIX = "gitstore.s3.key-prefix";
    public static final String MAX_PUSH_BYTES = "gitstore.limits.max-push-bytes";
    public static final String MAX_FETCH_BYTES = "gitstore.limits.max-fetch-bytes";

    /** receive-pack（push）请求体默认上限 500 MB。 */
    public static final long DEFAULT_MAX_PUSH_BYTES = 500L * 1024 * 1024;
    /** upload-pack（fetch/clone）请求体默认上限 10 MB。 */
    public static final long DEFAULT_MAX_FETCH_BYTES = 10L * 1024 * 1024;

    private static final Map<String, String> LEGACY_ENV = Map.of(
            LOCAL_BASE_DIR, "GIT_STORAGE_PATH",
            S3_ENDPOINT, "MINIO_ENDPOINT",
            S3_PORT, "MINIO_PORT",
            S3_USE_SSL, "MINIO_USE_SSL",
            S3_ACCESS_KEY, "MINIO_ACCESS_KEY",
            S3_SECRET_KEY, "MINIO_SECRET_KEY",
            S3_BUCKET, "MINIO_BUCKET_NAME");

    StorageBackend backend;
    Path localBaseDir;
    String s3Endpoint;
    int s3Port;
    boolean s3UseSsl;
    String s3AccessKey;
    String s3SecretKey;
    String s3Bucket;
    String s3KeyPrefix;
    long maxPushBytes;
    long maxFetchBytes;

    /**
     * 从当前进程的系统属性、环境变量与 classpath 资源加载。
     */
    public static StorageConfig load() {
        return load(System.getProperties(), System.getenv(), loadResource());
    }

    /**
     * 按优先级合并三个来源。
     *
     * @param system 系统属性
     * @param env    环境变量
     * @param file   配置文件内容
     */
    public static StorageConfig load(Properties system, Map<String, String> env, Properties file) {
        Sources sources = new Sources(system, env, file);
        StorageConfig config = new StorageConfig(
                StorageBackend.parse(sources.get(BACKEND, "local")),
                Paths.get(sources.get(LOCAL_BASE_DIR, "repos")).toAbsolutePath().normalize(),
                sources.get(S3_ENDPOINT, "localhost"),
                sources.getInt(S3_PORT, 9000),
                sources.getBoolean(S3_USE_SSL, false),
                sources.get(S3_ACCESS_KEY, null),
                sources.get(S3_SECRET_KEY, null),
                sources.get(S3_BUCKET, "gitstore"),
                sources.get(S3_KEY_PREFIX, "repos"),
                sources.getLong(MAX_PUSH_BYTES, DEFAULT_MAX_PUSH_BYTES),
                sources.getLong(MAX_FETCH_BYTES, DEFAULT_MAX_FETCH_BYTES));
        log.debug("storage config backend={} localBaseDir={} s3Endpoint={}:{} bucket={} maxPush={} maxFetch={}",
                config.backend.getId(), config.localBaseDir, config.s3Endpoint, config.s3Port, config.s3Bucket,
                config.maxPushBytes, config.maxFetchBytes);
        return config;
    }

    /**
     * 读取 classpath 上的 gitstore.properties；不存在时返回空配置。
     */
    static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream in = StorageConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + RESOURCE, e);
        }
        return props;
    }

    /**
     * 属性名转环境变量名：gitstore.s3.access-key → GITSTORE_S3_ACCESS_KEY。
     */
    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    /**
     * S3 后端必需的参数缺失时抛出 IllegalStateException。
     */
    public void requireS3Credentials() {
        if (s3AccessKey == null || s3AccessKey.isEmpty()) {
            throw new IllegalStateException(S3_ACCESS_KEY + " is required for the s3 backend");
        }
        if (s3SecretKey == null || s3SecretKey.isEmpty()) {
            throw new IllegalStateException(S3_SECRET_KEY + " is required for the s3 backend");
        }
    }

    @Override
    public String toString() {
        return "StorageConfig(backend=" + backend.getId() + ", localBaseDir=" + localBaseDir
                + ", s3Endpoint=" + s3Endpoint + ":" + s3Port + ", s3UseSsl=" + s3UseSsl
                + ", s3Bucket=" + s3Bucket + ", s3KeyPrefix=" + s3KeyPrefix
                + ", maxPushBytes=" + maxPushBytes + ", maxFetchBytes=" + maxFetchBytes + ")";
    }

    /** 三个来源的按优先级查找。 */
    private static final class Sources {
        private final Properties system;
        private final Map<String, String> env;
        private final Properties file;

        Sources(Properties system, Map<String, String> env, Properties file) {
            this.system = system;
            this.env = env;
            this.file = file;
        }

        /** 空白值视为未设置，继续查找下一个来源。 */
        String get(String key, String defaultValue) {
            String legacy = LEGACY_ENV.containsKey(key) ? env.get(LEGACY_ENV.get(key)) : null;
            for (String value : Arrays.asList(system.getProperty(key), env.get(envName(key)), legacy, file.getProperty(key))) {
                if (value != null && !value.trim().isEmpty()) {
                    return value.trim();
                }
            }
            return defaultValue;
        }

        int getInt(String key, int defaultValue) {
            String value = get(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer: " + value, e);
            }
        }

        long getLong(String key, long defaultValue) {
            String value = get(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new IllegalArgumentException(key + " must not be negative: " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number: " + value, e);
            }
        }

        boolean getBoolean(String key, boolean defaultValue) {
            String value = get(key, null);
            if (value == null) {
                return defaultValue;
            }
            if ("true".equalsIgnoreCase(value)) {
                return true;
            }
            if ("false".equalsIgnoreCase(value)) {
                return false;
            }
            throw new IllegalArgumentException(key + " must be \"true\" or \"false\": " + value);
        }
    }
}
