package com.weixiao.gitstore.objectstore;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.RemoveObjectsArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import io.minio.messages.DeleteError;
import io.minio.messages.DeleteObject;
import io.minio.messages.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * S3 兼容对象存储（MinIO、AWS S3 等），通过 MinIO Java SDK 访问。
 * <p>
 * AWS S3 与 MinIO 对单个 key 都提供强一致的写后读，满足 {@link ObjectStore} 的要求；
 * 接入其它 S3 兼容服务前需确认其一致性模型。
 */
public final class MinioObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(MinioObjectStore.class);

    private static final String NO_SUCH_KEY = "NoSuchKey";
    private static final String USER_METADATA_PREFIX = "x-amz-meta-";

    private final MinioClient client;
    private final String bucket;

    public MinioObjectStore(MinioClient client, String bucket) {
        this.client = client;
        this.bucket = bucket;
    }

    /**
     * 按连接参数创建客户端。
     */
    public static MinioClient buildClient(String endpoint, int port, boolean useSsl, String accessKey, String secretKey) {
        return MinioClient.builder()
                .endpoint(endpoint, port, useSsl)
                .credentials(accessKey, secretKey)
                .build();
    }

    /**
     * bucket 不存在时创建。
     */
    public void ensureBucket() throws IOException {
        boolean exists = execute("bucketExists", bucket,
                () -> client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build()));
        if (exists) {
            log.info("bucket {} already exists", bucket);
            return;
        }
        execute("makeBucket", bucket, () -> {
            client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            return null;
        });
        log.info("bucket {} created", bucket);
    }

    @Override
    public void put(String key, byte[] data, Map<String, String> metadata) throws IOException {
        execute("putObject", key, () -> client.putObject(PutObjectArgs.builder()
                .bucket(bucket)
                .object(key)
                .stream(new ByteArrayInputStream(data), data.length, -1)
                .userMetadata(metadata == null ? Collections.emptyMap() : metadata)
                .build()));
        log.debug("put {} size={}", key, data.length);
    }

    @Override
    public Optional<StoredObject> get(String key) throws IOException {
        return executeOptional("getObject", key, () -> {
            try (GetObjectResponse response = client.getObject(GetObjectArgs.builder().bucket(bucket).object(key).build())) {
                byte[] data = response.readAllBytes();
                Map<String, String> metadata = new TreeMap<>();
                for (String name : response.headers().names()) {
                    String lower = name.toLowerCase(Locale.ROOT);
                    if (lower.startsWith(USER_METADATA_PREFIX)) {
                        metadata.put(lower.substring(USER_METADATA_PREFIX.length()), response.headers().get(name));
                    }
                }
                long lastModified = parseHttpDate(response.headers().get("Last-Modified"));
                ObjectInfo info = new ObjectInfo(key, data.length, lastModified, Collections.unmodifiableMap(metadata));
                return new StoredObject(info, data);
            }
        });
    }

    @Override
    public Optional<ObjectInfo> head(String key) throws IOException {
        return executeOptional("statObject", key, () -> {
            StatObjectResponse stat = client.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            Map<String, String> metadata = new TreeMap<>();
            stat.userMetadata().forEach((k, v) -> metadata.put(k.toLowerCase(Locale.ROOT), v));
            long lastModified = stat.lastModified() == null ? 0L : stat.lastModified().toInstant().toEpochMilli();
            return new ObjectInfo(key, stat.size(), lastModified, Collections.unmodifiableMap(metadata));
        });
    }

    @Override
    public List<ObjectInfo> list(String prefix) throws IOException {
        return execute("listObjects", prefix, () -> {
            List<ObjectInfo> infos = new ArrayList<>();
            Iterable<Result<Item>> results = client.listObjects(ListObjectsArgs.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .recursive(true)
                    .build());
            for (Result<Item> result : results) {
                Item item = result.get();
                if (item.isDir()) {
                    continue;
                }
                ZonedDateTime lastModified = item.lastModified();
                infos.add(new ObjectInfo(item.objectName(), item.size(),
                        lastModified == null ? 0L : lastModified.toInstant().toEpochMilli(), Collections.emptyMap()));
            }
            log.debug("list {} count={}", prefix, infos.size());
            return infos;
        });
    }

    /**
     * 每页最多一条，只读取第一条结果。
     */
    @Override
    public boolean anyWithPrefix(String prefix) throws IOException {
        return execute("listObjects", prefix, () -> {
            Iterable<Result<Item>> results = client.listObjects(ListObjectsArgs.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .recursive(true)
                    .maxKeys(1)
                    .build());
            for (Result<Item> result : results) {
                if (!result.get().isDir()) {
                    return true;
                }
            }
            return false;
        });
    }

    @Override
    public void delete(String key) throws IOException {
        execute("removeObject", key, () -> {
            client.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
            return null;
        });
        log.debug("delete {}", key);
    }

    /**
     * 使用批量删除接口；任何一个 key 删除失败都会抛出 IOException。
     */
    @Override
    public void deleteAll(Collection<String> keys) throws IOException {
        if (keys.isEmpty()) {
            return;
        }
        List<DeleteObject> objects = new ArrayList<>(keys.size());
        for (String key : keys) {
            objects.add(new DeleteObject(key));
        }
        execute("removeObjects", bucket, () -> {
            Iterable<Result<DeleteError>> results = client.removeObjects(RemoveObjectsArgs.builder()
                    .bucket(bucket)
                    .objects(objects)
                    .build());
            // 结果是惰性的，必须遍历才会真正发出请求
            for (Result<DeleteError> result : results) {
                DeleteError error = result.get();
                throw new IOException("delete failed for " + error.objectName() + ": " + error.message());
            }
            return null;
        });
        log.debug("deleteAll count={}", keys.size());
    }

    private static long parseHttpDate(String value) {
        if (value == null) {
            return 0L;
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            log.debug("unparseable Last-Modified header: {}", value);
            return 0L;
        }
    }

    private <T> Optional<T> executeOptional(String action, String key, MinioCall<T> call) throws IOException {
        try {
            return Optional.of(call.call());
        } catch (ErrorResponseException e) {
            if (NO_SUCH_KEY.equals(e.errorResponse().code())) {
                return Optional.empty();
            }
            throw new IOException(action + " failed for " + key + ": " + e.errorResponse().code(), e);
        } catch (MinioException | GeneralSecurityException e) {
            throw new IOException(action + " failed for " + key + ": " + e.getMessage(), e);
        }
    }

    private <T> T execute(String action, String key, MinioCall<T> call) throws IOException {
        try {
            return call.call();
        } catch (ErrorResponseException e) {
            throw new IOException(action + " failed for " + key + ": " + e.errorResponse().code(), e);
        } catch (MinioException | GeneralSecurityException e) {
            throw new IOException(action + " failed for " + key + ": " + e.getMessage(), e);
        }
    }

    /** SDK 调用：声明 SDK 可能抛出的受检异常。 */
    @FunctionalInterface
    private interface MinioCall<T> {
        T call() throws MinioException, GeneralSecurityException, IOException;
    }
}
