package com.weixiao.gitstore.config;

import com.weixiao.gitstore.objectstore.MinioObjectStore;
import com.weixiao.gitstore.objectstore.ObjectStore;
import com.weixiao.gitstore.storage.LocalFsAdapter;
import com.weixiao.gitstore.storage.ObjectStoreAdapter;
import com.weixiao.gitstore.storage.StorageAdapter;
import com.weixiao.gitstore.stream.StreamSizeCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.LongConsumer;

/**
 * 按配置为某个仓库创建存储适配器，以及按配置的预算创建流计数器。
 * 调用方只拿到 {@link StorageAdapter}，不知道具体是哪种后端。
 */
public final class StorageAdapters {

    private static final Logger log = LoggerFactory.getLogger(StorageAdapters.class);

    private final StorageConfig config;
    private ObjectStore objectStore;

    public StorageAdapters(StorageConfig config) {
        this.config = config;
    }

    /**
     * 使用给定的对象存储（如测试中的 InMemoryObjectStore），不再按配置连接 S3。
     */
    public StorageAdapters(StorageConfig config, ObjectStore objectStore) {
        this.config = config;
        this.objectStore = objectStore;
    }

    /**
     * 打开仓库：本地后端的根为 baseDir/id，S3 后端的 key 前缀为 keyPrefix/id。
     *
     * @throws IllegalArgumentException 仓库 id 不合法
     */
    public StorageAdapter open(String repositoryId) throws IOException {
        String id = RepositoryIds.validate(repositoryId);
        switch (config.getBackend()) {
            case S3:
                String prefix = config.getS3KeyPrefix().isEmpty() ? id : config.getS3KeyPrefix() + "/" + id;
                log.debug("open repository {} on object store prefix={}", id, prefix);
                return new ObjectStoreAdapter(objectStore(), prefix);
            case LOCAL:
            default:
                Path root = repositoryDir(id);
                log.debug("open repository {} on local dir {}", id, root);
                return new LocalFsAdapter(root);
        }
    }

    /**
     * 本地后端下仓库的根目录。
     */
    public Path repositoryDir(String repositoryId) {
        return config.getLocalBaseDir().resolve(RepositoryIds.validate(repositoryId));
    }

    /**
     * push（receive-pack）请求体的计数器。
     */
    public StreamSizeCounter pushCounter(LongConsumer onLimitExceeded) {
        return new StreamSizeCounter(config.getMaxPushBytes(), "git receive-pack", onLimitExceeded);
    }

    /**
     * fetch/clone（upload-pack）请求体的计数器。
     */
    public StreamSizeCounter fetchCounter(LongConsumer onLimitExceeded) {
        return new StreamSizeCounter(config.getMaxFetchBytes(), "git upload-pack", onLimitExceeded);
    }

    public StorageConfig getConfig() {
        return config;
    }

    private synchronized ObjectStore objectStore() throws IOException {
        if (objectStore == null) {
            config.requireS3Credentials();
            MinioObjectStore minio = new MinioObjectStore(
                    MinioObjectStore.buildClient(config.getS3Endpoint(), config.getS3Port(), config.isS3UseSsl(),
                            config.getS3AccessKey(), config.getS3SecretKey()),
                    config.getS3Bucket());
            minio.ensureBucket();
            log.info("connected to object store {}:{} bucket={}", config.getS3Endpoint(), config.getS3Port(), config.getS3Bucket());
            objectStore = minio;
        }
        return objectStore;
    }
}
