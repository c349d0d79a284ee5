package com.weixiao.gitstore.objectstore;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 扁平 key-value 对象存储的最小接口（S3 语义）：没有目录、没有符号链接、没有权限位。
 * <p>
 * 实现必须对单个 key 提供强一致的写后读：put 返回后，get/head/list 立即能看到新内容。
 * 单个 key 的 put 是原子的，不会出现部分可见的对象。
 */
public interface ObjectStore {

    /** 写入（覆盖）对象。metadata 的 key 按小写存储。 */
    void put(String key, byte[] data, Map<String, String> metadata) throws IOException;

    /** 读取对象内容与元数据；不存在时返回 empty。 */
    Optional<StoredObject> get(String key) throws IOException;

    /** 只读取元数据；不存在时返回 empty。 */
    Optional<ObjectInfo> head(String key) throws IOException;

    /** 递归列出所有以 prefix 开头的对象，按 key 排序。 */
    List<ObjectInfo> list(String prefix) throws IOException;

    /**
     * 是否存在以 prefix 开头的对象。实现应只取第一条结果，不遍历整个前缀。
     */
    boolean anyWithPrefix(String prefix) throws IOException;

    /** 删除对象；不存在时不报错。 */
    void delete(String key) throws IOException;

    /** 批量删除。 */
    default void deleteAll(Collection<String> keys) throws IOException {
        for (String key : keys) {
            delete(key);
        }
    }
}
