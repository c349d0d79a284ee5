package com.weixiao.gitstore.objectstore;

import lombok.Value;

import java.util.Map;

/**
 * 对象的元数据：key、字节大小、最后修改时间（毫秒）、用户元数据（key 统一小写）。
 * list 返回的条目不一定带用户元数据（S3 列表接口不返回），需要时用 head 获取。
 */
@Value
public class ObjectInfo {
    String key;
    long size;
    long lastModifiedMillis;
    Map<String, String> metadata;
}
