package com.weixiao.gitstore.objectstore;

import lombok.Value;

/**
 * get 的结果：对象元数据与完整内容。
 */
@Value
public class StoredObject {
    ObjectInfo info;
    byte[] data;
}
