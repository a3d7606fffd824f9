package com.edge.equipment.core.cache;

/**
 * 缓存目录无法创建或不可写，属于启动期致命错误
 */
public class CacheConfigurationException extends RuntimeException {

    public CacheConfigurationException(String message) {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
