package com.edge.equipment.service;

/**
 * 目录配置错误：基准目录 / 探针目录不存在或不是目录
 */
public class CatalogConfigurationException extends RuntimeException {

    public CatalogConfigurationException(String message) {
        super(message);
    }
}
