package com.edge.equipment.util;

import java.io.IOException;

/**
 * 图片无法读取或解码（损坏、格式不支持、空文件）
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
