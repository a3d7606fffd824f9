package com.edge.equipment;

import com.edge.equipment.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 装备图标匹配服务入口
 */
@SpringBootApplication
public class EquipmentMatcherApplication {

    public static void main(String[] args) {
        // 必须在任何 Mat 创建之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(EquipmentMatcherApplication.class, args);
    }
}
