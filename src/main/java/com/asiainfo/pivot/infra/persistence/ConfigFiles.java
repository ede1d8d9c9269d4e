package com.asiainfo.pivot.infra.persistence;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 定位 <location>/<table>/<file>：location 是已存在的目录时读文件系统，否则按 classpath 资源读取
 */
final class ConfigFiles {

    private ConfigFiles() {}

    static Optional<InputStream> open(String location, String table, String fileName) throws IOException {
        Path dir = Path.of(location);
        if (Files.isDirectory(dir)) {
            Path file = dir.resolve(table).resolve(fileName);
            return Files.isRegularFile(file) ? Optional.of(Files.newInputStream(file)) : Optional.empty();
        }
        String resource = location.endsWith("/") ? location + table + "/" + fileName : location + "/" + table + "/" + fileName;
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigFiles.class.getClassLoader();
        }
        return Optional.ofNullable(loader.getResourceAsStream(resource));
    }
}
