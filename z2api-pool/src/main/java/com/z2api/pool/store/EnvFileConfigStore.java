package com.z2api.pool.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 写回 .env 文件的配置存储。
 * <p>
 * 只在文件已存在时更新，替换 {@code KEY=...} 所在行，没有则追加到末尾。
 * 先写临时文件再移动，避免写到一半的文件被读到。
 */
@Slf4j
public class EnvFileConfigStore implements ConfigStore {

    private final Path envFile;

    public EnvFileConfigStore(Path envFile) {
        this.envFile = envFile;
    }

    @Override
    public void setValue(String key, String value) {
        if (!Files.exists(envFile)) {
            log.debug("环境文件 {} 不存在，跳过写入 {}", envFile, key);
            return;
        }
        try {
            List<String> lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
            List<String> updated = new ArrayList<>(lines.size() + 1);
            String line = key + "=" + value;
            boolean replaced = false;
            for (String existing : lines) {
                if (isAssignmentOf(existing, key)) {
                    if (!replaced) {
                        updated.add(line);
                        replaced = true;
                    }
                } else {
                    updated.add(existing);
                }
            }
            if (!replaced) {
                updated.add(line);
            }

            Path temp = envFile.resolveSibling(envFile.getFileName() + ".tmp");
            Files.write(temp, updated, StandardCharsets.UTF_8);
            Files.move(temp, envFile, StandardCopyOption.REPLACE_EXISTING);
            log.debug("已更新环境文件 {} 中的 {}", envFile, key);
        } catch (IOException e) {
            throw new UncheckedIOException("写入环境文件失败: " + envFile, e);
        }
    }

    private boolean isAssignmentOf(String line, String key) {
        String trimmed = line.trim();
        if (trimmed.startsWith("export ")) {
            trimmed = trimmed.substring("export ".length()).trim();
        }
        return trimmed.startsWith(key + "=") || trimmed.startsWith(key + " =");
    }
}
