package com.z2api.pool.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EnvFileConfigStoreTest {

    @TempDir
    Path dir;

    @Test
    void replacesExistingAssignmentAndKeepsOtherLines() throws Exception {
        Path env = dir.resolve(".env");
        Files.write(env, List.of("# proxy settings", "API_KEY=sk-local", "Z_AI_COOKIES=old1,old2", "PORT=8000"));

        new EnvFileConfigStore(env).setValue("Z_AI_COOKIES", "tokA,u@e.com----pw----tokB");

        assertThat(Files.readAllLines(env)).containsExactly(
                "# proxy settings", "API_KEY=sk-local", "Z_AI_COOKIES=tokA,u@e.com----pw----tokB", "PORT=8000");
    }

    @Test
    void appendsAssignmentWhenKeyIsMissing() throws Exception {
        Path env = dir.resolve(".env");
        Files.write(env, List.of("PORT=8000"));

        new EnvFileConfigStore(env).setValue("Z_AI_COOKIES", "");

        assertThat(Files.readAllLines(env)).containsExactly("PORT=8000", "Z_AI_COOKIES=");
    }

    @Test
    void doesNothingWhenFileDoesNotExist() {
        Path env = dir.resolve("missing.env");

        new EnvFileConfigStore(env).setValue("Z_AI_COOKIES", "tokA");

        assertThat(Files.exists(env)).isFalse();
    }
}
