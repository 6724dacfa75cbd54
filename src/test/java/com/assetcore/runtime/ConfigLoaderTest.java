package com.assetcore.runtime;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUseDefaultsWhenFileMissing() throws Exception {
        AppConfig config = ConfigLoader.load(tempDir.resolve("absent.yml"));

        assertEquals("http://localhost:8022", config.getApi().getBaseUrl());
        assertEquals(1000, config.getApi().getChildPageSize());
        assertEquals(".assetcore/blobs", config.getCache().getSpoolDir());
    }

    @Test
    void shouldUseDefaultsWhenFileEmpty() throws Exception {
        Path empty = Files.createFile(tempDir.resolve("empty.yml"));

        assertEquals(30000, ConfigLoader.load(empty).getApi().getReadTimeoutMs());
    }

    @Test
    void shouldOverlayPartialYamlOnDefaults() throws Exception {
        Path yaml = tempDir.resolve("application.yml");
        Files.writeString(yaml, """
                api:
                  baseUrl: https://catalog.internal
                  infospaceId: 9
                  retries: 4
                cache:
                  spoolDir: /var/tmp/blobs
                unknownSection:
                  x: 1
                """);

        AppConfig config = ConfigLoader.load(yaml);

        assertEquals("https://catalog.internal", config.getApi().getBaseUrl());
        assertEquals(9L, config.getApi().getInfospaceId());
        assertEquals("ASSETCORE_ACCESS_TOKEN", config.getApi().getTokenEnv());
        assertEquals("/var/tmp/blobs", config.getCache().getSpoolDir());
    }
}
