package com.github.mirrorfetch;

import com.github.mirrorfetch.model.MirrorSite;
import com.github.mirrorfetch.service.MirrorRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class MirrorFetchApplicationTests {

    @TempDir
    static Path tempDir;

    @DynamicPropertySource
    static void registryFile(DynamicPropertyRegistry registry) {
        registry.add("mirrorfetch.registry.mirror-file", () -> tempDir.resolve("mirrors.json").toString());
    }

    @Autowired
    private MirrorRegistry registry;

    @Test
    void contextLoadsWithSeededMirrors() {
        List<MirrorSite> active = registry.listActiveMirrors();

        assertFalse(active.isEmpty());
        assertEquals(5, active.get(0).getPriority());
    }
}
