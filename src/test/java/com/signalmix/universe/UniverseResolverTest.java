package com.signalmix.universe;

import com.signalmix.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UniverseResolverTest {

    @Test
    void existingUniverseShouldBeUsedAsIsAndNotRewritten(@TempDir Path tempDir) throws Exception {
        Path valid = tempDir.resolve("data/nextday_universe_valid.csv");
        Files.createDirectories(valid.getParent());
        Files.writeString(valid, "ticker\nAAA\nbbb.ax\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("universe_ax.txt"), "ZZZ\n", StandardCharsets.UTF_8);

        UniverseResolution resolution = resolver(tempDir).resolve();

        assertEquals(UniverseResolution.Source.EXISTING, resolution.getSource());
        assertEquals(List.of("AAA", "bbb.ax"), resolution.getTickers());
        assertEquals("ticker\nAAA\nbbb.ax\n", Files.readString(valid, StandardCharsets.UTF_8));
    }

    @Test
    void seedListShouldBeNormalizedAndSkipEmptyResults(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("universe_ax.txt"), "cba.ax\n\n  bhp \n...\nWES.ASX\n", StandardCharsets.UTF_8);

        UniverseResolution resolution = resolver(tempDir).resolve();

        assertEquals(UniverseResolution.Source.SEED_LIST, resolution.getSource());
        assertEquals(List.of("CBA", "BHP", "WES"), resolution.getTickers());
        assertEquals(
                "ticker\nCBA\nBHP\nWES\n",
                Files.readString(tempDir.resolve("data/nextday_universe_valid.csv"), StandardCharsets.UTF_8)
        );
    }

    @Test
    void priceCacheFilenamesShouldBeUsedInFilenameOrder(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("cache_ZIP.AX_ohlc.csv"), "", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("cache_A2M.AX_ohlc.csv"), "", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("cache_notes.txt"), "", StandardCharsets.UTF_8);

        UniverseResolution resolution = resolver(tempDir).resolve();

        assertEquals(UniverseResolution.Source.PRICE_CACHE, resolution.getSource());
        assertEquals(List.of("A2M", "ZIP"), resolution.getTickers());
    }

    @Test
    void noSourceShouldWriteHeaderOnlyUniverse(@TempDir Path tempDir) throws Exception {
        UniverseResolution resolution = resolver(tempDir).resolve();

        assertEquals(UniverseResolution.Source.EMPTY, resolution.getSource());
        assertTrue(resolution.getTickers().isEmpty());
        assertEquals(
                "ticker\n",
                Files.readString(tempDir.resolve("data/nextday_universe_valid.csv"), StandardCharsets.UTF_8)
        );
    }

    private UniverseResolver resolver(Path workingDir) {
        return new UniverseResolver(Config.fromConfigurationProperties(workingDir, Map.of()));
    }
}
