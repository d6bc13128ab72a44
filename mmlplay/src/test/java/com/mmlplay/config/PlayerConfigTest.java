package com.mmlplay.config;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class PlayerConfigTest {

    @TempDir
    Path tmp;

    private Path sample() throws URISyntaxException {
        return Path.of(getClass().getResource("sample-mmlplay.ini").toURI());
    }

    @Test
    public void load_sampleFile() throws Exception {
        PlayerConfig cfg = PlayerConfig.load(sample());
        assertEquals("audio", cfg.getOption("output"));
        assertEquals("44100", cfg.getOption("sample-rate"));
        assertEquals("0.5", cfg.getOption("volume"));
        assertEquals("ALL", cfg.getOption("log-cats"));
        // keys are case-insensitive and trimmed
        assertEquals("yes", cfg.getOption("VERBOSE"));
        assertFalse(cfg.hasOption("this line is malformed and skipped"));
    }

    @Test
    public void load_missingFile_isEmpty() throws Exception {
        PlayerConfig cfg = PlayerConfig.load(tmp.resolve("absent.ini"));
        assertFalse(cfg.hasOption("output"));
        assertNull(cfg.getOption("output"));
        assertNull(cfg.getOption(null));
    }

    @Test
    public void configUtils_neverThrows() throws Exception {
        // a directory cannot be read as a file
        Path dir = Files.createDirectory(tmp.resolve("mmlplay.ini"));
        PlayerConfig cfg = ConfigUtils.loadPlayerConfig(dir);
        assertFalse(cfg.hasOption("output"));
    }

    @Test
    public void configUtils_loadsExistingFile() throws Exception {
        Path f = tmp.resolve("mmlplay.ini");
        Files.writeString(f, "output=silent\n", StandardCharsets.UTF_8);
        assertEquals("silent", ConfigUtils.loadPlayerConfig(f).getOption("output"));
    }

    @Test
    public void parseBoolean_variants() {
        assertEquals(Boolean.TRUE, ConfigUtils.parseBoolean(" On "));
        assertEquals(Boolean.TRUE, ConfigUtils.parseBoolean("1"));
        assertEquals(Boolean.FALSE, ConfigUtils.parseBoolean("no"));
        assertNull(ConfigUtils.parseBoolean("maybe"));
        assertNull(ConfigUtils.parseBoolean(null));
    }

    @Test
    public void outputMode_parse() {
        assertEquals(OutputMode.AUDIO, OutputMode.parse("Audio"));
        assertEquals(OutputMode.SLEEP, OutputMode.parse(" sleep"));
        assertEquals(OutputMode.SILENT, OutputMode.parse("SILENT"));
        assertNull(OutputMode.parse("speaker"));
    }
}
