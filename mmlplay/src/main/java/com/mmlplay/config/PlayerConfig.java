package com.mmlplay.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for mmlplay.ini: plain {@code key=value} lines, {@code #} comments,
 * keys case-insensitive.
 */
public class PlayerConfig {

    private final Map<String, String> options = new HashMap<>();

    /**
     * Get raw option value (null if absent).
     *
     * @param key
     * @return
     */
    public String getOption(String key) {
        if (key == null)
            return null;
        return options.get(key.toLowerCase(Locale.ROOT));
    }

    /**
     * Check if given option is present.
     *
     * @param key
     * @return
     */
    public boolean hasOption(String key) {
        if (key == null)
            return false;
        return options.containsKey(key.toLowerCase(Locale.ROOT));
    }

    void putOption(String key, String value) {
        options.put(key.toLowerCase(Locale.ROOT), value);
    }

    /**
     * Load config from given path (if file missing, return empty config).
     *
     * @param path
     * @return
     * @throws IOException
     */
    public static PlayerConfig load(Path path) throws IOException {
        PlayerConfig cfg = new PlayerConfig();
        if (!Files.exists(path))
            return cfg; // empty default
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#"))
                    continue;
                int eq = line.indexOf('=');
                if (eq <= 0)
                    continue; // ignore malformed
                String key = line.substring(0, eq).trim();
                String val = line.substring(eq + 1).trim();
                cfg.putOption(key, val);
            }
        }
        return cfg;
    }
}
