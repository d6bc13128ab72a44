package com.mmlplay.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.mmlplay.util.Log;
import static com.mmlplay.util.Log.Cat.*;

/**
 * Utility helpers for loading player configuration from mmlplay.ini and
 * interpreting loosely typed option values.
 */
public final class ConfigUtils {

    public static final String CONFIG_FILE_NAME = "mmlplay.ini";

    private ConfigUtils() {
    }

    /**
     * Loads PlayerConfig from mmlplay.ini in the working directory.
     * Never throws; returns an empty PlayerConfig on failure and logs a warning.
     */
    public static PlayerConfig loadPlayerConfig() {
        return loadPlayerConfig(Path.of(CONFIG_FILE_NAME));
    }

    public static PlayerConfig loadPlayerConfig(Path path) {
        try {
            if (Files.exists(path)) {
                PlayerConfig cfg = PlayerConfig.load(path);
                Log.debug(CONFIG, "Configuração carregada de %s", path.toAbsolutePath());
                return cfg;
            }
        } catch (Exception ex) {
            Log.warn(CONFIG, "Falha ao carregar configuração (%s): %s", path, ex.getMessage());
        }
        return new PlayerConfig();
    }

    /**
     * Parses true|false|1|0|yes|no|on|off.
     *
     * @return parsed value or null when not recognized
     */
    public static Boolean parseBoolean(String raw) {
        if (raw == null)
            return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("1") || v.equals("yes") || v.equals("on"))
            return Boolean.TRUE;
        if (v.equals("false") || v.equals("0") || v.equals("no") || v.equals("off"))
            return Boolean.FALSE;
        return null;
    }
}
