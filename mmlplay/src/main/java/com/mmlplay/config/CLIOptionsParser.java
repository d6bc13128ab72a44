package com.mmlplay.config;

import com.mmlplay.util.Log;
import static com.mmlplay.util.Log.Cat.*;

/** Parses CLI arguments into an AppOptions struct. */
public final class CLIOptionsParser {

    /**
     * Private constructor (static class).
     */
    private CLIOptionsParser() {
    }

    /**
     * Parses CLI args. Unknown flags are logged and skipped; the last non-flag
     * argument wins as notation text.
     *
     * @param args
     * @return
     */
    public static AppOptions parse(String[] args) {
        AppOptions o = new AppOptions();
        if (args == null)
            return o;
        for (String a : args) {
            if (a == null)
                continue;
            if (a.equalsIgnoreCase("--help") || a.equals("-h")) {
                o.help = true;
            } else if (a.startsWith("--file=")) {
                o.filePath = a.substring(7).trim();
            } else if (a.startsWith("--output=")) {
                o.output = OutputMode.parse(a.substring(9));
                if (o.output == null)
                    Log.warn(CONFIG, "Valor inválido em --output= (usar audio|sleep|silent)");
            } else if (a.equalsIgnoreCase("--dry-run")) {
                o.dryRun = true;
            } else if (a.startsWith("--sample-rate=")) {
                try {
                    o.sampleRate = Integer.parseInt(a.substring(14).trim());
                } catch (NumberFormatException e) {
                    Log.warn(CONFIG, "Valor inválido em --sample-rate= (usar número)");
                }
            } else if (a.startsWith("--volume=")) {
                try {
                    o.volume = Double.parseDouble(a.substring(9).trim());
                } catch (NumberFormatException e) {
                    Log.warn(CONFIG, "Valor inválido em --volume= (usar 0.0..1.0)");
                }
            } else if (a.equalsIgnoreCase("--quiet")) {
                o.quiet = true;
            } else if (a.equalsIgnoreCase("--verbose")) {
                o.verboseFlag = Boolean.TRUE;
            } else if (a.startsWith("--log-level=")) {
                o.logLevelOpt = a.substring(12).trim();
            } else if (a.startsWith("--log-cats=")) {
                o.logCatsOpt = a.substring(11).trim();
            } else if (a.equalsIgnoreCase("--log-ts")) {
                o.logTimestamps = true;
            } else if (a.startsWith("--")) {
                Log.warn(CONFIG, "Opção desconhecida ignorada: %s", a);
            } else {
                o.text = a;
            }
        }
        return o;
    }
}
