package com.mmlplay.config;

import com.mmlplay.sound.TonePlayer;
import com.mmlplay.util.Log;
import static com.mmlplay.util.Log.Cat.*;

/**
 * Holder for application options parsed from CLI.
 *
 * Notes on sources and precedence:
 * - CLI values go here (filled by CLIOptionsParser).
 * - INI values are merged afterwards by {@link #mergeFromConfig} and only fill
 * what the CLI left unspecified.
 */
public class AppOptions {

    /** Notation text passed positionally on CLI (non --flag). */
    public String text = null;

    /** Read notation from this file. CLI: --file=PATH. */
    public String filePath = null;

    /** Output target. CLI: --output=audio|sleep|silent. INI: output=. */
    public OutputMode output = null;

    /** Print events instead of sounding them. CLI: --dry-run. */
    public boolean dryRun = false;

    /** Synthesis sample rate in Hz. CLI: --sample-rate=N. INI: sample-rate=. */
    public Integer sampleRate = null;

    /** Tone amplitude 0.0..1.0. CLI: --volume=F. INI: volume=. */
    public Double volume = null;

    /** Show usage and exit. CLI: --help. */
    public boolean help = false;

    /** Only errors are logged. CLI: --quiet. */
    public boolean quiet = false;

    /** Verbose logging (DEBUG). CLI: --verbose. INI: verbose=. */
    public Boolean verboseFlag = null;

    /** Log level name. CLI: --log-level=LVL. INI: log-level=. */
    public String logLevelOpt = null;

    /** Comma separated log categories or ALL. CLI: --log-cats=. INI: log-cats=. */
    public String logCatsOpt = null;

    /** Prefix log lines with time. CLI: --log-ts. INI: log-ts=. */
    public boolean logTimestamps = false;

    public OutputMode resolveOutput() {
        return output != null ? output : OutputMode.AUDIO;
    }

    public int resolveSampleRate() {
        return sampleRate != null ? sampleRate : TonePlayer.DEFAULT_SAMPLE_RATE;
    }

    public double resolveVolume() {
        return volume != null ? volume : TonePlayer.DEFAULT_VOLUME;
    }

    /**
     * Fill options not given on the CLI from the INI config.
     *
     * @param cli options parsed from the command line (mutated)
     * @param cfg loaded config, may be null
     */
    public static void mergeFromConfig(AppOptions cli, PlayerConfig cfg) {
        if (cli == null || cfg == null)
            return;
        if (cli.output == null && cfg.hasOption("output")) {
            cli.output = OutputMode.parse(cfg.getOption("output"));
            if (cli.output == null)
                Log.warn(CONFIG, "Valor inválido em output= (usar audio|sleep|silent): %s", cfg.getOption("output"));
        }
        if (cli.sampleRate == null && cfg.hasOption("sample-rate"))
            try {
                cli.sampleRate = Integer.parseInt(cfg.getOption("sample-rate"));
            } catch (NumberFormatException e) {
                Log.warn(CONFIG, "Valor inválido em sample-rate= (usar número)");
            }
        if (cli.volume == null && cfg.hasOption("volume"))
            try {
                cli.volume = Double.parseDouble(cfg.getOption("volume"));
            } catch (NumberFormatException e) {
                Log.warn(CONFIG, "Valor inválido em volume= (usar 0.0..1.0)");
            }
        // --quiet / --verbose on the CLI outrank an INI log-level
        if (cli.logLevelOpt == null && !cli.quiet && cli.verboseFlag == null && cfg.hasOption("log-level"))
            cli.logLevelOpt = cfg.getOption("log-level");
        if (cli.verboseFlag == null && cfg.hasOption("verbose"))
            cli.verboseFlag = ConfigUtils.parseBoolean(cfg.getOption("verbose"));
        if (cli.logCatsOpt == null && cfg.hasOption("log-cats"))
            cli.logCatsOpt = cfg.getOption("log-cats");
        if (!cli.logTimestamps && cfg.hasOption("log-ts"))
            cli.logTimestamps = Boolean.TRUE.equals(ConfigUtils.parseBoolean(cfg.getOption("log-ts")));
    }
}
