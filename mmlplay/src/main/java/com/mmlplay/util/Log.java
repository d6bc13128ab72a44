package com.mmlplay.util;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/** Minimal lightweight logger without external deps. */
public final class Log {
    private Log() {
    }

    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR
    }

    public enum Cat {
        PARSER, SOUND, CONFIG, GENERAL
    }

    private static volatile Level globalLevel = Level.INFO;
    private static final EnumSet<Cat> enabledCats = EnumSet.allOf(Cat.class);
    private static final AtomicBoolean timestamps = new AtomicBoolean(false);
    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    public static void setLevel(Level lvl) {
        if (lvl != null)
            globalLevel = lvl;
    }

    public static Level getLevel() {
        return globalLevel;
    }

    public static void setTimestamps(boolean on) {
        timestamps.set(on);
    }

    /** Replace enabled category set (thread-unsafe coarse reconfiguration). */
    public static void setCategories(Collection<Cat> cats) {
        enabledCats.clear();
        if (cats != null && !cats.isEmpty()) {
            enabledCats.addAll(cats);
        }
    }

    /**
     * Applies textual options (as given on the CLI or in mmlplay.ini). Invalid
     * level names and unknown categories are reported and ignored.
     *
     * @param levelOpt   TRACE|DEBUG|INFO|WARN|ERROR or null to keep current
     * @param catsOpt    comma separated categories, ALL, or null to keep current
     * @param timestamps prefix lines with wall-clock time
     */
    public static void configure(String levelOpt, String catsOpt, boolean timestamps) {
        if (levelOpt != null && !levelOpt.isBlank()) {
            try {
                setLevel(Level.valueOf(levelOpt.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                warn(Cat.CONFIG, "Nível de log inválido: %s (usar TRACE|DEBUG|INFO|WARN|ERROR)", levelOpt);
            }
        }
        if (catsOpt != null && !catsOpt.isBlank()) {
            if (catsOpt.trim().equalsIgnoreCase("ALL")) {
                setCategories(EnumSet.allOf(Cat.class));
            } else {
                EnumSet<Cat> set = EnumSet.noneOf(Cat.class);
                for (String c : catsOpt.split(",")) {
                    c = c.trim();
                    if (c.isEmpty())
                        continue;
                    try {
                        set.add(Cat.valueOf(c.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException ex) {
                        warn(Cat.CONFIG, "Categoria de log inválida ignorada: %s", c);
                    }
                }
                if (set.isEmpty())
                    warn(Cat.CONFIG, "Nenhuma categoria válida em log-cats, mantendo padrão.");
                else
                    setCategories(set);
            }
        }
        if (timestamps)
            setTimestamps(true);
    }

    public static boolean isEnabled(Level lvl, Cat cat) {
        return lvl.ordinal() >= globalLevel.ordinal() && enabledCats.contains(cat);
    }

    private static void log(Level lvl, Cat cat, String fmt, Object... args) {
        if (!isEnabled(lvl, cat))
            return;
        StringBuilder sb = new StringBuilder();
        if (timestamps.get())
            sb.append(LocalDateTime.now().format(TS_FMT)).append(' ');
        sb.append('[').append(lvl.name()).append(']').append('[').append(cat.name()).append("] ");
        sb.append(String.format(Locale.ROOT, fmt, args));
        // errors go to stderr so piped dry-run output stays clean
        PrintStream out = lvl == Level.ERROR ? System.err : System.out;
        out.println(sb.toString());
    }

    public static void trace(Cat c, String f, Object... a) {
        log(Level.TRACE, c, f, a);
    }

    public static void debug(Cat c, String f, Object... a) {
        log(Level.DEBUG, c, f, a);
    }

    public static void info(Cat c, String f, Object... a) {
        log(Level.INFO, c, f, a);
    }

    public static void warn(Cat c, String f, Object... a) {
        log(Level.WARN, c, f, a);
    }

    public static void error(Cat c, String f, Object... a) {
        log(Level.ERROR, c, f, a);
    }
}
