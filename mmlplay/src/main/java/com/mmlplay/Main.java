package com.mmlplay;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.mmlplay.config.AppOptions;
import com.mmlplay.config.CLIOptionsParser;
import com.mmlplay.config.ConfigUtils;
import com.mmlplay.config.OutputMode;
import com.mmlplay.config.PlayerConfig;
import com.mmlplay.parser.PlayInterpreter;
import com.mmlplay.parser.PlaySyntaxException;
import com.mmlplay.sound.PlayEvent;
import com.mmlplay.sound.RecordingSink;
import com.mmlplay.sound.SilentSink;
import com.mmlplay.sound.SleepingSink;
import com.mmlplay.sound.TonePlayer;
import com.mmlplay.sound.interfaces.SoundSink;
import com.mmlplay.util.Log;
import static com.mmlplay.util.Log.Cat.*;

/**
 * Command line host: reads notation from an argument, a file or stdin and
 * plays it.
 *
 * Exit codes: 0 ok, 1 I/O problem, 2 notation error.
 */
public class Main {

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO = 1;
    public static final int EXIT_SYNTAX = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Uso: mmlplay [opções] [\"notação\"]",
            "  --file=PATH            lê a notação de um arquivo (padrão: argumento ou stdin)",
            "  --output=MODE          audio | sleep | silent (padrão: audio)",
            "  --dry-run              lista os eventos sem tocar",
            "  --sample-rate=N        taxa de amostragem em Hz (padrão: 44100)",
            "  --volume=F             volume 0.0..1.0 (padrão: 0.5)",
            "  --log-level=LVL        TRACE|DEBUG|INFO|WARN|ERROR",
            "  --log-cats=A,B|ALL     PARSER,SOUND,CONFIG,GENERAL",
            "  --log-ts               prefixa logs com horário",
            "  --quiet | --verbose");

    public static void main(String[] args) throws Exception {
        int code = run(args, System.in);
        if (code != EXIT_OK)
            System.exit(code);
    }

    static int run(String[] args, InputStream stdin) {
        return run(args, stdin, ConfigUtils.loadPlayerConfig());
    }

    static int run(String[] args, InputStream stdin, PlayerConfig config) {
        AppOptions options = CLIOptionsParser.parse(args);
        AppOptions.mergeFromConfig(options, config);
        configureLogging(options);

        if (options.help) {
            System.out.println(USAGE);
            return EXIT_OK;
        }

        String text;
        try {
            text = readNotation(options, stdin);
        } catch (IOException ex) {
            Log.error(GENERAL, "Falha ao ler notação: %s", ex.getMessage());
            return EXIT_IO;
        }

        if (options.dryRun)
            return dryRun(text);

        OutputMode mode = options.resolveOutput();
        TonePlayer player = null;
        SoundSink sink;
        switch (mode) {
            case SILENT -> sink = SilentSink.INSTANCE;
            case SLEEP -> sink = new SleepingSink();
            default -> {
                player = new TonePlayer(options.resolveSampleRate(), options.resolveVolume());
                player.open();
                sink = player;
            }
        }
        try {
            new PlayInterpreter(sink).interpret(text);
            return EXIT_OK;
        } catch (PlaySyntaxException ex) {
            reportSyntaxError(text, ex);
            return EXIT_SYNTAX;
        } finally {
            if (player != null)
                player.close();
        }
    }

    private static int dryRun(String text) {
        RecordingSink recorder = new RecordingSink();
        int code = EXIT_OK;
        try {
            new PlayInterpreter(recorder).interpret(text);
        } catch (PlaySyntaxException ex) {
            reportSyntaxError(text, ex);
            code = EXIT_SYNTAX;
        }
        int n = 0;
        for (PlayEvent e : recorder.getEvents())
            System.out.printf("%4d  %s%n", ++n, e);
        System.out.printf("%d eventos, %d ms%n", recorder.getEvents().size(), recorder.getTotalDurationMs());
        return code;
    }

    private static String readNotation(AppOptions options, InputStream stdin) throws IOException {
        if (options.filePath != null && !options.filePath.isBlank())
            return Files.readString(Path.of(options.filePath), StandardCharsets.UTF_8);
        if (options.text != null)
            return options.text;
        return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void configureLogging(AppOptions options) {
        if (options.quiet)
            Log.setLevel(Log.Level.ERROR);
        else if (options.verboseFlag != null && options.verboseFlag)
            Log.setLevel(Log.Level.DEBUG);
        Log.configure(options.logLevelOpt, options.logCatsOpt, options.logTimestamps);
    }

    static void reportSyntaxError(String text, PlaySyntaxException ex) {
        Log.error(PARSER, "%s", ex.getMessage());
        String excerpt = excerpt(text, ex.getIndex());
        if (!excerpt.isEmpty())
            Log.error(PARSER, "%s", excerpt);
    }

    /**
     * Renders the source line holding {@code index} followed by a caret line.
     * Returns "" for empty input.
     */
    static String excerpt(String text, int index) {
        if (text.isEmpty())
            return "";
        int at = Math.min(index, text.length());
        int start = at;
        while (start > 0 && text.charAt(start - 1) != '\n')
            start--;
        int end = at;
        while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r')
            end++;
        StringBuilder caret = new StringBuilder();
        for (int i = start; i < at; i++)
            caret.append(text.charAt(i) == '\t' ? '\t' : ' ');
        caret.append('^');
        return text.substring(start, end) + System.lineSeparator() + caret;
    }
}
