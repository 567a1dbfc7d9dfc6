package net.lavalauncher.launcher.utils;

import java.io.PrintStream;
import java.util.Map;

/**
 * Console output for the launcher. Messages go to stdout, warnings and errors to stderr.
 */
public final class Logger {
    // Replacement Map for Emojis
    private static final Map<Character, String> EMOJI_MAP = Map.of(
            '↓', "DL",
            '✓', "OK",
            '⚠', "WARN",
            '✗', "ERR",
            '▶', "RUN"
    );

    public static boolean NO_COLOR;
    public static boolean NO_EMOJIS;
    public static boolean VERBOSE;
    private static IndeterminateSpinner spinner;

    private final String name;

    private Logger(String name) {
        this.name = name;
    }

    /**
     * Creates a logger named after the calling class. The name is only shown in verbose mode.
     */
    public static Logger create() {
        var caller = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE).getCallerClass();
        return new Logger(caller.getSimpleName());
    }

    public void println(String text) {
        print(System.out, text);
    }

    public void debug(String text) {
        if (VERBOSE) {
            print(System.out, AnsiColor.MUTED.paint(text));
        }
    }

    public void warn(String text) {
        print(System.err, AnsiColor.YELLOW.paint("⚠ " + text));
    }

    public void error(String text) {
        print(System.err, AnsiColor.RED.paint("✗ " + text));
    }

    public void error(String text, Throwable e) {
        error(text + ": " + e);
        if (VERBOSE) {
            e.printStackTrace();
        }
    }

    private synchronized void print(PrintStream out, String text) {
        closeSpinner();

        if (VERBOSE) {
            text = "[" + Thread.currentThread().getName() + "] [" + name + "] " + text;
        }
        out.println(cleanText(text));
    }

    private static void closeSpinner() {
        if (spinner != null) {
            spinner.end();
            spinner = null;
            System.out.println(); // End line
        }
    }

    public IndeterminateSpinner spinner(String message) {
        closeSpinner();

        System.out.print(cleanText(message));
        return spinner = new IndeterminateSpinner();
    }

    static String cleanText(String text) {
        if (!NO_COLOR && !NO_EMOJIS) {
            return text;
        }

        var result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            var ch = text.charAt(i);
            // Strip ANSI Escape Sequences
            if (NO_COLOR && ch == '\033') {
                i++;
                while (i < text.length() && text.charAt(i) != 'm') {
                    i++;
                }
            } else if (NO_EMOJIS && ch >= 0x7f) {
                result.append(EMOJI_MAP.getOrDefault(ch, "."));
            } else {
                result.append(ch);
            }
        }
        return result.toString();
    }

    /**
     * Shows a very basic animation when the user has to wait for an operation of indeterminate length.
     */
    public static class IndeterminateSpinner {
        String[] spinners = {"", ".", "..", "..."};
        String lastTextPrinted = "";
        int spinnerIndex = 0;

        public IndeterminateSpinner() {
            tick();
        }

        public void tick() {
            if (!lastTextPrinted.isEmpty()) {
                System.out.print("\b".repeat(lastTextPrinted.length())); // clear the last spinner
            }
            lastTextPrinted = spinners[++spinnerIndex % spinners.length];
            System.out.print(lastTextPrinted);
        }

        public void end() {
            if (spinner == this) {
                System.out.print("\b".repeat(lastTextPrinted.length())); // clear the last spinner
                lastTextPrinted = "";
                spinner = null;
            }
        }
    }
}
