package net.lavalauncher.launcher.utils;

/**
 * SGR escape sequences used for console output. {@link Logger} strips them again when colors are disabled.
 */
public enum AnsiColor {
    RESET("0"),
    BOLD("1"),
    MUTED("0;2;3"),
    RED("91"),
    YELLOW("93"),
    BRIGHT_GREEN("92");

    private final String sequence;

    AnsiColor(String code) {
        this.sequence = "\033[" + code + "m";
    }

    /**
     * Wraps {@code text} in this color, followed by a reset.
     */
    public String paint(Object text) {
        return sequence + text + RESET.sequence;
    }

    @Override
    public String toString() {
        return sequence;
    }
}
