package net.lavalauncher.launcher.launch;

/**
 * Guesses the {@link RunState} of a game from the lines it writes to stdout.
 */
public final class LogAnalyzer {
    private LogAnalyzer() {
    }

    /**
     * @return the state after {@code line} was printed. Never earlier than {@code current}.
     */
    public static RunState nextState(RunState current, String line) {
        RunState indicated;
        if (line.contains("Backend library:") || line.contains("LWJGL")) {
            indicated = RunState.RENDERER_READY;
        } else if (line.contains("Sound engine started")) {
            indicated = RunState.RUNNING;
        } else if (current == RunState.RENDERER_READY) {
            // The game logs resource loading while the splash screen is shown
            indicated = RunState.SPLASH_SCREEN;
        } else {
            indicated = current;
        }
        return indicated.isAfter(current) ? indicated : current;
    }

    public static boolean isDiagnostic(String line) {
        return line.contains("[STDERR]");
    }
}
