package net.lavalauncher.launcher.launch;

/**
 * How far a launched game has come, as far as we can tell from its log output.
 * The constants are declared in the order a game passes through them.
 */
public enum RunState {
    LAUNCHING,
    RENDERER_READY,
    SPLASH_SCREEN,
    RUNNING;

    public boolean isAfter(RunState other) {
        return ordinal() > other.ordinal();
    }
}
