package net.lavalauncher.launcher.downloads;

import java.util.List;

public class DownloadsFailedException extends Exception {
    private final List<Exception> errors;

    public DownloadsFailedException(List<Exception> errors) {
        super(createMessage(errors), errors.isEmpty() ? null : errors.get(0));
        this.errors = List.copyOf(errors);
        for (int i = 1; i < this.errors.size(); i++) {
            addSuppressed(this.errors.get(i));
        }
    }

    private static String createMessage(List<Exception> errors) {
        if (errors.size() == 1) {
            return "Download failed: " + errors.get(0).getMessage();
        }
        return errors.size() + " downloads failed, first error: " + (errors.isEmpty() ? "none" : errors.get(0).getMessage());
    }

    public List<Exception> getErrors() {
        return errors;
    }
}
