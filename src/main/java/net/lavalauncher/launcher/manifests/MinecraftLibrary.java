package net.lavalauncher.launcher.manifests;

import com.google.gson.annotations.SerializedName;
import net.lavalauncher.launcher.utils.OsType;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record MinecraftLibrary(@SerializedName("name") String artifactId, @Nullable Downloads downloads, List<Rule> rules,
                               @Nullable Map<OsType, String> natives, @Nullable Extract extract) {
    public MinecraftLibrary {
        Objects.requireNonNull(artifactId, "name");
        rules = Objects.requireNonNullElseGet(rules, List::of);
    }

    /**
     * Library rules are folded in order: an allow rule includes the library only on a matching OS,
     * a disallow rule excludes it on a matching OS. Rules without an OS condition don't change the outcome.
     */
    public boolean rulesMatch(RuleContext context) {
        var allowed = true;
        for (var rule : rules) {
            if (rule.os() == null) {
                continue;
            }
            var osMatches = rule.os().platformMatches(context);
            allowed = rule.action().isAllowed() == osMatches;
        }
        return allowed;
    }

    @Nullable
    public MinecraftDownload getArtifactDownload() {
        return downloads != null ? downloads.artifact : null;
    }

    /**
     * The classifier of the native library archive for the context's OS, e.g. {@code natives-windows}.
     * Older manifests embed the pointer width as {@code ${arch}}.
     */
    @Nullable
    public String getNativesClassifier(RuleContext context) {
        if (natives == null) {
            return null;
        }
        var classifier = natives.get(context.os());
        if (classifier == null) {
            return null;
        }
        return classifier.replace("${arch}", context.arch().contains("64") ? "64" : "32");
    }

    /**
     * @return null if the library has no natives for the context's OS, or the manifest lacks the classifier download
     */
    @Nullable
    public MinecraftDownload getNativesDownload(RuleContext context) {
        var classifier = getNativesClassifier(context);
        if (classifier == null || downloads == null) {
            return null;
        }
        return downloads.classifiers.get(classifier);
    }

    public List<String> getExtractExcludes() {
        return extract != null ? extract.exclude() : List.of();
    }

    public record Downloads(@Nullable MinecraftDownload artifact, Map<String, MinecraftDownload> classifiers) {
        public Downloads {
            if (classifiers == null) {
                classifiers = Map.of();
            }
        }
    }

    public record Extract(List<String> exclude) {
        public Extract {
            exclude = Objects.requireNonNullElseGet(exclude, List::of);
        }
    }

    @Override
    public String toString() {
        return artifactId;
    }
}
