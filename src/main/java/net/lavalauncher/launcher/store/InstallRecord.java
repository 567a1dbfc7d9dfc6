package net.lavalauncher.launcher.store;

import net.lavalauncher.launcher.versions.VersionDescriptor;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A named installation of a Minecraft version.
 * <p>
 * The version details are only known once the version has been resolved, until then they are empty.
 * Paths are stored as strings so that records serialize to plain JSON.
 *
 * @param id         The name chosen by the user.
 * @param folderName Name of the game directory below the instances folder.
 * @param classPath  Library paths relative to the shared libraries folder.
 */
public record InstallRecord(String id,
                            String versionId,
                            InstallState state,
                            @Nullable String type,
                            String folderName,
                            int requiredJavaVersion,
                            @Nullable String clientJarPath,
                            @Nullable String mainClass,
                            @Nullable String assetIndex,
                            List<String> classPath,
                            List<String> gameArguments,
                            List<String> jvmArguments) {
    public InstallRecord {
        // Gson maps state names it doesn't know to null
        state = Objects.requireNonNullElse(state, InstallState.UNKNOWN);
        classPath = classPath == null ? List.of() : List.copyOf(classPath);
        gameArguments = gameArguments == null ? List.of() : List.copyOf(gameArguments);
        jvmArguments = jvmArguments == null ? List.of() : List.copyOf(jvmArguments);
    }

    public static InstallRecord installing(String id, String versionId, String folderName) {
        return new InstallRecord(id, versionId, InstallState.INSTALLING, null, folderName, 0, null, null, null,
                List.of(), List.of(), List.of());
    }

    public InstallRecord withState(InstallState state) {
        return new InstallRecord(id, versionId, state, type, folderName, requiredJavaVersion, clientJarPath, mainClass,
                assetIndex, classPath, gameArguments, jvmArguments);
    }

    public InstallRecord withVersion(VersionDescriptor version) {
        return new InstallRecord(id, version.versionId(), state, version.type(), folderName, version.requiredJavaVersion(),
                version.clientJarPath().toString(), version.mainClass(), version.assetIndex(),
                version.classPath(), version.gameArguments(), version.jvmArguments());
    }

    public boolean isReady() {
        return state == InstallState.READY;
    }
}
