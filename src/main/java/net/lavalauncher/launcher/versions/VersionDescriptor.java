package net.lavalauncher.launcher.versions;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to download and later launch one Minecraft version on the current platform.
 * Library and argument rules have already been evaluated; placeholders such as
 * {@code ${auth_player_name}} are still present in the argument lists.
 *
 * @param classPath Library paths relative to {@link #librariesFolder()}, in class path order.
 */
public record VersionDescriptor(String versionId,
                                String type,
                                int requiredJavaVersion,
                                Path clientJarPath,
                                String mainClass,
                                Path installationFolder,
                                Path assetsFolder,
                                Path librariesFolder,
                                Path nativeLibrariesFolder,
                                String assetIndex,
                                List<String> classPath,
                                List<String> gameArguments,
                                List<String> jvmArguments) {
    public VersionDescriptor {
        classPath = List.copyOf(classPath);
        gameArguments = List.copyOf(gameArguments);
        jvmArguments = List.copyOf(jvmArguments);
    }
}
