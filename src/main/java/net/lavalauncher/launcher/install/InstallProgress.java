package net.lavalauncher.launcher.install;

/**
 * Snapshot of the progress of one installation. All gauges range from 0 to 100.
 *
 * @param valid false until the installation has actually started
 */
public record InstallProgress(String instanceId,
                              boolean valid,
                              int minecraftProgress,
                              int assetsProgress,
                              int librariesProgress,
                              int javaProgress) {
    public static InstallProgress initial(String instanceId) {
        return new InstallProgress(instanceId, false, 0, 0, 0, 0);
    }

    public static InstallProgress started(String instanceId) {
        return new InstallProgress(instanceId, true, 0, 0, 0, 0);
    }

    public static InstallProgress finished(String instanceId) {
        return new InstallProgress(instanceId, true, 100, 100, 100, 100);
    }

    public InstallProgress withMinecraftProgress(int progress) {
        return new InstallProgress(instanceId, valid, Math.max(minecraftProgress, progress), assetsProgress, librariesProgress, javaProgress);
    }

    public InstallProgress withAssetsProgress(int progress) {
        return new InstallProgress(instanceId, valid, minecraftProgress, Math.max(assetsProgress, progress), librariesProgress, javaProgress);
    }

    public InstallProgress withLibrariesProgress(int progress) {
        return new InstallProgress(instanceId, valid, minecraftProgress, assetsProgress, Math.max(librariesProgress, progress), javaProgress);
    }

    public InstallProgress withJavaProgress(int progress) {
        return new InstallProgress(instanceId, valid, minecraftProgress, assetsProgress, librariesProgress, Math.max(javaProgress, progress));
    }

    public boolean isComplete() {
        return valid && minecraftProgress == 100 && assetsProgress == 100 && librariesProgress == 100 && javaProgress == 100;
    }

    /**
     * Average of all gauges.
     */
    public int getOverallProgress() {
        return (minecraftProgress + assetsProgress + librariesProgress + javaProgress) / 4;
    }
}
