package net.lavalauncher.launcher.manifests;

public record AssetObject(String hash, long size) {
    /**
     * Objects are stored in subfolders named after the first two characters of their hash.
     */
    public String getRelativePath() {
        return hash.substring(0, 2) + "/" + hash;
    }
}
