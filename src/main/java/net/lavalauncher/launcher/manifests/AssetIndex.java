package net.lavalauncher.launcher.manifests;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public record AssetIndex(Map<String, AssetObject> objects) {
    public AssetIndex {
        objects = Objects.requireNonNullElseGet(objects, Map::of);
    }

    public static AssetIndex from(Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path)) {
            var index = new Gson().fromJson(reader, AssetIndex.class);
            if (index == null) {
                throw new IOException("Asset index " + path + " is empty");
            }
            return index;
        } catch (JsonParseException e) {
            throw new IOException("Failed to parse asset index " + path, e);
        }
    }
}
