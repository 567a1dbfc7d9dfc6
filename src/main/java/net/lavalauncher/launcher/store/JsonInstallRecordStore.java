package net.lavalauncher.launcher.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import net.lavalauncher.launcher.utils.FileUtil;
import net.lavalauncher.launcher.utils.HashingUtil;
import net.lavalauncher.launcher.utils.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stores every record as its own pretty-printed JSON file, named after the SHA-1 of the record id.
 * Files are replaced atomically, so a crash leaves either the old or the new content behind.
 */
public class JsonInstallRecordStore implements InstallRecordStore {
    private static final Logger LOG = Logger.create();

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path directory;

    public JsonInstallRecordStore(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized boolean exists(String id) throws IOException {
        return get(id) != null;
    }

    @Override
    @Nullable
    public synchronized InstallRecord get(String id) throws IOException {
        var file = getRecordFile(id);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        var record = read(file);
        if (record != null && !record.id().equals(id)) {
            LOG.warn("Install record " + file + " belongs to '" + record.id() + "' instead of '" + id + "'");
            return null;
        }
        return record;
    }

    @Override
    public synchronized List<InstallRecord> getAll() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<Path> files;
        try (var stream = Files.list(directory)) {
            files = stream.filter(f -> f.getFileName().toString().endsWith(".json")).toList();
        }

        var result = new ArrayList<InstallRecord>(files.size());
        for (var file : files) {
            var record = read(file);
            if (record != null) {
                result.add(record);
            }
        }
        result.sort(Comparator.comparing(InstallRecord::id));
        return result;
    }

    @Override
    public synchronized void insert(InstallRecord record) throws IOException {
        if (Files.exists(getRecordFile(record.id()))) {
            throw new FileAlreadyExistsException(getRecordFile(record.id()).toString(), null, "An install record for '" + record.id() + "' already exists");
        }
        write(record);
    }

    @Override
    public synchronized void update(InstallRecord record) throws IOException {
        if (!Files.exists(getRecordFile(record.id()))) {
            throw new NoSuchFileException(getRecordFile(record.id()).toString(), null, "No install record for '" + record.id() + "'");
        }
        write(record);
    }

    @Override
    public synchronized void setState(String id, InstallState state) throws IOException {
        var record = get(id);
        if (record == null) {
            throw new NoSuchFileException(getRecordFile(id).toString(), null, "No install record for '" + id + "'");
        }
        update(record.withState(state));
    }

    private Path getRecordFile(String id) {
        return directory.resolve(HashingUtil.sha1(id) + ".json");
    }

    private void write(InstallRecord record) throws IOException {
        if (record.state() == InstallState.UNKNOWN) {
            throw new IllegalArgumentException("Cannot store install record '" + record.id() + "' with state UNKNOWN");
        }
        Files.createDirectories(directory);
        FileUtil.writeStringAtomically(getRecordFile(record.id()), GSON.toJson(record));
    }

    @Nullable
    private static InstallRecord read(Path file) throws IOException {
        try {
            var record = GSON.fromJson(Files.readString(file), InstallRecord.class);
            if (record == null || record.id() == null || record.versionId() == null || record.folderName() == null) {
                LOG.warn("Skipping incomplete install record " + file);
                return null;
            }
            return record;
        } catch (JsonParseException e) {
            LOG.warn("Skipping unreadable install record " + file + ": " + e.getMessage());
            return null;
        }
    }
}
