package net.lavalauncher.launcher.store;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * Persists {@link InstallRecord install records}, keyed by their id.
 */
public interface InstallRecordStore {
    boolean exists(String id) throws IOException;

    @Nullable
    InstallRecord get(String id) throws IOException;

    /**
     * @return all readable records, sorted by id
     */
    List<InstallRecord> getAll() throws IOException;

    /**
     * @throws FileAlreadyExistsException if a record with the same id exists
     */
    void insert(InstallRecord record) throws IOException;

    /**
     * @throws NoSuchFileException if there's no record with that id
     */
    void update(InstallRecord record) throws IOException;

    /**
     * @throws NoSuchFileException if there's no record with that id
     */
    void setState(String id, InstallState state) throws IOException;
}
