package com.mimecast.mailfetch.storage;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Local directory attachment storage.
 *
 * <p>Saves files on disk, replacing any existing file with the same name.
 */
public class LocalAttachmentStorage implements AttachmentStorage {
    private static final Logger log = LogManager.getLogger(LocalAttachmentStorage.class);

    private final Path directory;

    /**
     * Constructs a new LocalAttachmentStorage instance.
     *
     * @param directory Directory path.
     */
    public LocalAttachmentStorage(String directory) {
        this.directory = Paths.get(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    @Override
    public void save(Path path, byte[] contents) throws IOException {
        FileUtils.writeByteArrayToFile(path.toFile(), contents);
        log.debug("Attachment saved to: {}", path);
    }
}
