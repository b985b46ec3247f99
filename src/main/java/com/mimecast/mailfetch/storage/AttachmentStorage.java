package com.mimecast.mailfetch.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Attachment storage interface.
 */
public interface AttachmentStorage {

    /**
     * Resolves a generated file name to a storage path.
     *
     * @param fileName File system safe name.
     * @return Path.
     */
    Path resolve(String fileName);

    /**
     * Saves contents to path.
     *
     * @param path     Path obtained from {@link #resolve(String)}.
     * @param contents Bytes.
     * @throws IOException Unable to write.
     */
    void save(Path path, byte[] contents) throws IOException;
}
