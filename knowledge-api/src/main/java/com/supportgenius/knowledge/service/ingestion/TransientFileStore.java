package com.supportgenius.knowledge.service.ingestion;

import java.nio.file.Path;

/** Local scratch storage for uploaded files awaiting ingestion. */
public interface TransientFileStore {

    Path write(String fileName, byte[] bytes);

    byte[] read(Path path);

    /** @return {@code false} when there was nothing to delete */
    boolean delete(Path path);
}
