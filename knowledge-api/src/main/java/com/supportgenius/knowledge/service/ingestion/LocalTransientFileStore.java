package com.supportgenius.knowledge.service.ingestion;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Component
public class LocalTransientFileStore implements TransientFileStore {

    private static final Logger log = LoggerFactory.getLogger(LocalTransientFileStore.class);

    private final Path directory;

    public LocalTransientFileStore(@Value("${knowledge.uploads.directory:uploads}") String directory) {
        this.directory = Paths.get(directory).toAbsolutePath().normalize();
    }

    @Override
    public Path write(String fileName, byte[] bytes) {
        String safeName = FilenameUtils.getName(fileName);
        if (safeName == null || safeName.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "A file name is required");
        }
        try {
            Files.createDirectories(directory);
            Path target = directory.resolve(safeName);
            Files.write(target, bytes);
            log.debug("Stored {} bytes at {}", bytes.length, target);
            return target;
        } catch (IOException e) {
            throw new KnowledgeException(KnowledgeErrorCode.STORAGE_FAILURE, "Failed to store uploaded file", e);
        }
    }

    @Override
    public byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new KnowledgeException(KnowledgeErrorCode.STORAGE_FAILURE, "Failed to read stored file " + path.getFileName(), e);
        }
    }

    @Override
    public boolean delete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new KnowledgeException(KnowledgeErrorCode.STORAGE_FAILURE, "Failed to delete stored file " + path.getFileName(), e);
        }
    }

    Path directory() {
        return directory;
    }
}
