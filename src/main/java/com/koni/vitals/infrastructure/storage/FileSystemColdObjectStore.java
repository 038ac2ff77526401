package com.koni.vitals.infrastructure.storage;

import com.koni.vitals.application.port.ColdObjectStore;
import com.koni.vitals.domain.exception.ColdStorageException;
import com.koni.vitals.domain.model.StoredObject;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * Cold object store on a local or mounted filesystem.
 *
 * Object keys map to relative paths under the configured root. Writes go to a temporary file
 * in the target directory and are moved into place, so readers never see a partial object.
 */
@Slf4j
@Component
public class FileSystemColdObjectStore implements ColdObjectStore {
    
    private final Path root;
    
    @Autowired
    public FileSystemColdObjectStore(PipelineProperties properties) {
        this(properties.getColdStore().getRoot());
    }
    
    FileSystemColdObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }
    
    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }
    
    @Override
    public Optional<StoredObject> stat(String key) {
        Path path = resolve(key);
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            if (!attributes.isRegularFile()) {
                return Optional.empty();
            }
            return Optional.of(new StoredObject(key, attributes.size(), attributes.lastModifiedTime().toInstant()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ColdStorageException("Failed to stat object " + key, e);
        }
    }
    
    @Override
    public Optional<byte[]> get(String key) {
        Path path = resolve(key);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ColdStorageException("Failed to read object " + key, e);
        }
    }
    
    @Override
    @Observed(name = "coldstore.put", contextualName = "cold-object-put")
    public void put(String key, byte[] content, String contentType) {
        if (content == null) {
            throw new IllegalArgumentException("Content cannot be null");
        }
        Path target = resolve(key);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Stored object key={}, bytes={}, contentType={}", key, content.length, contentType);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ColdStorageException("Failed to write object " + key, e);
        }
    }
    
    public Path getRoot() {
        return root;
    }
    
    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Object key cannot be blank");
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Object key escapes the store root: " + key);
        }
        return path;
    }
    
    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary upload file path={}, error={}", temp, e.getMessage());
        }
    }
}
