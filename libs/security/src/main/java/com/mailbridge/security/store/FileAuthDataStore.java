package com.mailbridge.security.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.security.AuthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps all records in one JSON file. Meant for local development, not for multi-instance
 * deployments.
 * <p>
 * Every operation re-reads the file so edits made by hand are picked up. Writes go to a
 * temporary sibling file that is then moved over the original. Methods are synchronized,
 * which serialises access within one process only.
 */
public class FileAuthDataStore implements AuthDataStore {

    private static final Logger log = LoggerFactory.getLogger(FileAuthDataStore.class);
    private static final TypeReference<List<AuthRecord>> RECORDS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public FileAuthDataStore(Path file) {
        this(file, new ObjectMapper());
    }

    public FileAuthDataStore(Path file, ObjectMapper mapper) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized Optional<AuthRecord> get(String appId) {
        return read().stream().filter(r -> r.appId().equals(appId)).findFirst();
    }

    @Override
    public synchronized void set(AuthRecord record) {
        List<AuthRecord> records = new ArrayList<>(read());
        records.removeIf(r -> r.tenantApiUrl().equals(record.tenantApiUrl()));
        records.add(record);
        write(records);
        log.debug("Stored auth record for {}", record.tenantApiUrl());
    }

    @Override
    public synchronized void delete(String tenantApiUrl) {
        List<AuthRecord> records = new ArrayList<>(read());
        if (records.removeIf(r -> r.tenantApiUrl().equals(tenantApiUrl))) {
            write(records);
            log.debug("Deleted auth record for {}", tenantApiUrl);
        }
    }

    @Override
    public synchronized List<AuthRecord> list() {
        return List.copyOf(read());
    }

    @Override
    public StoreStatus isReady() {
        try {
            read();
            return StoreStatus.success();
        } catch (AuthDataStoreException e) {
            return StoreStatus.failed(e.getMessage());
        }
    }

    @Override
    public StoreStatus isConfigured() {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            return StoreStatus.failed("Directory " + parent + " does not exist");
        }
        return StoreStatus.success();
    }

    public Path file() {
        return file;
    }

    private List<AuthRecord> read() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            if (Files.size(file) == 0) {
                return List.of();
            }
            return mapper.readValue(file.toFile(), RECORDS);
        } catch (IOException e) {
            throw new AuthDataStoreException("Could not read auth data from " + file, e);
        }
    }

    private void write(List<AuthRecord> records) {
        try {
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), records);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new AuthDataStoreException("Could not write auth data to " + file, e);
        }
    }
}
