package me.questcore.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.questcore.infrastructure.config.QuestProperties;
import me.questcore.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores engine state as JSON documents under a base directory:
 * <ul>
 * <li>tasks/ - all tasks
 * <li>characters/ - one file per character
 * <li>bonds/ - one file per partner bond
 * <li>routines/ - routine bundles
 * <li>inventory/ - loot per character
 * <li>confirmations/ - two-phase confirmation tokens
 * </ul>
 *
 * <p>
 * Base path configured via {@code quest.storage.base-path}, defaults to
 * {@code ${user.home}/.questcore/data}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> DIRECTORIES = List.of("tasks", "characters", "bonds", "routines", "inventory",
            "confirmations");

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final QuestProperties properties;

    private Path basePath;

    /**
     * Resolves the base path and creates one directory per store. The engine
     * cannot run without its state directory, so a failure here aborts start-up.
     */
    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        basePath = Paths.get(configured).toAbsolutePath().normalize();
        try {
            for (String store : DIRECTORIES) {
                Files.createDirectories(basePath.resolve(store));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create quest storage under " + basePath, e);
        }
        log.info("[Storage] Quest state stored at: {}", basePath);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            if (Files.notExists(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            Path file = resolvePath(directory, path);
            try {
                if (Files.deleteIfExists(file)) {
                    log.debug("[Storage] Deleted {}/{}", directory, path);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Cannot delete " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolvePath(directory, path);
            Path temp = sibling(target, TEMP_SUFFIX);
            try {
                Files.createDirectories(target.getParent());
                writeSynced(temp, content);
                if (backup && Files.exists(target)) {
                    Files.copy(target, sibling(target, BACKUP_SUFFIX), StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
                log.debug("[Storage] Saved {}/{} ({} chars)", directory, path, content.length());
            } catch (IOException e) {
                discardTemp(temp);
                throw new IllegalStateException("Cannot save " + directory + "/" + path, e);
            }
        });
    }

    private static void writeSynced(Path file, String content) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Filesystem has no atomic rename, falling back to plain move for {}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Leftover temp file {}: {}", temp, e.getMessage());
        }
    }

    private static Path sibling(Path file, String suffix) {
        return file.resolveSibling(file.getFileName() + suffix);
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path escapes storage root: " + directory + "/" + path);
        }
        return resolved;
    }
}
