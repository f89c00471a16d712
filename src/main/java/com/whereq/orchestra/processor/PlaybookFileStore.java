package com.whereq.orchestra.processor;

import com.whereq.orchestra.config.OrchestraProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Writes playbook content to the playbook directory so the automation tool can be pointed at a file
 */
@Slf4j
@Component
public class PlaybookFileStore {

    private final Path directory;

    public PlaybookFileStore(OrchestraProperties properties) {
        this.directory = Paths.get(properties.getPlaybooks().getDirectory());
    }

    /**
     * Store new content under a generated file name
     *
     * @return absolute path of the written file
     */
    public Mono<String> write(String content) {
        return Mono.fromCallable(() -> {
            Files.createDirectories(directory);
            String filename = "playbook_" + System.currentTimeMillis() + "_"
                + UUID.randomUUID().toString().substring(0, 8) + ".yml";
            Path file = directory.resolve(filename);
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.debug("Wrote playbook file {}", file);
            return file.toAbsolutePath().toString();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Replace the content of an existing playbook file
     */
    public Mono<Void> rewrite(String filePath, String content) {
        return Mono.fromCallable(() -> {
            Path file = Paths.get(filePath);
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }
}
