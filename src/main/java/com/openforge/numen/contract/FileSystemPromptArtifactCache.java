package com.openforge.numen.contract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps artifacts under {@code {artifact-dir}/{agentId}/}:
 *
 *   agent_contract.json
 *   system_prompt.txt
 *
 * Files are written to a temp sibling and moved into place so a reader
 * never sees a half-written file.
 */
@Slf4j
@Component
public class FileSystemPromptArtifactCache implements PromptArtifactCache {

    static final String CONTRACT_FILE = "agent_contract.json";
    static final String PROMPT_FILE   = "system_prompt.txt";

    private final Path root;

    public FileSystemPromptArtifactCache(ContractProperties properties) {
        this(Paths.get(properties.artifactDir()));
    }

    FileSystemPromptArtifactCache(Path root) {
        this.root = root;
    }

    @Override
    public Optional<Artifact> read(String agentId) {
        Path dir = agentDir(agentId);
        Path contract = dir.resolve(CONTRACT_FILE);
        Path prompt = dir.resolve(PROMPT_FILE);
        if (!Files.exists(contract) && !Files.exists(prompt)) {
            return Optional.empty();
        }
        return Optional.of(new Artifact(readIfPresent(contract), readIfPresent(prompt)));
    }

    @Override
    public void write(String agentId, Artifact artifact) {
        Path dir = agentDir(agentId);
        try {
            Files.createDirectories(dir);
            writeAtomically(dir.resolve(CONTRACT_FILE), artifact.contractJson());
            writeAtomically(dir.resolve(PROMPT_FILE), artifact.systemPrompt());
            log.debug("[Artifact] Wrote artifact for agent {} under {}", agentId, dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifact for agent " + agentId, e);
        }
    }

    private Path agentDir(String agentId) {
        Path dir = root.resolve(agentId).normalize();
        if (!dir.startsWith(root.normalize()) || agentId.isBlank()) {
            throw new IllegalArgumentException("Illegal agent id for artifact path: " + agentId);
        }
        return dir;
    }

    private static String readIfPresent(Path file) {
        if (!Files.exists(file)) return null;
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
