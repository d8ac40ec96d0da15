package com.codemend.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Editable buffers that may hold unsaved content. A buffer, when present,
 * is the authoritative content of its file.
 */
@Component
public class OpenBufferRegistry {

    private static final Logger log = LoggerFactory.getLogger(OpenBufferRegistry.class);

    private final Map<String, String> buffers = new ConcurrentHashMap<>();

    public void open(String relativePath, String content) {
        buffers.put(key(relativePath), content != null ? content : "");
        log.debug("[Buffers] Opened {}", relativePath);
    }

    public boolean isOpen(String relativePath) {
        return buffers.containsKey(key(relativePath));
    }

    public Optional<String> get(String relativePath) {
        return Optional.ofNullable(buffers.get(key(relativePath)));
    }

    /** Updates the buffer only if it is open. */
    public boolean replaceIfOpen(String relativePath, String content) {
        return buffers.computeIfPresent(key(relativePath), (k, v) -> content) != null;
    }

    public void close(String relativePath) {
        buffers.remove(key(relativePath));
    }

    private static String key(String relativePath) {
        String normalized = relativePath.replace('\\', '/');
        while (normalized.startsWith("./")) normalized = normalized.substring(2);
        return normalized;
    }
}
