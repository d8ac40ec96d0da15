package com.codemend.core.diagnostics;

import com.codemend.core.issue.RawDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Diagnostics pushed in from outside: an editor integration posting to
 * {@code /codemend/diagnostics}, or a test. The latest publication for a
 * target replaces the previous one.
 */
@Component
@ConditionalOnProperty(name = "codemend.diagnostics.provider", havingValue = "published", matchIfMissing = true)
public class PublishedDiagnosticProvider implements DiagnosticProvider {

    private static final Logger log = LoggerFactory.getLogger(PublishedDiagnosticProvider.class);

    private final Map<String, List<RawDiagnostic>> diagnostics = new ConcurrentHashMap<>();

    public void publish(String target, List<RawDiagnostic> reported) {
        diagnostics.put(normalize(target), List.copyOf(reported));
        log.debug("[Diagnostics] {} diagnostics published for {}", reported.size(), target);
    }

    public void clear(String target) {
        diagnostics.remove(normalize(target));
    }

    @Override
    public List<RawDiagnostic> getDiagnostics(String target) {
        return diagnostics.getOrDefault(normalize(target), List.of());
    }

    private static String normalize(String target) {
        String t = target.replace('\\', '/');
        return t.startsWith("./") ? t.substring(2) : t;
    }
}
