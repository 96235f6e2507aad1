package com.cvjudge.engine.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of provider adapters by judge id.
 *
 * Built once at startup from configuration. The orchestrator only ever
 * sees judge ids and this registry, never a concrete provider.
 */
public class JudgeClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(JudgeClientRegistry.class);

    private final Map<String, JudgeClient> clients = new LinkedHashMap<>();

    public JudgeClientRegistry(Map<String, ? extends JudgeClient> clients) {
        clients.forEach((judgeId, client) -> {
            this.clients.put(judgeId, client);
            log.info("Registered judge '{}' -> {}", judgeId, client.getClass().getSimpleName());
        });
    }

    public Optional<JudgeClient> find(String judgeId) {
        return Optional.ofNullable(clients.get(judgeId));
    }

    /** Registered judge ids, in registration order. */
    public List<String> judgeIds() {
        return List.copyOf(clients.keySet());
    }
}
