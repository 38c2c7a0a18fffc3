package com.kmg.dms.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.dms.dto.EventMessage;
import com.kmg.dms.repo.SystemLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pipeline events: pushed to SSE subscribers, and for {@link #record} also stored in {@code system_logs}.
 */
@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    public enum Level {
        DEBUG,
        INFO,
        WARNING,
        ERROR
    }

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final SystemLogRepository systemLogRepository;
    private final ObjectMapper objectMapper;

    public EventService(SystemLogRepository systemLogRepository, ObjectMapper objectMapper) {
        this.systemLogRepository = systemLogRepository;
        this.objectMapper = objectMapper;
    }

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));

        return emitter;
    }

    public void publish(String type, String jobId, String message, Object payload) {
        EventMessage event = new EventMessage(
                type, jobId, message, OffsetDateTime.now(ZoneOffset.UTC).toString(), payload);
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(type).data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("Removing SSE emitter after send failure: {}", e.getMessage());
                emitters.remove(emitter);
            }
        }
    }

    /**
     * Persists a system event and forwards it to subscribers as {@code system-log}. Storage failures are logged
     * and never propagate into the pipeline.
     */
    public void record(Level level, String source, String message, Map<String, ?> details) {
        try {
            String detailsJson = details == null || details.isEmpty() ? null : objectMapper.writeValueAsString(details);
            systemLogRepository.insert(level.name(), source, message, detailsJson);
        } catch (IOException | DataAccessException e) {
            log.warn("Failed to store system event from {}: {}", source, e.getMessage());
        }
        publish("system-log", null, message, Map.of("level", level.name(), "source", source));
    }
}
