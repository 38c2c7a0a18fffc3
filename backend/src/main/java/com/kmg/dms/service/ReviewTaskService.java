package com.kmg.dms.service;

import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.ReviewSource;
import com.kmg.dms.model.ReviewTask;
import com.kmg.dms.model.ReviewTaskStatus;
import com.kmg.dms.repo.ReviewTaskRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class ReviewTaskService {
    static final int DEFAULT_PRIORITY = 2;
    private static final int TITLE_FILENAME_LIMIT = 50;

    private final ReviewTaskRepository reviewTaskRepository;
    private final EventService eventService;
    private final Clock clock;

    public ReviewTaskService(ReviewTaskRepository reviewTaskRepository, EventService eventService, Clock clock) {
        this.reviewTaskRepository = reviewTaskRepository;
        this.eventService = eventService;
        this.clock = clock;
    }

    /**
     * Returns the open task of the document, creating one if there is none.
     */
    public ReviewTask createReviewTask(DocumentRecord document, ReviewSource source) {
        Optional<ReviewTask> existing = reviewTaskRepository.findOpenByDocumentId(document.id());
        if (existing.isPresent()) {
            return existing.get();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String filename = document.originalFilename();
        if (filename.length() > TITLE_FILENAME_LIMIT) {
            filename = filename.substring(0, TITLE_FILENAME_LIMIT);
        }
        ReviewTask task = new ReviewTask(
                UUID.randomUUID().toString(),
                document.id(),
                "Review document: " + filename,
                "This document from " + source.displayName() + " could not be assigned automatically.\n\n"
                        + "Please check:\n"
                        + "- employee assignment\n"
                        + "- document type\n"
                        + "- period (month/year)",
                DEFAULT_PRIORITY,
                ReviewTaskStatus.OPEN,
                source,
                now,
                now,
                null
        );

        if (!reviewTaskRepository.insertIfNoOpenTask(task)) {
            // Lost a race against another worker.
            return reviewTaskRepository.findOpenByDocumentId(document.id())
                    .orElseThrow(() -> new IllegalStateException("Open review task vanished for " + document.id()));
        }

        eventService.record(EventService.Level.INFO, "TASK_CREATE",
                "Review task created for: " + document.originalFilename(),
                Map.of("document_id", document.id(), "task_id", task.id(), "source", source.name()));
        return task;
    }
}
