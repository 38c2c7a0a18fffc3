package com.kmg.dms.api;

import com.kmg.dms.dto.DocumentView;
import com.kmg.dms.service.DocumentProcessingService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {
    private final DocumentProcessingService documentProcessingService;

    public DocumentController(DocumentProcessingService documentProcessingService) {
        this.documentProcessingService = documentProcessingService;
    }

    @PostMapping("/{id}/reprocess")
    public List<DocumentView> reprocess(@PathVariable String id) {
        return documentProcessingService.reprocess(id).stream().map(DocumentView::from).toList();
    }
}
