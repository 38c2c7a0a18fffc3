package com.kmg.dms.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.dms.TestDatabase;
import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.repo.DocumentRepository;
import com.kmg.dms.repo.DocumentTypeRepository;
import com.kmg.dms.repo.EmployeeRepository;
import com.kmg.dms.repo.MatchingRuleRepository;
import com.kmg.dms.repo.ProcessedRecordRepository;
import com.kmg.dms.repo.ReviewTaskRepository;
import com.kmg.dms.repo.ScanJobRepository;
import com.kmg.dms.repo.SystemLogRepository;
import com.kmg.dms.repo.TenantRepository;
import org.apache.tika.Tika;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import javax.crypto.spec.SecretKeySpec;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The ingestion pipeline wired by hand over a temporary SQLite database and content directory. Redis is
 * unreachable, so every run proceeds with a degraded lock.
 */
final class PipelineFixture implements AutoCloseable {
    final DmsProperties properties;
    final Path archiveRoot;
    final TenantRepository tenants;
    final EmployeeRepository employees;
    final DocumentRepository documents;
    final ProcessedRecordRepository processedRecords;
    final ScanJobRepository scanJobs;
    final MatchingRuleRepository rules;
    final ReviewTaskRepository reviewTasks;
    final SystemLogRepository systemLogs;
    final ContentStore contentStore;
    final CodeExtractor codeExtractor;
    final IngestionOrchestrator orchestrator;
    final DocumentProcessingService processingService;

    PipelineFixture(Path workDir) {
        Clock clock = Clock.systemUTC();
        ObjectMapper objectMapper = new ObjectMapper();
        archiveRoot = workDir.resolve("archive");

        properties = new DmsProperties();
        properties.setBaseDir(workDir.toString());
        properties.getArchive().setRootDir(archiveRoot.toString());
        properties.getStorage().setContentDir(workDir.resolve("content").toString());
        properties.getStorage().setSplitDir(workDir.resolve("split").toString());
        properties.getStorage().setSpoolDir(workDir.resolve("spool").toString());
        properties.getScan().setMaxWorkers(4);
        properties.getScan().setProgressInterval(2);
        properties.getScan().setCodeTimeout(Duration.ofSeconds(30));

        TestDatabase database = TestDatabase.create(workDir);
        tenants = new TenantRepository(database.jdbcTemplate());
        employees = new EmployeeRepository(database.jdbcTemplate());
        documents = new DocumentRepository(database.jdbcTemplate(), objectMapper);
        processedRecords = new ProcessedRecordRepository(database.jdbcTemplate());
        scanJobs = new ScanJobRepository(database.jdbcTemplate());
        rules = new MatchingRuleRepository(database.jdbcTemplate(), objectMapper);
        reviewTasks = new ReviewTaskRepository(database.jdbcTemplate());
        systemLogs = new SystemLogRepository(database.jdbcTemplate());
        DocumentTypeRepository documentTypes = new DocumentTypeRepository(database.jdbcTemplate());

        byte[] key = new byte[32];
        for (int i = 0; i < key.length; i++) {
            key[i] = (byte) i;
        }
        StreamingCipher cipher = new StreamingCipher(new SecretKeySpec(key, "AES"));
        contentStore = new ContentStore(workDir.resolve("content"), cipher);

        EventService events = new EventService(systemLogs, objectMapper);
        RuleEngine ruleEngine = new RuleEngine(rules, clock);
        ReviewTaskService reviewTaskService = new ReviewTaskService(reviewTasks, events, clock);
        DocumentPersistenceService persistence = new DocumentPersistenceService(documents, processedRecords,
                contentStore, ruleEngine, reviewTaskService, database.transactionTemplate(), clock);

        codeExtractor = new CodeExtractor(properties);
        IdentityResolver identityResolver = new IdentityResolver(employees);
        PdfSegmenter segmenter = new PdfSegmenter(codeExtractor);
        DocumentAnalyzer analyzer = new DocumentAnalyzer(new DocumentClassifier(), codeExtractor, identityResolver,
                documentTypes, properties);
        ArchiveFileIngestor ingestor = new ArchiveFileIngestor(processedRecords, new MediaTypeDetector(new Tika()),
                analyzer, segmenter, identityResolver, persistence, events, clock, properties);

        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.opsForHash()).thenThrow(new RedisConnectionFailureException("redis down"));
        DistributedLockManager lockManager = new DistributedLockManager(redis, clock);

        DirectoryArchiveSource source = new DirectoryArchiveSource(archiveRoot,
                properties.getArchive().getTenantFolderPattern(),
                properties.getArchive().getSupportedExtensions(),
                List.of("thumbs.db", "desktop.ini", ".ds_store"));
        orchestrator = new IngestionOrchestrator(source, ingestor, lockManager, tenants, processedRecords, scanJobs,
                events, clock, properties);
        processingService = new DocumentProcessingService(documents, tenants, contentStore, analyzer, segmenter,
                identityResolver, ruleEngine, persistence, reviewTaskService, events, clock, properties);
    }

    @Override
    public void close() {
        codeExtractor.shutdown();
    }
}
