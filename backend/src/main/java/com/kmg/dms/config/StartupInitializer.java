package com.kmg.dms.config;

import com.kmg.dms.repo.ScanJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final DmsProperties properties;
    private final DatabaseSchema databaseSchema;
    private final ScanJobRepository scanJobRepository;

    public StartupInitializer(
            DmsProperties properties,
            DatabaseSchema databaseSchema,
            ScanJobRepository scanJobRepository
    ) {
        this.properties = properties;
        this.databaseSchema = databaseSchema;
        this.scanJobRepository = scanJobRepository;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        databaseSchema.initialize();
        int recovered = scanJobRepository.recoverRunningJobsAfterRestart();
        if (recovered > 0) {
            log.warn("Marked {} interrupted scan job(s) as FAILED", recovered);
        }
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(Path.of(properties.getBaseDir()));
        Files.createDirectories(Path.of(properties.getArchive().getRootDir()));
        Files.createDirectories(Path.of(properties.getStorage().getContentDir()));
        Files.createDirectories(Path.of(properties.getStorage().getSplitDir()));
        Files.createDirectories(Path.of(properties.getStorage().getSpoolDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
    }
}
