package com.kmg.dms.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "dms")
public class DmsProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    private Archive archive = new Archive();
    @NotNull
    private Storage storage = new Storage();
    @NotNull
    private State state = new State();
    @NotNull
    private Logs logs = new Logs();
    @NotNull
    private Encryption encryption = new Encryption();
    @NotNull
    private Lock lock = new Lock();
    @NotNull
    private Scan scan = new Scan();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Archive getArchive() {
        return archive;
    }

    public void setArchive(Archive archive) {
        this.archive = archive;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Encryption getEncryption() {
        return encryption;
    }

    public void setEncryption(Encryption encryption) {
        this.encryption = encryption;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public static class Archive {
        @NotBlank
        private String rootDir;
        @NotBlank
        private String tenantFolderPattern = "^\\d{8}$";
        @NotEmpty
        private List<String> supportedExtensions = List.of(
                "pdf", "doc", "docx", "xls", "xlsx", "jpg", "jpeg", "png", "tiff", "txt", "csv");
        @NotNull
        private List<String> skipNames = List.of("thumbs.db", "desktop.ini", ".ds_store");

        public String getRootDir() {
            return rootDir;
        }

        public void setRootDir(String rootDir) {
            this.rootDir = rootDir;
        }

        public String getTenantFolderPattern() {
            return tenantFolderPattern;
        }

        public void setTenantFolderPattern(String tenantFolderPattern) {
            this.tenantFolderPattern = tenantFolderPattern;
        }

        public List<String> getSupportedExtensions() {
            return supportedExtensions;
        }

        public void setSupportedExtensions(List<String> supportedExtensions) {
            this.supportedExtensions = supportedExtensions;
        }

        public List<String> getSkipNames() {
            return skipNames;
        }

        public void setSkipNames(List<String> skipNames) {
            this.skipNames = skipNames;
        }
    }

    public static class Storage {
        @NotBlank
        private String contentDir;
        @NotBlank
        private String splitDir;
        @NotBlank
        private String spoolDir;

        public String getContentDir() {
            return contentDir;
        }

        public void setContentDir(String contentDir) {
            this.contentDir = contentDir;
        }

        public String getSplitDir() {
            return splitDir;
        }

        public void setSplitDir(String splitDir) {
            this.splitDir = splitDir;
        }

        public String getSpoolDir() {
            return spoolDir;
        }

        public void setSpoolDir(String spoolDir) {
            this.spoolDir = spoolDir;
        }
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Encryption {
        /**
         * Base64 encoded 256-bit AES key.
         */
        @NotBlank
        private String key;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }

    public static class Lock {
        @NotBlank
        private String name = "archive_scanner";
        @NotNull
        private Duration ttl = Duration.ofMinutes(30);

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Scan {
        @Min(1)
        private int maxWorkers = 4;
        @Min(1)
        private int progressInterval = 10;
        @Min(1)
        private int codePages = 1;
        @NotNull
        private Duration codeTimeout = Duration.ofSeconds(10);
        @NotBlank
        private String cron = "-";
        @NotNull
        private Retry retry = new Retry();

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public int getProgressInterval() {
            return progressInterval;
        }

        public void setProgressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
        }

        public int getCodePages() {
            return codePages;
        }

        public void setCodePages(int codePages) {
            this.codePages = codePages;
        }

        public Duration getCodeTimeout() {
            return codeTimeout;
        }

        public void setCodeTimeout(Duration codeTimeout) {
            this.codeTimeout = codeTimeout;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public Retry getRetry() {
            return retry;
        }

        public void setRetry(Retry retry) {
            this.retry = retry;
        }
    }

    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(10);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }
}
