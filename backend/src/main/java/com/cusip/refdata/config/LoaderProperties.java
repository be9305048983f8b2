package com.cusip.refdata.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "loader")
public class LoaderProperties {
    public static final String DEFAULT_FILE_NAME_TEMPLATE = "CED{MM}-{DD}*{TYPE}.PIP";

    private Source source = new Source();
    private Staging staging = new Staging();
    private Lock lock = new Lock();
    private Api api = new Api();
    private Cli cli = new Cli();

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Staging getStaging() {
        return staging;
    }

    public void setStaging(Staging staging) {
        this.staging = staging;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Source {
        private String type = "local";
        private String directory = "/data/pif_files";
        private String fileNameTemplate = DEFAULT_FILE_NAME_TEMPLATE;
        private S3 s3 = new S3();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getFileNameTemplate() {
            if (fileNameTemplate == null || fileNameTemplate.isBlank()) {
                return DEFAULT_FILE_NAME_TEMPLATE;
            }
            return fileNameTemplate.trim();
        }

        public void setFileNameTemplate(String fileNameTemplate) {
            this.fileNameTemplate = fileNameTemplate;
        }

        public S3 getS3() {
            return s3;
        }

        public void setS3(S3 s3) {
            this.s3 = s3;
        }
    }

    public static class S3 {
        private String bucket;
        private String prefix = "pip/";
        private String region;
        private String endpoint;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getPrefix() {
            return normalizePrefix(prefix);
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public static String normalizePrefix(String candidate) {
            if (candidate == null || candidate.isBlank()) {
                return "";
            }
            String trimmed = candidate.trim();
            while (trimmed.startsWith("/")) {
                trimmed = trimmed.substring(1);
            }
            if (trimmed.isEmpty()) {
                return "";
            }
            return trimmed.endsWith("/") ? trimmed : trimmed + "/";
        }
    }

    public static class Staging {
        private int batchSize = 5000;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }
    }

    public static class Lock {
        private int waitSeconds = 30;

        public int getWaitSeconds() {
            return Math.max(0, waitSeconds);
        }

        public void setWaitSeconds(int waitSeconds) {
            this.waitSeconds = Math.max(0, waitSeconds);
        }
    }

    public static class Api {
        private String token = "";

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public static class Cli {
        private boolean run;
        private String date = "";
        private String types = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getDate() {
            return date;
        }

        public void setDate(String date) {
            this.date = date;
        }

        public String getTypes() {
            return types;
        }

        public void setTypes(String types) {
            this.types = types;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
