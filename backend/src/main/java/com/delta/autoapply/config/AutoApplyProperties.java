package com.delta.autoapply.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@ConfigurationProperties(prefix = "autoapply")
public class AutoApplyProperties {
    private Profile profile = new Profile();
    private Pacing pacing = new Pacing();
    private Form form = new Form();
    private Search search = new Search();
    private Ai ai = new Ai();
    private Audit audit = new Audit();
    private Browser browser = new Browser();
    private Executor executor = new Executor();

    public Profile getProfile() {
        return profile;
    }

    public void setProfile(Profile profile) {
        this.profile = profile;
    }

    public Pacing getPacing() {
        return pacing;
    }

    public void setPacing(Pacing pacing) {
        this.pacing = pacing;
    }

    public Form getForm() {
        return form;
    }

    public void setForm(Form form) {
        this.form = form;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Ai getAi() {
        return ai;
    }

    public void setAi(Ai ai) {
        this.ai = ai;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public static class Profile {
        private String text = "";
        private String file = "";

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text == null ? "" : text;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file == null ? "" : file.trim();
        }

        /**
         * Profile text handed to the AI collaborator. A readable profile file wins over inline text.
         */
        public String resolve() {
            if (file != null && !file.isBlank()) {
                Path path = Path.of(file);
                if (Files.isReadable(path)) {
                    try {
                        return Files.readString(path, StandardCharsets.UTF_8);
                    } catch (IOException ignored) {
                        // Fall back to the inline profile text.
                    }
                }
            }
            return text == null ? "" : text;
        }
    }

    public static class Pacing {
        private int minActionDelayMs = 1500;
        private int maxActionDelayMs = 4000;
        private double hesitationProbability = 0.15;
        private int minHesitationMs = 500;
        private int maxHesitationMs = 1500;
        private int minKeystrokeDelayMs = 30;
        private int maxKeystrokeDelayMs = 100;

        public int getMinActionDelayMs() {
            return Math.max(0, minActionDelayMs);
        }

        public void setMinActionDelayMs(int minActionDelayMs) {
            this.minActionDelayMs = Math.max(0, minActionDelayMs);
        }

        public int getMaxActionDelayMs() {
            return Math.max(getMinActionDelayMs(), maxActionDelayMs);
        }

        public void setMaxActionDelayMs(int maxActionDelayMs) {
            this.maxActionDelayMs = Math.max(0, maxActionDelayMs);
        }

        public double getHesitationProbability() {
            return Math.min(1.0, Math.max(0.0, hesitationProbability));
        }

        public void setHesitationProbability(double hesitationProbability) {
            this.hesitationProbability = Math.min(1.0, Math.max(0.0, hesitationProbability));
        }

        public int getMinHesitationMs() {
            return Math.max(0, minHesitationMs);
        }

        public void setMinHesitationMs(int minHesitationMs) {
            this.minHesitationMs = Math.max(0, minHesitationMs);
        }

        public int getMaxHesitationMs() {
            return Math.max(getMinHesitationMs(), maxHesitationMs);
        }

        public void setMaxHesitationMs(int maxHesitationMs) {
            this.maxHesitationMs = Math.max(0, maxHesitationMs);
        }

        public int getMinKeystrokeDelayMs() {
            return Math.max(0, minKeystrokeDelayMs);
        }

        public void setMinKeystrokeDelayMs(int minKeystrokeDelayMs) {
            this.minKeystrokeDelayMs = Math.max(0, minKeystrokeDelayMs);
        }

        public int getMaxKeystrokeDelayMs() {
            return Math.max(getMinKeystrokeDelayMs(), maxKeystrokeDelayMs);
        }

        public void setMaxKeystrokeDelayMs(int maxKeystrokeDelayMs) {
            this.maxKeystrokeDelayMs = Math.max(0, maxKeystrokeDelayMs);
        }
    }

    public static class Form {
        private int maxPages = 10;
        private int minLabelLength = 3;
        private int surfaceWaitSeconds = 5;
        private int confirmationWaitMs = 2500;
        private int confirmationPollMs = 250;
        private int maxRewindSteps = 10;

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getMinLabelLength() {
            return Math.max(1, minLabelLength);
        }

        public void setMinLabelLength(int minLabelLength) {
            this.minLabelLength = Math.max(1, minLabelLength);
        }

        public int getSurfaceWaitSeconds() {
            return Math.max(1, surfaceWaitSeconds);
        }

        public void setSurfaceWaitSeconds(int surfaceWaitSeconds) {
            this.surfaceWaitSeconds = Math.max(1, surfaceWaitSeconds);
        }

        public int getConfirmationWaitMs() {
            return Math.max(1, confirmationWaitMs);
        }

        public void setConfirmationWaitMs(int confirmationWaitMs) {
            this.confirmationWaitMs = Math.max(1, confirmationWaitMs);
        }

        public int getConfirmationPollMs() {
            return Math.max(1, confirmationPollMs);
        }

        public void setConfirmationPollMs(int confirmationPollMs) {
            this.confirmationPollMs = Math.max(1, confirmationPollMs);
        }

        public int getMaxRewindSteps() {
            return Math.max(0, maxRewindSteps);
        }

        public void setMaxRewindSteps(int maxRewindSteps) {
            this.maxRewindSteps = Math.max(0, maxRewindSteps);
        }
    }

    public static class Search {
        private int maxResultPages = 10;

        public int getMaxResultPages() {
            return Math.max(1, maxResultPages);
        }

        public void setMaxResultPages(int maxResultPages) {
            this.maxResultPages = Math.max(1, maxResultPages);
        }
    }

    public static class Ai {
        private static final String DEFAULT_BASE_URL = "https://api.moonshot.ai/v1";
        private static final String DEFAULT_MODEL = "kimi-k2-0711-preview";

        private String baseUrl = DEFAULT_BASE_URL;
        private String apiKey = "";
        private String model = DEFAULT_MODEL;
        private int timeoutSeconds = 60;
        private double temperature = 0.3;

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return DEFAULT_BASE_URL;
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey == null ? "" : apiKey.trim();
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return !getApiKey().isEmpty();
        }

        public String getModel() {
            return model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public double getTemperature() {
            return Math.min(2.0, Math.max(0.0, temperature));
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    public static class Audit {
        private String directory = "./data/audit";

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "./data/audit" : directory.trim();
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Browser {
        private boolean headless = false;
        private String userDataDir = "./data/browser-profile";
        private int pageLoadTimeoutSeconds = 30;
        private boolean startMinimized = false;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getUserDataDir() {
            return userDataDir;
        }

        public void setUserDataDir(String userDataDir) {
            this.userDataDir = userDataDir;
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = Math.max(1, pageLoadTimeoutSeconds);
        }

        public boolean isStartMinimized() {
            return startMinimized;
        }

        public void setStartMinimized(boolean startMinimized) {
            this.startMinimized = startMinimized;
        }
    }

    public static class Executor {
        private int applicationThreads = 2;

        public int getApplicationThreads() {
            return Math.max(1, applicationThreads);
        }

        public void setApplicationThreads(int applicationThreads) {
            this.applicationThreads = Math.max(1, applicationThreads);
        }
    }
}
