package com.delta.backgrounder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "backgrounder")
public class BackgrounderProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private Http http = new Http();
    private Profile profile = new Profile();
    private Serpapi serpapi = new Serpapi();
    private Github github = new Github();
    private Proxycurl proxycurl = new Proxycurl();
    private Rapidapi rapidapi = new Rapidapi();
    private Nvidia nvidia = new Nvidia();
    private Imgbb imgbb = new Imgbb();
    private Social social = new Social();
    private References references = new References();
    private Upload upload = new Upload();
    private Stream stream = new Stream();
    private Cli cli = new Cli();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Profile getProfile() {
        return profile;
    }

    public void setProfile(Profile profile) {
        this.profile = profile;
    }

    public Serpapi getSerpapi() {
        return serpapi;
    }

    public void setSerpapi(Serpapi serpapi) {
        this.serpapi = serpapi;
    }

    public Github getGithub() {
        return github;
    }

    public void setGithub(Github github) {
        this.github = github;
    }

    public Proxycurl getProxycurl() {
        return proxycurl;
    }

    public void setProxycurl(Proxycurl proxycurl) {
        this.proxycurl = proxycurl;
    }

    public Rapidapi getRapidapi() {
        return rapidapi;
    }

    public void setRapidapi(Rapidapi rapidapi) {
        this.rapidapi = rapidapi;
    }

    public Nvidia getNvidia() {
        return nvidia;
    }

    public void setNvidia(Nvidia nvidia) {
        this.nvidia = nvidia;
    }

    public Imgbb getImgbb() {
        return imgbb;
    }

    public void setImgbb(Imgbb imgbb) {
        this.imgbb = imgbb;
    }

    public Social getSocial() {
        return social;
    }

    public void setSocial(Social social) {
        this.social = social;
    }

    public References getReferences() {
        return references;
    }

    public void setReferences(References references) {
        this.references = references;
    }

    public Upload getUpload() {
        return upload;
    }

    public void setUpload(Upload upload) {
        this.upload = upload;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return userAgent.trim();
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static class Http {
        private String userAgent;
        private int globalConcurrency = 5;
        private int requestTimeoutSeconds = 30;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }
    }

    public static class Profile {
        private String defaultProvider = "scraper";

        public String getDefaultProvider() {
            return hasText(defaultProvider) ? defaultProvider.trim() : "scraper";
        }

        public void setDefaultProvider(String defaultProvider) {
            this.defaultProvider = defaultProvider;
        }
    }

    public static class Serpapi {
        private String apiKey;
        private String baseUrl = "https://serpapi.com/search.json";
        private int maxResults = 8;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return hasText(apiKey);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMaxResults() {
            return Math.max(1, maxResults);
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }
    }

    public static class Github {
        private String apiBaseUrl = "https://api.github.com";
        private String token;
        private int searchLimit = 5;
        private int topRepos = 5;

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public int getSearchLimit() {
            return Math.max(1, searchLimit);
        }

        public void setSearchLimit(int searchLimit) {
            this.searchLimit = searchLimit;
        }

        public int getTopRepos() {
            return Math.max(1, topRepos);
        }

        public void setTopRepos(int topRepos) {
            this.topRepos = topRepos;
        }
    }

    public static class Proxycurl {
        private String apiKey;
        private String baseUrl = "https://nubela.co/proxycurl/api";

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return hasText(apiKey);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Rapidapi {
        private String apiKey;
        private String host = "linkedin-data-api.p.rapidapi.com";
        private String baseUrl;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return hasText(apiKey);
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        /**
         * Defaults to the API host itself; overridable so tests can point at a local server.
         */
        public String getBaseUrl() {
            return hasText(baseUrl) ? baseUrl : "https://" + host + "/";
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Nvidia {
        private String apiKey;
        private String baseUrl = "https://integrate.api.nvidia.com/v1";
        private String model = "meta/llama-3.1-70b-instruct";
        private double reportTemperature = 0.3;
        private int reportMaxTokens = 4000;
        private double resumeTemperature = 0.1;
        private int resumeMaxTokens = 2048;
        private int contextMaxChars = 30000;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return hasText(apiKey);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getReportTemperature() {
            return reportTemperature;
        }

        public void setReportTemperature(double reportTemperature) {
            this.reportTemperature = reportTemperature;
        }

        public int getReportMaxTokens() {
            return Math.max(256, reportMaxTokens);
        }

        public void setReportMaxTokens(int reportMaxTokens) {
            this.reportMaxTokens = reportMaxTokens;
        }

        public double getResumeTemperature() {
            return resumeTemperature;
        }

        public void setResumeTemperature(double resumeTemperature) {
            this.resumeTemperature = resumeTemperature;
        }

        public int getResumeMaxTokens() {
            return Math.max(256, resumeMaxTokens);
        }

        public void setResumeMaxTokens(int resumeMaxTokens) {
            this.resumeMaxTokens = resumeMaxTokens;
        }

        public int getContextMaxChars() {
            return Math.max(1000, contextMaxChars);
        }

        public void setContextMaxChars(int contextMaxChars) {
            this.contextMaxChars = contextMaxChars;
        }
    }

    public static class Imgbb {
        private String apiKey;
        private String uploadUrl = "https://api.imgbb.com/1/upload";
        private int expirationSeconds = 600;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return hasText(apiKey);
        }

        public String getUploadUrl() {
            return uploadUrl;
        }

        public void setUploadUrl(String uploadUrl) {
            this.uploadUrl = uploadUrl;
        }

        public int getExpirationSeconds() {
            return Math.max(60, expirationSeconds);
        }

        public void setExpirationSeconds(int expirationSeconds) {
            this.expirationSeconds = expirationSeconds;
        }
    }

    public static class Social {
        private int retryThreshold = 2;
        private Map<String, String> retryPlatforms = defaultRetryPlatforms();

        public int getRetryThreshold() {
            return Math.max(0, retryThreshold);
        }

        public void setRetryThreshold(int retryThreshold) {
            this.retryThreshold = retryThreshold;
        }

        /**
         * Platform name to site domain, in query order.
         */
        public Map<String, String> getRetryPlatforms() {
            return retryPlatforms;
        }

        public void setRetryPlatforms(Map<String, String> retryPlatforms) {
            this.retryPlatforms = retryPlatforms == null ? new LinkedHashMap<>() : new LinkedHashMap<>(retryPlatforms);
        }

        private static Map<String, String> defaultRetryPlatforms() {
            Map<String, String> platforms = new LinkedHashMap<>();
            platforms.put("Twitter/X", "twitter.com");
            platforms.put("Instagram", "instagram.com");
            platforms.put("YouTube", "youtube.com");
            platforms.put("LeetCode", "leetcode.com");
            platforms.put("Medium", "medium.com");
            return platforms;
        }
    }

    public static class References {
        private int maxCompanies = 4;

        public int getMaxCompanies() {
            return Math.max(1, maxCompanies);
        }

        public void setMaxCompanies(int maxCompanies) {
            this.maxCompanies = maxCompanies;
        }
    }

    public static class Upload {
        private long maxResumeBytes = 10L * 1024 * 1024;
        private long maxPhotoBytes = 5L * 1024 * 1024;

        public long getMaxResumeBytes() {
            return Math.max(1, maxResumeBytes);
        }

        public void setMaxResumeBytes(long maxResumeBytes) {
            this.maxResumeBytes = maxResumeBytes;
        }

        public long getMaxPhotoBytes() {
            return Math.max(1, maxPhotoBytes);
        }

        public void setMaxPhotoBytes(long maxPhotoBytes) {
            this.maxPhotoBytes = maxPhotoBytes;
        }
    }

    public static class Stream {
        private long timeoutMs = 600_000L;

        public long getTimeoutMs() {
            return Math.max(1_000L, timeoutMs);
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Cli {
        private boolean run;
        private String name;
        private String company;
        private String title;
        private String location;
        private String linkedinUrl;
        private String provider;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCompany() {
            return company;
        }

        public void setCompany(String company) {
            this.company = company;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getLinkedinUrl() {
            return linkedinUrl;
        }

        public void setLinkedinUrl(String linkedinUrl) {
            this.linkedinUrl = linkedinUrl;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
