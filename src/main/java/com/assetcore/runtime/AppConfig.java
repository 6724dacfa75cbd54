package com.assetcore.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ApiConfig api = new ApiConfig();
    private CacheConfig cache = new CacheConfig();

    public ApiConfig getApi() {
        return api;
    }

    public void setApi(ApiConfig api) {
        this.api = api == null ? new ApiConfig() : api;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiConfig {
        private String baseUrl = "http://localhost:8022";
        private long infospaceId = 1;
        private String tokenEnv = "ASSETCORE_ACCESS_TOKEN";
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 30000;
        private int childPageSize = 1000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getInfospaceId() {
            return infospaceId;
        }

        public void setInfospaceId(long infospaceId) {
            this.infospaceId = infospaceId;
        }

        public String getTokenEnv() {
            return tokenEnv;
        }

        public void setTokenEnv(String tokenEnv) {
            this.tokenEnv = tokenEnv;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public int getChildPageSize() {
            return childPageSize;
        }

        public void setChildPageSize(int childPageSize) {
            this.childPageSize = childPageSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private String spoolDir = ".assetcore/blobs";

        public String getSpoolDir() {
            return spoolDir;
        }

        public void setSpoolDir(String spoolDir) {
            this.spoolDir = spoolDir;
        }
    }
}
