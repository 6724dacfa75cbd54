package com.assetcore.remote;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetcore.runtime.AppConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class RemoteApiClient {
    private static final Logger log = LoggerFactory.getLogger(RemoteApiClient.class);

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final long infospaceId;
    private final String accessToken;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public RemoteApiClient(OkHttpClient httpClient, String baseUrl, long infospaceId, String accessToken) {
        this.httpClient = httpClient;
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid API base URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.infospaceId = infospaceId;
        this.accessToken = accessToken;
    }

    public static RemoteApiClient fromConfig(AppConfig.ApiConfig config, Map<String, String> environment) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
        String token = config.getTokenEnv() == null ? null : environment.get(config.getTokenEnv());
        if (token == null || token.isBlank()) {
            log.warn("api.token.missing env={}; requests will be sent without Authorization", config.getTokenEnv());
        }
        return new RemoteApiClient(client, config.getBaseUrl(), config.getInfospaceId(), token);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public long infospaceId() {
        return infospaceId;
    }

    HttpUrl.Builder apiUrl() {
        return baseUrl.newBuilder().addPathSegment("api").addPathSegment("v1");
    }

    HttpUrl.Builder assetUrl(long assetId) {
        return apiUrl()
                .addPathSegment("infospaces")
                .addPathSegment(Long.toString(infospaceId))
                .addPathSegment("assets")
                .addPathSegment(Long.toString(assetId));
    }

    Request.Builder authorized(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder;
    }

    CompletableFuture<byte[]> send(Request request) {
        CompletableFuture<byte[]> result = new CompletableFuture<>();
        String url = request.url().toString();
        log.debug("api.request method={} url={}", request.method(), url);
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    byte[] bytes = body == null ? new byte[0] : body.bytes();
                    if (!response.isSuccessful()) {
                        result.completeExceptionally(new RemoteApiException(response.code(), url, errorDetail(bytes)));
                        return;
                    }
                    result.complete(bytes);
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    String errorDetail(byte[] body) {
        if (body.length == 0) {
            return "";
        }
        try {
            JsonNode root = mapper.readTree(body);
            JsonNode detail = root.path("detail");
            if (!detail.isMissingNode() && !detail.isNull()) {
                return detail.isValueNode() ? detail.asText() : detail.toString();
            }
            return root.path("message").asText("");
        } catch (IOException e) {
            return new String(body, StandardCharsets.UTF_8).trim();
        }
    }
}
