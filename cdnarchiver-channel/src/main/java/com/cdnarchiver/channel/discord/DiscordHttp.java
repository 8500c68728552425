package com.cdnarchiver.channel.discord;

import com.cdnarchiver.common.logging.LogRedact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous JSON-over-HTTP calls against the Discord API.
 * Non-2xx responses complete exceptionally with {@link DiscordApi.ApiError};
 * transport failures complete with the underlying {@link IOException}.
 */
@Slf4j
public class DiscordHttp {

    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    public DiscordHttp(OkHttpClient httpClient, ObjectMapper objectMapper, String apiBase) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase != null ? apiBase : DiscordApi.API_BASE;
    }

    public DiscordHttp(String apiBase) {
        this(defaultClient(), new ObjectMapper(), apiBase);
    }

    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(120))
                .writeTimeout(Duration.ofSeconds(120))
                .build();
    }

    public String getApiBase() {
        return apiBase;
    }

    /**
     * Multipart body in the shape Discord expects for a single-file message.
     */
    public RequestBody fileMessageBody(Path file, String filename) throws IOException {
        String payload = objectMapper.writeValueAsString(Map.of(
                "attachments", List.of(Map.of("id", 0, "filename", filename))));
        String probed = Files.probeContentType(file);
        MediaType contentType = probed != null ? MediaType.parse(probed) : OCTET_STREAM;
        return new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("payload_json", payload)
                .addFormDataPart("files[0]", filename, RequestBody.create(file.toFile(), contentType))
                .build();
    }

    /**
     * Execute a request and parse the JSON response body.
     *
     * @param operation short label used in errors and logs
     */
    public CompletableFuture<JsonNode> call(String operation, Request request) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("Discord {} transport failure: {}", operation,
                        LogRedact.redactSensitiveText(String.valueOf(e.getMessage())));
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    String text = body != null ? body.string() : "";
                    if (!response.isSuccessful()) {
                        DiscordApi.ApiError error = DiscordApi.toApiError(operation, response.code(), text);
                        log.warn("{}", LogRedact.redactSensitiveText(error.getMessage()));
                        future.completeExceptionally(error);
                        return;
                    }
                    future.complete(text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text));
                } catch (IOException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }
}
