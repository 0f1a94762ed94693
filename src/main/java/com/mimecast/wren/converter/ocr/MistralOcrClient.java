package com.mimecast.wren.converter.ocr;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.mimecast.wren.config.OcrConfig;
import com.mimecast.wren.resilience.ServiceCallException;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Mistral OCR client.
 * <p>
 * This class runs documents through the Mistral OCR service over HTTP/REST in three steps:
 * <ol>
 *     <li>Upload the file with purpose {@code ocr}</li>
 *     <li>Fetch a signed URL for the uploaded file</li>
 *     <li>Request OCR of the signed URL</li>
 * </ol>
 * Timeouts, 429 and 5xx responses are reported as transient failures.
 */
public class MistralOcrClient implements OcrService {
    private static final Logger log = LogManager.getLogger(MistralOcrClient.class);

    private static final MediaType APPLICATION_JSON = MediaType.parse("application/json");
    private static final MediaType APPLICATION_OCTET_STREAM = MediaType.parse("application/octet-stream");
    private static final String FILES_ENDPOINT = "/v1/files";
    private static final String OCR_ENDPOINT = "/v1/ocr";

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final OkHttpClient httpClient;
    private final Gson gson;

    /**
     * Constructs a new MistralOcrClient instance.
     *
     * @param config OcrConfig instance.
     */
    public MistralOcrClient(OcrConfig config) {
        this.baseUrl = config.getBaseUrl().replaceAll("/+$", "");
        this.apiKey = config.getApiKey();
        this.model = config.getModel();
        int timeout = config.getTimeoutSeconds();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeout, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .writeTimeout(timeout, TimeUnit.SECONDS)
                .callTimeout(timeout * 3L, TimeUnit.SECONDS)
                .build();
        this.gson = new Gson();
        log.debug("Mistral OCR client initialized with {}", baseUrl);
    }

    @Override
    public String getEndpoint() {
        return baseUrl + OCR_ENDPOINT;
    }

    @Override
    public OcrDocument process(String filename, File document, OcrRequest request) throws ServiceCallException, IOException {
        String fileId = upload(filename, document);
        String url = signedUrl(fileId);
        return ocr(url, request);
    }

    /**
     * Uploads document.
     *
     * @param filename Document name.
     * @param document Document file.
     * @return File id.
     */
    String upload(String filename, File document) throws ServiceCallException, IOException {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("purpose", "ocr")
                .addFormDataPart("file", filename, RequestBody.create(document, APPLICATION_OCTET_STREAM))
                .build();

        Request request = authorized(new Request.Builder().url(baseUrl + FILES_ENDPOINT).post(body));
        JsonObject json = execute(request, "upload");
        String id = string(json, "id");
        if (id == null) {
            throw new ServiceCallException("Upload returned no file id", 200, false, null);
        }
        log.debug("Uploaded {} as {}", filename, id);
        return id;
    }

    /**
     * Gets signed URL for uploaded file.
     *
     * @param fileId File id.
     * @return Signed URL.
     */
    String signedUrl(String fileId) throws ServiceCallException, IOException {
        Request request = authorized(new Request.Builder().url(baseUrl + FILES_ENDPOINT + "/" + fileId + "/url?expiry=24").get());
        JsonObject json = execute(request, "signed url");
        String url = string(json, "url");
        if (url == null) {
            throw new ServiceCallException("Signed URL response has no url", 200, false, null);
        }
        return url;
    }

    /**
     * Requests OCR.
     *
     * @param documentUrl Signed document URL.
     * @param options     OcrRequest instance.
     * @return OcrDocument instance.
     */
    OcrDocument ocr(String documentUrl, OcrRequest options) throws ServiceCallException, IOException {
        JsonObject document = new JsonObject();
        document.addProperty("type", "document_url");
        document.addProperty("document_url", documentUrl);

        JsonObject payload = new JsonObject();
        payload.addProperty("model", model);
        payload.add("document", document);
        payload.addProperty("include_image_base64", options.isIncludeImages());
        if (options.getImageLimit() > 0) {
            payload.addProperty("image_limit", options.getImageLimit());
        }
        payload.addProperty("image_min_size", options.getImageMinSize());

        Request request = authorized(new Request.Builder()
                .url(baseUrl + OCR_ENDPOINT)
                .post(RequestBody.create(gson.toJson(payload), APPLICATION_JSON)));
        return parseDocument(execute(request, "ocr"));
    }

    /**
     * Parses OCR response.
     *
     * @param json Response JSON.
     * @return OcrDocument instance.
     */
    OcrDocument parseDocument(JsonObject json) {
        List<OcrPage> pages = new ArrayList<>();
        JsonArray pageArray = json.has("pages") && json.get("pages").isJsonArray() ? json.getAsJsonArray("pages") : new JsonArray();
        for (int i = 0; i < pageArray.size(); i++) {
            JsonObject page = pageArray.get(i).getAsJsonObject();
            List<OcrImage> images = new ArrayList<>();
            if (page.has("images") && page.get("images").isJsonArray()) {
                for (JsonElement element : page.getAsJsonArray("images")) {
                    JsonObject image = element.getAsJsonObject();
                    images.add(new OcrImage(
                            string(image, "id"),
                            integer(image, "top_left_x"),
                            integer(image, "top_left_y"),
                            integer(image, "bottom_right_x"),
                            integer(image, "bottom_right_y"),
                            string(image, "image_base64")
                    ));
                }
            }
            int index = page.has("index") ? integer(page, "index") : i;
            pages.add(new OcrPage(index, string(page, "markdown"), images));
        }

        int processed = pages.size();
        if (json.has("usage_info") && json.get("usage_info").isJsonObject()) {
            JsonObject usage = json.getAsJsonObject("usage_info");
            if (usage.has("pages_processed")) {
                processed = integer(usage, "pages_processed");
            }
        }
        return new OcrDocument(string(json, "model"), pages, processed);
    }

    private Request authorized(Request.Builder builder) {
        return builder
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json")
                .build();
    }

    /**
     * Executes request and parses JSON response.
     *
     * @param request Request instance.
     * @param step    Step name for messages.
     * @return Response JSON.
     */
    private JsonObject execute(Request request, String step) throws ServiceCallException, IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("Mistral {} failed with status: {}", step, response.code());
                throw ServiceCallException.forStatus(response.code(),
                        "Mistral " + step + " failed with HTTP " + response.code() + ": " + abbreviate(body));
            }
            try {
                JsonElement element = JsonParser.parseString(body);
                if (!element.isJsonObject()) {
                    throw new ServiceCallException("Mistral " + step + " returned non-object JSON", response.code(), false, null);
                }
                return element.getAsJsonObject();
            } catch (JsonParseException e) {
                throw new ServiceCallException("Mistral " + step + " returned invalid JSON", response.code(), false, e);
            }
        } catch (InterruptedIOException e) {
            throw ServiceCallException.timeout("Mistral " + step + " timed out: " + e.getMessage(), e);
        }
    }

    private static String string(JsonObject json, String name) {
        return json.has(name) && json.get(name).isJsonPrimitive() ? json.get(name).getAsString() : null;
    }

    private static int integer(JsonObject json, String name) {
        return json.has(name) && json.get(name).isJsonPrimitive() ? json.get(name).getAsInt() : 0;
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
