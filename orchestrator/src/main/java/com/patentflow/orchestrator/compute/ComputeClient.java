package com.patentflow.orchestrator.compute;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the remote compute service.
 *
 * One call = one POST to {base-url}/{endpoint}/invoke. No retries here;
 * {@link RetryingComputeCaller} decides what to do with each failure class.
 *
 * Request:  {"input": {...stage fields..., "tmp_folder": "..."}}
 * Response: {"output": {...}} where output may also arrive as a JSON string,
 *           and holds {"res": "...", "TIME(s)": 12.3, "cost": 0.42}.
 *
 * Called from worker threads, so blocking I/O here is acceptable.
 */
@Component
public class ComputeClient {

    private static final Logger log = LoggerFactory.getLogger(ComputeClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public ComputeClient(
            @Value("${patentflow.compute.base-url}") String baseUrl,
            @Value("${patentflow.compute.request-timeout:30m}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl        = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Invoke one stage endpoint once.
     *
     * @throws TransientRemoteException on 5xx or a network-level fault
     * @throws PermanentRemoteException on 4xx
     * @throws ProtocolException        on a 2xx with a malformed envelope
     * @throws RemoteCallException      if the calling thread is interrupted
     */
    public RemoteEnvelope invoke(String endpointName, Map<String, Object> payload) {
        String url = baseUrl + "/" + trimSlashes(endpointName) + "/invoke";
        String opName = "invoke " + endpointName;

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .header("User-Agent",   "PatentFlow/1.0")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(payload)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(opName + " interrupted", e);
        } catch (IOException e) {
            // HttpTimeoutException, ConnectException, resets and protocol errors all land here.
            throw new TransientRemoteException(opName + " failed: " + describe(e), e);
        }

        int status = resp.statusCode();
        if (status >= 500) {
            throw new TransientRemoteException(
                    opName + " failed: HTTP " + status + ": " + abbreviate(resp.body()), status);
        }
        if (status < 200 || status >= 300) {
            throw new PermanentRemoteException(
                    opName + " rejected: HTTP " + status + ": " + abbreviate(resp.body()), status);
        }
        log.info("{} succeeded, response size: {} chars", opName, resp.body().length());
        return parseEnvelope(resp.body());
    }

    /**
     * Parse a 2xx response body into an envelope.
     *
     * @throws ProtocolException if the body is not JSON, or output / res is missing
     */
    public RemoteEnvelope parseEnvelope(String body) {
        try {
            JsonNode root = json.readTree(body);
            JsonNode output = root == null ? null : root.get("output");
            if (output == null || output.isNull()) {
                throw new ProtocolException("Malformed response: missing 'output'");
            }
            if (output.isTextual()) {
                output = json.readTree(output.asText());
            }
            if (output == null || !output.isObject()) {
                throw new ProtocolException("Malformed response: 'output' is not an object");
            }
            JsonNode res = output.get("res");
            if (res == null || res.isNull()) {
                throw new ProtocolException("Malformed response: missing 'output.res'");
            }
            return new RemoteEnvelope(
                    res.asText(),
                    output.path("TIME(s)").asDouble(0.0),
                    output.path("cost").asDouble(0.0));
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed response: not valid JSON", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new RemoteCallException("JSON serialization failed", e);
        }
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        return msg == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String trimSlashes(String path) {
        String p = path;
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/"))   p = p.substring(0, p.length() - 1);
        return p;
    }
}
