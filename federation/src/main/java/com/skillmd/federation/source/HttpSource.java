package com.skillmd.federation.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shared plumbing for sources backed by a JSON REST API.
 *
 * Uses java.net.http.HttpClient so each request's timeout can be cut down to
 * whatever is left of the caller's {@link CallContext}. Subclasses add their
 * auth headers and map responses to {@link ExternalSkill}s.
 */
public abstract class HttpSource implements Source {

    private static final Logger log = LoggerFactory.getLogger(HttpSource.class);

    protected static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    protected static final String   USER_AGENT      = "SkillMD/1.0";

    protected final HttpClient   http;
    protected final ObjectMapper json;
    protected final String       baseUrl;
    protected final String       token;

    private volatile boolean enabled = true;

    protected HttpSource(String baseUrl, String token, ObjectMapper json, HttpClient http) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.token   = token == null ? "" : token;
        this.json    = json;
        this.http    = http;
    }

    /** Default client: HTTP/1.1, 10-second connect timeout. */
    public static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public boolean enabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    protected boolean hasToken() {
        return !token.isBlank();
    }

    /** Add auth and content-negotiation headers for this backend. */
    protected abstract void applyHeaders(HttpRequest.Builder request);

    // ------------------------------------------------------------------
    // Request helpers
    // ------------------------------------------------------------------

    /**
     * GET {@code baseUrl + pathAndQuery}.
     *
     * @throws SourceException TRANSPORT if the request could not complete,
     *         CANCELLED / DEADLINE_EXCEEDED if the caller's context ended
     */
    protected HttpResponse<String> get(CallContext ctx, String pathAndQuery) {
        ctx.checkActive(name());
        String url = baseUrl + pathAndQuery;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(ctx.timeoutOr(REQUEST_TIMEOUT))
                .header("User-Agent", USER_AGENT)
                .GET();
        applyHeaders(builder);

        try {
            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            log.debug("GET {} -> {}", url, resp.statusCode());
            return resp;
        } catch (HttpTimeoutException e) {
            if (ctx.isDone()) {
                throw ctx.endedException(name());
            }
            throw new SourceException(SourceException.Kind.TRANSPORT, name(), "timed out: GET " + url, e);
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.TRANSPORT, name(), "request failed: GET " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException(SourceException.Kind.CANCELLED, name(), "interrupted: GET " + url, e);
        }
    }

    protected <T> T decode(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new SourceException(SourceException.Kind.DECODE, name(),
                    "failed to decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    protected <T> T decode(String body, TypeReference<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new SourceException(SourceException.Kind.DECODE, name(),
                    "failed to decode response: " + e.getOriginalMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Shared behaviour
    // ------------------------------------------------------------------

    /**
     * Soft failure on search: the upstream rejected the credentials, throttled
     * us or is otherwise unhappy. Reported as an empty page, never as an error.
     */
    protected SearchResult softFailure(SearchOptions options, int status) {
        log.warn("{} search answered HTTP {}; returning no results", name(), status);
        return SearchResult.empty(name(), options);
    }

    /**
     * Content already loaded is returned as-is; otherwise the full skill is
     * fetched and its content returned ("" if the skill no longer exists).
     */
    @Override
    public String getContent(CallContext ctx, ExternalSkill skill) {
        if (skill.hasContent()) {
            return skill.content();
        }
        return getSkill(ctx, skill.id())
                .map(ExternalSkill::content)
                .orElse("");
    }

    protected static boolean isOk(HttpResponse<?> resp) {
        return resp.statusCode() == 200;
    }

    protected static String encodeQuery(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** Percent-encode one path segment (spaces as %20, slashes escaped). */
    protected static String encodeSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Encode each segment of a slash-separated path, keeping the slashes. */
    protected static String encodePath(String path) {
        return Arrays.stream(path.split("/", -1))
                .map(HttpSource::encodeSegment)
                .collect(Collectors.joining("/"));
    }

    protected static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
