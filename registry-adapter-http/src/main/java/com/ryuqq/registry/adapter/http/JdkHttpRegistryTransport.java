package com.ryuqq.registry.adapter.http;

import com.ryuqq.registry.core.error.ErrorKind;
import com.ryuqq.registry.core.error.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * {@link RegistryTransport} backed by {@link java.net.http.HttpClient}.
 *
 * <p><strong>헤더:</strong></p>
 * <ul>
 *   <li>api-key</li>
 *   <li>Content-Type: application/json</li>
 *   <li>User-Agent</li>
 *   <li>X-Request-Attempt</li>
 * </ul>
 *
 * <p><strong>본문 크기 제한:</strong></p>
 * <ul>
 *   <li>2xx 응답의 Content-Length가 한도를 넘으면 본문을 읽지 않고 거절</li>
 *   <li>Content-Length가 없으면 한도 + 1 바이트까지만 읽고, 초과 시 거절</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JdkHttpRegistryTransport implements RegistryTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpRegistryTransport.class);

    private final HttpClient client;
    private final RegistrySettings settings;

    public JdkHttpRegistryTransport(RegistrySettings settings) {
        this(HttpClient.newBuilder()
                .connectTimeout(settings.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            settings);
    }

    public JdkHttpRegistryTransport(HttpClient client, RegistrySettings settings) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.client = client;
        this.settings = settings;
    }

    @Override
    public RegistryResponse execute(RegistryRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        log.debug("{} {} (attempt {})", request.method(), request.uri(), request.attempt());

        HttpResponse<InputStream> response;
        try {
            response = client.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new RegistryException(ErrorKind.TIMEOUT,
                "Request timed out after " + settings.requestTimeout().toMillis() + "ms: " + request.uri(), e);
        } catch (IOException e) {
            throw new RegistryException(ErrorKind.NETWORK, "Network failure: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(ErrorKind.UNEXPECTED, "Request interrupted: " + request.uri(), e);
        }

        try (InputStream body = response.body()) {
            int status = response.statusCode();
            boolean successful = status >= 200 && status < 300;
            long declared = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            if (successful && declared > request.maxBodyBytes()) {
                throw tooLarge(declared, request);
            }
            byte[] bytes = readBounded(body, request);
            return new RegistryResponse(status, response.headers().map(), bytes);
        } catch (HttpTimeoutException e) {
            throw new RegistryException(ErrorKind.TIMEOUT, "Timed out reading response: " + request.uri(), e);
        } catch (IOException e) {
            throw new RegistryException(ErrorKind.NETWORK, "Failed to read response: " + e.getMessage(), e);
        }
    }

    private HttpRequest toHttpRequest(RegistryRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
            .timeout(settings.requestTimeout())
            .header("api-key", settings.apiKey())
            .header("Content-Type", "application/json")
            .header("User-Agent", settings.userAgent())
            .header("X-Request-Attempt", String.valueOf(request.attempt()));

        HttpRequest.BodyPublisher publisher = request.jsonBody() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(request.jsonBody(), StandardCharsets.UTF_8);
        return builder.method(request.method(), publisher).build();
    }

    private static byte[] readBounded(InputStream body, RegistryRequest request) throws IOException {
        long limit = request.maxBodyBytes();
        if (limit >= Integer.MAX_VALUE - 8) {
            return body.readAllBytes();
        }
        byte[] bytes = body.readNBytes((int) limit + 1);
        if (bytes.length > limit) {
            throw tooLarge(bytes.length, request);
        }
        return bytes;
    }

    private static RegistryException tooLarge(long size, RegistryRequest request) {
        log.warn("Rejected response body of {} bytes (limit {}): {}", size, request.maxBodyBytes(), request.uri());
        return new RegistryException(ErrorKind.ATTACHMENT_TOO_LARGE,
            "Response body exceeds " + request.maxBodyBytes() + " bytes: " + request.uri());
    }
}
