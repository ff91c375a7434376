package io.xblive.broker.internal;

import io.xblive.broker.Cancellation;
import io.xblive.broker.NetworkException;
import io.xblive.broker.OperationCancelledException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Helper methods for building JSON and form requests and sending them under a {@link Cancellation}.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpRequest jsonPost(String url, Object payload, Duration timeout, Map<String, String> headers)
        throws IOException {

        byte[] body = Json.mapper().writeValueAsBytes(payload);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .timeout(timeout);
        headers.forEach(builder::header);
        return builder.build();
    }

    public static HttpRequest formPost(String url, Map<String, String> form, Duration timeout) {
        StringJoiner encoded = new StringJoiner("&");
        form.forEach((key, value) -> {
            if (value != null) {
                encoded.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        });
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(encoded.toString()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
    }

    public static HttpRequest bearerGet(String url, String bearerToken, Duration timeout) {
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .GET()
            .header("Authorization", "Bearer " + bearerToken)
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
    }

    /**
     * GET against an Xbox Live API, authorized with an {@code XBL3.0} identity token.
     */
    public static HttpRequest xboxLiveGet(String url, String identityToken, String contractVersion, Duration timeout) {
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .GET()
            .header("Authorization", identityToken)
            .header("x-xbl-contract-version", contractVersion)
            .header("Accept-Language", "en-US")
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
    }

    /**
     * Sends the request and waits for the response head. Cancelling {@code cancellation} or
     * interrupting the thread releases the caller immediately.
     *
     * @param operation short description used in exception messages.
     */
    public static HttpResponse<InputStream> send(
        HttpClient client,
        HttpRequest request,
        Cancellation cancellation,
        String operation
    ) throws NetworkException, OperationCancelledException {

        cancellation.throwIfCancelled(operation);
        CompletableFuture<HttpResponse<InputStream>> future =
            client.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());

        try (Cancellation.Registration ignored = cancellation.onCancel(() -> future.cancel(true))) {
            return future.get();
        } catch (CancellationException ex) {
            throw new OperationCancelledException(operation + " cancelled", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(operation + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new NetworkException(operation + ": " + cause.getMessage(), cause);
        }
    }
}
