package me.golemcore.sync.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Interceptor that answers OkHttp calls from a queue of planned responses and
 * records every request. Never touches the network.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Request> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueJson(int code, String body) {
        plannedResults.add(new PlannedResult(code, body != null ? body : "", null));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(new PlannedResult(0, "", failure));
    }

    public Request takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(request);
        requestCount.incrementAndGet();

        PlannedResult plannedResult = plannedResults.poll();
        if (plannedResult == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message("mock")
                .headers(Headers.of())
                .body(ResponseBody.create(plannedResult.body().getBytes(StandardCharsets.UTF_8), JSON))
                .build();
    }

    public static String target(Request request) {
        String encodedQuery = request.url().encodedQuery();
        return encodedQuery == null ? request.url().encodedPath() : request.url().encodedPath() + "?" + encodedQuery;
    }

    private record PlannedResult(int code, String body, IOException failure) {
    }
}
