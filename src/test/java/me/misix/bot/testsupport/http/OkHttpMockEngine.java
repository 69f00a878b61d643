package me.misix.bot.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Interceptor that answers OkHttp calls from a queue instead of the network.
 * Every request is recorded with its body decoded as UTF-8.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final Deque<Object> planned = new ArrayDeque<>();
    private final Deque<CapturedRequest> captured = new ArrayDeque<>();

    public synchronized void enqueueJson(int code, String body) {
        planned.add(new Reply(code, body != null ? body : ""));
    }

    public synchronized void enqueueFailure(IOException failure) {
        planned.add(failure);
    }

    public synchronized CapturedRequest takeRequest() {
        return captured.poll();
    }

    public synchronized int getRequestCount() {
        return captured.size();
    }

    @Override
    public synchronized Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request.method(), request.url().encodedPath(), request.headers(),
                bodyOf(request)));

        Object next = planned.poll();
        if (next == null) {
            throw new IOException("Unexpected request: " + request.method() + " " + request.url());
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        Reply reply = (Reply) next;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("mock")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    private static String bodyOf(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Reply(int code, String body) {
    }

    /**
     * A request seen by the engine; {@code target} is the encoded path.
     */
    public record CapturedRequest(String method, String target, Headers headers, String body) {
    }
}
