package com.scorebot.engine;

import com.scorebot.engine.data.HttpClientEx;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Returns a canned response for every GET and records the requested URLs.
 */
public final class StubHttpClient extends HttpClientEx {
    public final List<String> urls = new ArrayList<>();
    private int status;
    private String body;
    private IOException failure;

    public StubHttpClient(int status, String body) {
        this.status = status;
        this.body = body;
    }

    public static StubHttpClient failing(IOException failure) {
        StubHttpClient http = new StubHttpClient(0, "");
        http.failure = failure;
        return http;
    }

    @Override
    public TextResponse get(String url, int timeoutSeconds) throws IOException {
        urls.add(url);
        if (failure != null) {
            throw failure;
        }
        return new TextResponse(status, body);
    }
}
