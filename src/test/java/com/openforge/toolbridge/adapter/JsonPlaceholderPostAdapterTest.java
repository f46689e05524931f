package com.openforge.toolbridge.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolbridge.tool.ToolResult;
import com.openforge.toolbridge.tool.ToolStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JsonPlaceholderPostAdapterTest {

    private static final String POST_2 =
            "{\"userId\":1,\"id\":2,\"title\":\"qui est esse\",\"body\":\"est rerum tempore\"}";

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private JsonPlaceholderPostAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        adapter = new JsonPlaceholderPostAdapter(httpClient, new ObjectMapper(),
                new JsonPlaceholderProperties("https://jsonplaceholder.test/", 5));
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.<String>send(any(), any())).thenReturn(response);
    }

    @Test
    void fetch_okReturnsPostPayload() throws Exception {
        respond(200, POST_2);

        ToolResult result = adapter.fetch(2);

        assertEquals(ToolStatus.OK, result.status());
        assertEquals("post_call", result.toolName());
        assertEquals(2, result.payload().get("id").asInt());
        assertEquals("qui est esse", result.payload().get("title").asText());
        assertNull(result.rawError());
    }

    @Test
    void fetch_sendsGetToPostUriWithTimeout() throws Exception {
        respond(200, POST_2);

        adapter.fetch(2);

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertEquals(URI.create("https://jsonplaceholder.test/posts/2"), request.uri());
        assertEquals("GET", request.method());
        assertEquals(Duration.ofSeconds(5), request.timeout().orElseThrow());
    }

    @Test
    void fetch_nonPositiveIdNeverCallsUpstream() throws Exception {
        for (long id : new long[] {0, -1, Long.MIN_VALUE}) {
            ToolResult result = adapter.fetch(id);
            assertEquals(ToolStatus.ADAPTER_ERROR, result.status());
            assertTrue(result.rawError().contains("positive integer"));
        }
        verify(httpClient, never()).send(any(), any());
    }

    @Test
    void fetch_404IsNotFound() throws Exception {
        respond(404, "{}");

        ToolResult result = adapter.fetch(999);

        assertEquals(ToolStatus.NOT_FOUND, result.status());
        assertNull(result.payload());
        assertEquals("post 999 not found", result.rawError());
    }

    @Test
    void fetch_emptyObjectIsNotFound() throws Exception {
        respond(200, "{}");

        assertEquals(ToolStatus.NOT_FOUND, adapter.fetch(101).status());
    }

    @Test
    void fetch_serverErrorIsAdapterError() throws Exception {
        respond(503, "unavailable");

        ToolResult result = adapter.fetch(2);

        assertEquals(ToolStatus.ADAPTER_ERROR, result.status());
        assertEquals("Upstream returned HTTP 503", result.rawError());
    }

    @Test
    void fetch_invalidJsonIsAdapterError() throws Exception {
        respond(200, "<html>oops</html>");

        ToolResult result = adapter.fetch(2);

        assertEquals(ToolStatus.ADAPTER_ERROR, result.status());
        assertEquals("Upstream returned invalid JSON", result.rawError());
    }

    @Test
    void fetch_arrayBodyIsAdapterError() throws Exception {
        respond(200, "[]");

        assertEquals(ToolStatus.ADAPTER_ERROR, adapter.fetch(2).status());
    }

    @Test
    void fetch_emptyBodyIsAdapterError() throws Exception {
        respond(200, "");

        assertEquals(ToolStatus.ADAPTER_ERROR, adapter.fetch(2).status());
    }

    @Test
    void fetch_timeoutIsAdapterError() throws Exception {
        when(httpClient.<String>send(any(), any())).thenThrow(new HttpTimeoutException("request timed out"));

        ToolResult result = adapter.fetch(2);

        assertEquals(ToolStatus.ADAPTER_ERROR, result.status());
        assertEquals("Timeout while fetching post 2", result.rawError());
    }

    @Test
    void fetch_connectionRefusedIsAdapterError() throws Exception {
        when(httpClient.<String>send(any(), any())).thenThrow(new ConnectException("Connection refused"));

        ToolResult result = adapter.fetch(2);

        assertEquals(ToolStatus.ADAPTER_ERROR, result.status());
        assertTrue(result.rawError().startsWith("Network error"));
    }

    @Test
    void fetch_longDiagnosticIsTruncated() throws Exception {
        when(httpClient.<String>send(any(), any())).thenThrow(new IOException("x".repeat(1000)));

        ToolResult result = adapter.fetch(2);

        assertTrue(result.rawError().length() <= 203);
    }

    @Test
    void fetch_interruptIsAdapterErrorAndKeepsInterruptFlag() throws Exception {
        when(httpClient.<String>send(any(), any())).thenThrow(new InterruptedException());

        try {
            ToolResult result = adapter.fetch(2);
            assertEquals(ToolStatus.ADAPTER_ERROR, result.status());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
