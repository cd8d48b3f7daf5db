package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ImgBbPhotoUploaderTest {
    private MockWebServer server;
    private ExecutorService executor;
    private BackgrounderProperties properties;
    private ImgBbPhotoUploader uploader;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new BackgrounderProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getImgbb().setApiKey("img-key");
        properties.getImgbb().setUploadUrl(server.url("/1/upload").toString());
        executor = Executors.newFixedThreadPool(2);
        uploader = new ImgBbPhotoUploader(new SourceHttpClient(properties, executor), properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void uploadsBase64ImageWithExpiry() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("{\"data\": {\"url\": \"https://i.ibb.co/abc/p.jpg\"}, \"success\": true}"));

        assertThat(uploader.upload(new byte[] {1, 2, 3})).contains("https://i.ibb.co/abc/p.jpg");

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request.getBody().readUtf8()).isEqualTo("key=img-key&image=AQID&expiration=600");
    }

    @Test
    void failedOrEmptyUploadYieldsNothing() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\": \"bad image\"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\": {}}"));

        assertThat(uploader.upload(new byte[] {1})).isEmpty();
        assertThat(uploader.upload(new byte[] {1})).isEmpty();
    }

    @Test
    void missingKeySkipsUpload() {
        properties.getImgbb().setApiKey(null);

        assertThat(uploader.upload(new byte[] {1})).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }
}
