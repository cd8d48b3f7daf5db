package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.model.SocialProfile;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Scans the platform batches with one site-restricted query each. The company is never part
 * of the query. When the first pass finds too little, a broadened query runs per retry platform.
 */
@Service
public class SerpApiSocialMediaScanner implements SocialMediaScanner {
    private static final Logger log = LoggerFactory.getLogger(SerpApiSocialMediaScanner.class);
    private static final int BATCH_RESULTS = 10;
    private static final int RETRY_RESULTS = 5;
    private static final int SNIPPET_MAX = 200;

    private final SerpApiClient serpApi;
    private final BackgrounderProperties properties;
    private final ExecutorService sourceExecutor;

    public SerpApiSocialMediaScanner(
        SerpApiClient serpApi,
        BackgrounderProperties properties,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor
    ) {
        this.serpApi = serpApi;
        this.properties = properties;
        this.sourceExecutor = sourceExecutor;
    }

    @Override
    public List<SocialProfile> scan(String name) {
        if (!serpApi.isConfigured()) {
            log.debug("SerpAPI key not configured, skipping social scan");
            return List.of();
        }
        List<CompletableFuture<List<SocialProfile>>> batches = new ArrayList<>();
        for (SocialPlatforms.PlatformBatch batch : SocialPlatforms.BATCHES) {
            batches.add(CompletableFuture.supplyAsync(() -> searchBatch(name, batch), sourceExecutor));
        }

        List<SocialProfile> profiles = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        collect(batches, profiles, seenUrls);

        if (profiles.size() < properties.getSocial().getRetryThreshold()) {
            log.debug("Social scan found {} profiles for {}, retrying key platforms", profiles.size(), name);
            List<CompletableFuture<List<SocialProfile>>> retries = new ArrayList<>();
            for (Map.Entry<String, String> platform : properties.getSocial().getRetryPlatforms().entrySet()) {
                retries.add(CompletableFuture.supplyAsync(
                    () -> searchSingle(name, platform.getKey(), platform.getValue()),
                    sourceExecutor
                ));
            }
            collect(retries, profiles, seenUrls);
        }
        return profiles;
    }

    private void collect(List<CompletableFuture<List<SocialProfile>>> futures, List<SocialProfile> sink, Set<String> seenUrls) {
        for (CompletableFuture<List<SocialProfile>> future : futures) {
            try {
                for (SocialProfile profile : future.join()) {
                    if (seenUrls.add(profile.url())) {
                        sink.add(profile);
                    }
                }
            } catch (CompletionException e) {
                log.warn("Social platform query failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            }
        }
    }

    List<SocialProfile> searchBatch(String name, SocialPlatforms.PlatformBatch batch) {
        String siteQuery = batch.siteQuery();
        String[] nameParts = nameParts(name);
        List<String> queries = new ArrayList<>();
        queries.add("(" + siteQuery + ") \"" + name.trim() + "\"");
        if (nameParts.length >= 2) {
            queries.add("(" + siteQuery + ") " + nameParts[0] + " " + nameParts[nameParts.length - 1]);
        }

        List<SocialProfile> profiles = new ArrayList<>();
        for (String query : queries) {
            JsonNode data;
            try {
                data = serpApi.google(query, BATCH_RESULTS);
            } catch (SourceFetchException e) {
                log.debug("Social batch {} query failed: {}", batch.label(), e.getMessage());
                continue;
            }
            for (JsonNode item : data.path("organic_results")) {
                String url = SerpApiClient.text(item, "link");
                String title = SerpApiClient.text(item, "title");
                String snippet = SerpApiClient.text(item, "snippet");
                if (!mentionsName(title + " " + snippet, nameParts)) {
                    continue;
                }
                String platform = batch.matchPlatform(url);
                if (platform == null) {
                    continue;
                }
                profiles.add(new SocialProfile(
                    platform,
                    url,
                    SocialPlatforms.extractUsername(url),
                    SerpApiClient.truncate(snippet.isEmpty() ? title : snippet, SNIPPET_MAX)
                ));
            }
            if (!profiles.isEmpty()) {
                break;
            }
        }
        return profiles;
    }

    List<SocialProfile> searchSingle(String name, String platform, String site) {
        String[] nameParts = nameParts(name);
        String query = "site:" + site + " " + nameParts[0];
        if (nameParts.length > 1) {
            query += " " + nameParts[nameParts.length - 1];
        }
        JsonNode data;
        try {
            data = serpApi.google(query, RETRY_RESULTS);
        } catch (SourceFetchException e) {
            log.debug("Social retry on {} failed: {}", platform, e.getMessage());
            return List.of();
        }
        List<SocialProfile> profiles = new ArrayList<>();
        for (JsonNode item : data.path("organic_results")) {
            String url = SerpApiClient.text(item, "link");
            String title = SerpApiClient.text(item, "title");
            String snippet = SerpApiClient.text(item, "snippet");
            if (!mentionsName(title + " " + snippet, nameParts) || !url.contains(site)) {
                continue;
            }
            profiles.add(new SocialProfile(
                platform,
                url,
                SocialPlatforms.extractUsername(url),
                SerpApiClient.truncate(snippet.isEmpty() ? title : snippet, SNIPPET_MAX)
            ));
        }
        return profiles;
    }

    private static String[] nameParts(String name) {
        return name.trim().split("\\s+");
    }

    private static boolean mentionsName(String text, String[] nameParts) {
        String lower = text.toLowerCase(Locale.ROOT);
        return Arrays.stream(nameParts)
            .map(part -> part.toLowerCase(Locale.ROOT))
            .anyMatch(lower::contains);
    }
}
