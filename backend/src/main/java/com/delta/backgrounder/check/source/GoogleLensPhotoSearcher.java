package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.model.PhotoMatch;
import com.delta.backgrounder.check.model.PhotoSearchResult;
import com.delta.backgrounder.check.model.SocialProfile;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reverse image search through the Google Lens engine. Hits on known platforms are also
 * reported as social profiles.
 */
@Service
public class GoogleLensPhotoSearcher implements ReversePhotoSearcher {
    private static final Logger log = LoggerFactory.getLogger(GoogleLensPhotoSearcher.class);

    private static final Map<String, String> DOMAIN_PLATFORMS = new LinkedHashMap<>();

    static {
        DOMAIN_PLATFORMS.put("linkedin.com", "LinkedIn");
        DOMAIN_PLATFORMS.put("twitter.com", "Twitter/X");
        DOMAIN_PLATFORMS.put("x.com", "Twitter/X");
        DOMAIN_PLATFORMS.put("facebook.com", "Facebook");
        DOMAIN_PLATFORMS.put("instagram.com", "Instagram");
        DOMAIN_PLATFORMS.put("github.com", "GitHub");
        DOMAIN_PLATFORMS.put("youtube.com", "YouTube");
        DOMAIN_PLATFORMS.put("reddit.com", "Reddit");
        DOMAIN_PLATFORMS.put("medium.com", "Medium");
        DOMAIN_PLATFORMS.put("dev.to", "Dev.to");
        DOMAIN_PLATFORMS.put("stackoverflow.com", "Stack Overflow");
        DOMAIN_PLATFORMS.put("quora.com", "Quora");
        DOMAIN_PLATFORMS.put("kaggle.com", "Kaggle");
        DOMAIN_PLATFORMS.put("behance.net", "Behance");
        DOMAIN_PLATFORMS.put("dribbble.com", "Dribbble");
        DOMAIN_PLATFORMS.put("flickr.com", "Flickr");
        DOMAIN_PLATFORMS.put("pinterest.com", "Pinterest");
        DOMAIN_PLATFORMS.put("tumblr.com", "Tumblr");
        DOMAIN_PLATFORMS.put("vimeo.com", "Vimeo");
        DOMAIN_PLATFORMS.put("tiktok.com", "TikTok");
        DOMAIN_PLATFORMS.put("researchgate.net", "ResearchGate");
        DOMAIN_PLATFORMS.put("scholar.google.com", "Google Scholar");
        DOMAIN_PLATFORMS.put("leetcode.com", "LeetCode");
        DOMAIN_PLATFORMS.put("hackerrank.com", "HackerRank");
        DOMAIN_PLATFORMS.put("gitlab.com", "GitLab");
        DOMAIN_PLATFORMS.put("huggingface.co", "HuggingFace");
        DOMAIN_PLATFORMS.put("substack.com", "Substack");
    }

    private final SerpApiClient serpApi;

    public GoogleLensPhotoSearcher(SerpApiClient serpApi) {
        this.serpApi = serpApi;
    }

    @Override
    public PhotoSearchResult search(String imageUrl) {
        if (!serpApi.isConfigured()) {
            log.debug("SerpAPI key not configured, skipping reverse photo search");
            return PhotoSearchResult.empty();
        }
        JsonNode data = serpApi.googleLens(imageUrl);

        List<PhotoMatch> matches = new ArrayList<>();
        List<SocialProfile> profiles = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();

        for (JsonNode match : data.path("visual_matches")) {
            String url = SerpApiClient.text(match, "link");
            if (!seenUrls.add(url)) {
                continue;
            }
            String title = SerpApiClient.text(match, "title");
            String platform = detectPlatform(url);
            matches.add(new PhotoMatch(
                url,
                title,
                SerpApiClient.text(match, "source"),
                SerpApiClient.text(match, "thumbnail"),
                platform
            ));
            if (platform != null) {
                profiles.add(new SocialProfile(
                    platform + " (photo match)",
                    url,
                    SocialPlatforms.genericUsername(SocialPlatforms.lastSegment(url)),
                    "Photo found on " + platform + ": " + SerpApiClient.truncate(title, 150)
                ));
            }
        }

        JsonNode knowledge = data.path("knowledge_graph");
        if (knowledge.isArray()) {
            for (JsonNode item : knowledge) {
                String name = SerpApiClient.text(item, "title");
                String link = SerpApiClient.text(item, "link");
                if (!name.isEmpty() && !link.isEmpty() && seenUrls.add(link)) {
                    matches.add(new PhotoMatch(
                        link,
                        "Google identified: " + name,
                        "Google Knowledge Graph",
                        "",
                        detectPlatform(link)
                    ));
                }
            }
        }

        for (JsonNode match : data.path("exact_matches")) {
            String url = SerpApiClient.text(match, "link");
            if (url.isEmpty() || !seenUrls.add(url)) {
                continue;
            }
            String platform = detectPlatform(url);
            String title = SerpApiClient.text(match, "title");
            matches.add(new PhotoMatch(
                url,
                title.isEmpty() ? "Exact image match" : title,
                SerpApiClient.text(match, "source"),
                SerpApiClient.text(match, "thumbnail"),
                platform
            ));
            if (platform != null) {
                profiles.add(new SocialProfile(
                    platform + " (exact match)",
                    url,
                    SocialPlatforms.genericUsername(SocialPlatforms.lastSegment(url)),
                    "Exact photo match on " + platform
                ));
            }
        }
        return new PhotoSearchResult(matches, profiles);
    }

    static String detectPlatform(String url) {
        if (url == null) {
            return null;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : DOMAIN_PLATFORMS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
