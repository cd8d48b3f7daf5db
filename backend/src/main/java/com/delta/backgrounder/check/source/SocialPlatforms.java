package com.delta.backgrounder.check.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Platform groups scanned together, one OR-query per group, plus URL helpers.
 */
public final class SocialPlatforms {
    private static final Set<String> GENERIC_SEGMENTS = Set.of("profile", "users", "user", "u");

    public static final List<PlatformBatch> BATCHES = List.of(
        new PlatformBatch("Major Social", List.of(
            new Platform("Twitter/X", List.of("twitter.com", "x.com")),
            new Platform("Facebook", List.of("facebook.com")),
            new Platform("Instagram", List.of("instagram.com")),
            new Platform("Reddit", List.of("reddit.com/user"))
        )),
        new PlatformBatch("Dev Platforms", List.of(
            new Platform("Stack Overflow", List.of("stackoverflow.com/users")),
            new Platform("Medium", List.of("medium.com")),
            new Platform("Dev.to", List.of("dev.to")),
            new Platform("Hashnode", List.of("hashnode.dev")),
            new Platform("HackerNoon", List.of("hackernoon.com"))
        )),
        new PlatformBatch("Code Platforms", List.of(
            new Platform("GitLab", List.of("gitlab.com")),
            new Platform("Bitbucket", List.of("bitbucket.org")),
            new Platform("npm", List.of("npmjs.com/~")),
            new Platform("PyPI", List.of("pypi.org/user")),
            new Platform("HuggingFace", List.of("huggingface.co"))
        )),
        new PlatformBatch("Creative Platforms", List.of(
            new Platform("Behance", List.of("behance.net")),
            new Platform("Dribbble", List.of("dribbble.com")),
            new Platform("Figma", List.of("figma.com/@")),
            new Platform("CodePen", List.of("codepen.io"))
        )),
        new PlatformBatch("Research & Competitions", List.of(
            new Platform("Kaggle", List.of("kaggle.com")),
            new Platform("Google Scholar", List.of("scholar.google.com")),
            new Platform("ResearchGate", List.of("researchgate.net/profile")),
            new Platform("LeetCode", List.of("leetcode.com/u")),
            new Platform("HackerRank", List.of("hackerrank.com/profile")),
            new Platform("Codeforces", List.of("codeforces.com/profile"))
        )),
        new PlatformBatch("Content Platforms", List.of(
            new Platform("YouTube", List.of("youtube.com")),
            new Platform("Substack", List.of("substack.com")),
            new Platform("Quora", List.of("quora.com/profile")),
            new Platform("Speakerdeck", List.of("speakerdeck.com")),
            new Platform("SlideShare", List.of("slideshare.net"))
        ))
    );

    private SocialPlatforms() {
    }

    public record Platform(String name, List<String> sites) {}

    public record PlatformBatch(String label, List<Platform> platforms) {

        public List<String> sites() {
            List<String> sites = new ArrayList<>();
            platforms.forEach(platform -> sites.addAll(platform.sites()));
            return sites;
        }

        public String siteQuery() {
            return String.join(" OR ", sites().stream().map(site -> "site:" + site).toList());
        }

        /**
         * Platform whose site fragment appears in the URL, in declaration order.
         */
        public String matchPlatform(String url) {
            String lower = url.toLowerCase(Locale.ROOT);
            for (Platform platform : platforms) {
                for (String site : platform.sites()) {
                    if (lower.contains(site)) {
                        return platform.name();
                    }
                }
            }
            return null;
        }
    }

    public static String extractUsername(String url) {
        if (url == null) {
            return null;
        }
        List<String> parts = pathParts(url);
        if (parts.isEmpty()) {
            return null;
        }
        String last = parts.get(parts.size() - 1);
        if (url.contains("stackoverflow")) {
            int idx = parts.indexOf("users");
            if (idx < 0 || parts.size() <= idx + 1) {
                return null;
            }
            return parts.size() > idx + 2 ? parts.get(idx + 2) : parts.get(idx + 1);
        }
        if (url.contains("medium.com")) {
            String handle = firstHandle(parts);
            if (handle != null) {
                return handle;
            }
            return last.equals("medium.com") ? null : last;
        }
        if (url.contains("reddit.com")) {
            int idx = parts.indexOf("user");
            if (idx >= 0) {
                return parts.size() > idx + 1 ? parts.get(idx + 1) : null;
            }
        } else if (url.contains("scholar.google")) {
            return null;
        } else if (url.contains("leetcode.com") || url.contains("hackerrank.com") || url.contains("codeforces.com")
            || url.contains("huggingface.co") || url.contains("codepen.io")) {
            return last;
        } else if (url.contains("figma.com") || url.contains("youtube.com")) {
            String handle = firstHandle(parts);
            if (handle != null) {
                return handle;
            }
            if (url.contains("youtube.com") && (parts.contains("channel") || parts.contains("c"))) {
                return last;
            }
        }
        return genericUsername(last);
    }

    /**
     * Last path segment when it looks like a handle rather than a host or a generic path word.
     */
    public static String genericUsername(String lastSegment) {
        if (lastSegment == null || lastSegment.contains(".") || GENERIC_SEGMENTS.contains(lastSegment)
            || lastSegment.equals("in")) {
            return null;
        }
        return lastSegment;
    }

    public static String lastSegment(String url) {
        List<String> parts = pathParts(url);
        return parts.isEmpty() ? null : parts.get(parts.size() - 1);
    }

    private static String firstHandle(List<String> parts) {
        for (String part : parts) {
            if (part.startsWith("@")) {
                return part;
            }
        }
        return null;
    }

    private static List<String> pathParts(String url) {
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        List<String> parts = new ArrayList<>();
        for (String part : trimmed.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }
}
