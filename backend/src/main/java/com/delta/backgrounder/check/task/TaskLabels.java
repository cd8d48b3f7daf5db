package com.delta.backgrounder.check.task;

import java.util.Map;

/**
 * Human-facing names for task ids.
 */
public final class TaskLabels {
    private static final Map<String, String> EXACT = Map.ofEntries(
        Map.entry(TaskDescriptorBuilder.PROFILE_CHOSEN, "LinkedIn (primary provider)"),
        Map.entry(TaskDescriptorBuilder.PROFILE_SCRAPER, "LinkedIn (scraper)"),
        Map.entry(TaskDescriptorBuilder.PROFILE_SERPAPI, "LinkedIn (SerpAPI)"),
        Map.entry(TaskDescriptorBuilder.GOOGLE_MAIN, "Google Search"),
        Map.entry(TaskDescriptorBuilder.NEWS_MAIN, "News Search"),
        Map.entry(TaskDescriptorBuilder.GITHUB_NAME, "GitHub (name search)"),
        Map.entry(TaskDescriptorBuilder.GITHUB_DIRECT, "GitHub (direct profile)"),
        Map.entry(TaskDescriptorBuilder.GITHUB_COMPANY, "GitHub (company search)"),
        Map.entry(TaskDescriptorBuilder.COMPANY_VERIFY, "Company Verification"),
        Map.entry(TaskDescriptorBuilder.SOCIAL_MEDIA, "Social Media Scan"),
        Map.entry(TaskDescriptorBuilder.PHOTO_SEARCH, "Reverse Photo Search"),
        Map.entry(TaskDescriptorBuilder.REFERENCES, "Reference Discovery")
    );

    private TaskLabels() {
    }

    public static String friendly(String taskId) {
        String exact = EXACT.get(taskId);
        if (exact != null) {
            return exact;
        }
        if (taskId.startsWith(TaskDescriptorBuilder.GOOGLE_COMPANY_PREFIX)) {
            return "Google: " + taskId.substring(TaskDescriptorBuilder.GOOGLE_COMPANY_PREFIX.length());
        }
        if (taskId.startsWith(TaskDescriptorBuilder.GOOGLE_EDU_PREFIX)) {
            return "Google: " + taskId.substring(TaskDescriptorBuilder.GOOGLE_EDU_PREFIX.length());
        }
        if (taskId.startsWith(TaskDescriptorBuilder.GOOGLE_TERM_PREFIX)) {
            String index = taskId.substring(TaskDescriptorBuilder.GOOGLE_TERM_PREFIX.length());
            try {
                return "Google: key term #" + (Integer.parseInt(index) + 1);
            } catch (NumberFormatException e) {
                return "Google: " + index;
            }
        }
        if (taskId.startsWith(TaskDescriptorBuilder.NEWS_COMPANY_PREFIX)) {
            return "News: " + taskId.substring(TaskDescriptorBuilder.NEWS_COMPANY_PREFIX.length());
        }
        return taskId;
    }
}
