package com.delta.backgrounder.check.engine;

import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.AssembledContext;
import com.delta.backgrounder.check.model.CompanyCheck;
import com.delta.backgrounder.check.model.EducationEntry;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.GitHubProfile;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.PhotoMatch;
import com.delta.backgrounder.check.model.ReferenceContact;
import com.delta.backgrounder.check.model.RepoSummary;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.check.model.SearchHit;
import com.delta.backgrounder.check.model.SocialProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders merged run data as plain text for the report generator. Résumé and profile come
 * first so that later sections read as corroborating or contradicting evidence.
 */
@Component
public class ContextAssembler {
    static final String NO_PROFILE_NOTE = "No profile found. Report is based on web search results only.";
    static final String PARTIAL_PROFILE_NOTE = "Profile partially extracted. Some details may be missing.";

    private static final int RESUME_SKILLS = 20;
    private static final int PROFILE_SKILLS = 15;
    private static final int EXPERIENCE_DETAIL_CHARS = 200;
    private static final int PROFILE_RAW_CHARS = 3000;

    public AssembledContext assemble(AggregatedData data) {
        List<String> blocks = new ArrayList<>();
        List<String> sources = new ArrayList<>();

        if (data.resume() != null) {
            sources.add("Resume (uploaded)");
            blocks.add(resumeBlock(data.resume()));
        }
        if (data.linkedin() != null) {
            sources.add("LinkedIn (" + String.join(" + ", data.linkedinProviders()) + ")");
            blocks.add(profileBlock(data.linkedin()));
        }
        if (!data.githubProfiles().isEmpty()) {
            sources.add("GitHub (" + data.githubProfiles().size() + " profiles)");
            for (int i = 0; i < data.githubProfiles().size(); i++) {
                blocks.add(codeHostBlock(data.githubProfiles().get(i), i + 1));
            }
        }
        if (!data.searchResults().isEmpty()) {
            sources.add("Google (" + data.searchResults().size() + " results)");
            for (SearchHit hit : data.searchResults()) {
                blocks.add("[" + hit.source() + "] " + hit.title() + ": " + hit.snippet());
            }
        }
        if (!data.newsArticles().isEmpty()) {
            sources.add("News (" + data.newsArticles().size() + " articles)");
            for (SearchHit hit : data.newsArticles()) {
                blocks.add("[news] " + hit.title() + ": " + hit.snippet());
            }
        }
        if (!data.companyChecks().isEmpty()) {
            sources.add("Company Verify (" + data.companyChecks().size() + ")");
            for (CompanyCheck check : data.companyChecks()) {
                String evidence = check.evidenceUrl() == null ? "" : " (" + check.evidenceUrl() + ")";
                blocks.add("[company] " + check.name() + ": " + (check.verified() ? "VERIFIED" : "NOT VERIFIED")
                    + " - " + check.description() + evidence);
            }
        }
        if (!data.socialProfiles().isEmpty()) {
            sources.add("Social Media (" + data.socialProfiles().size() + ")");
            for (SocialProfile profile : data.socialProfiles()) {
                blocks.add("[social: " + profile.platform() + "] " + profile.url() + " - " + profile.snippet());
            }
        }
        if (!data.photoMatches().isEmpty()) {
            sources.add("Reverse Photo (" + data.photoMatches().size() + " matches)");
            for (PhotoMatch match : data.photoMatches()) {
                String tag = match.platform() == null ? "" : " [" + match.platform() + "]";
                blocks.add("[photo match" + tag + "] " + match.url() + " - " + match.title());
            }
        }
        if (!data.referenceContacts().isEmpty()) {
            sources.add("References (" + data.referenceContacts().size() + " contacts found)");
            for (ReferenceContact contact : data.referenceContacts()) {
                String category = contact.category() == null ? "Colleague" : contact.category().label();
                blocks.add("[reference: " + category + "] " + contact.name() + " - " + contact.title()
                    + " at " + contact.company() + " (" + contact.linkedinUrl() + ")");
            }
        }

        return new AssembledContext(String.join("\n\n", blocks), sources, confidenceNote(data.linkedin()));
    }

    static String confidenceNote(LinkedInProfile profile) {
        if (profile == null) {
            return NO_PROFILE_NOTE;
        }
        if (profile.rawText() != null && profile.experience().isEmpty()) {
            return PARTIAL_PROFILE_NOTE;
        }
        return "";
    }

    private static String resumeBlock(ResumeData resume) {
        List<String> lines = new ArrayList<>();
        lines.add("[SOURCE: Uploaded Resume]");
        field(lines, "Name", resume.name());
        field(lines, "Current Title", resume.title());
        field(lines, "Current Company", resume.company());
        field(lines, "Location", resume.location());
        field(lines, "Email", resume.email());
        field(lines, "LinkedIn", resume.linkedinUrl());
        field(lines, "GitHub", resume.githubUrl());
        field(lines, "Website", resume.website());
        if (!resume.skills().isEmpty()) {
            lines.add("Skills: " + String.join(", ", first(resume.skills(), RESUME_SKILLS)));
        }
        for (ExperienceEntry entry : resume.experience()) {
            lines.add(experienceLine(entry));
            if (entry.description() != null) {
                lines.add("  Details: " + truncate(entry.description(), EXPERIENCE_DETAIL_CHARS));
            }
        }
        for (EducationEntry entry : resume.education()) {
            lines.add("Education: " + text(entry.degree()) + " in " + text(entry.field()) + " from " + text(entry.school()));
        }
        if (!resume.certifications().isEmpty()) {
            lines.add("Certifications: " + String.join(", ", resume.certifications()));
        }
        if (!resume.keySearchTerms().isEmpty()) {
            lines.add("Key identifiers from resume: " + String.join(", ", resume.keySearchTerms()));
        }
        if (resume.name() == null && resume.experience().isEmpty() && resume.rawText() != null) {
            lines.add("Resume text:\n" + resume.rawText());
        }
        return String.join("\n", lines);
    }

    private static String profileBlock(LinkedInProfile profile) {
        List<String> lines = new ArrayList<>();
        lines.add("[SOURCE: LinkedIn]");
        lines.add("Name: " + text(profile.name()));
        field(lines, "Headline", profile.headline());
        field(lines, "Location", profile.location());
        field(lines, "About", profile.summary());
        for (ExperienceEntry entry : profile.experience()) {
            lines.add(experienceLine(entry));
        }
        for (EducationEntry entry : profile.education()) {
            lines.add("Education: " + text(entry.degree()) + " from " + text(entry.school()));
        }
        if (!profile.skills().isEmpty()) {
            lines.add("Skills: " + String.join(", ", first(profile.skills(), PROFILE_SKILLS)));
        }
        if (profile.rawText() != null && profile.experience().isEmpty()) {
            lines.add("Raw profile text:\n" + truncate(profile.rawText(), PROFILE_RAW_CHARS));
        }
        return String.join("\n", lines);
    }

    private static String codeHostBlock(GitHubProfile profile, int index) {
        List<String> lines = new ArrayList<>();
        lines.add("[SOURCE: GitHub Profile #" + index + "]");
        lines.add("Username: " + profile.username());
        field(lines, "Display Name", profile.name());
        field(lines, "Bio", profile.bio());
        field(lines, "Company", profile.company());
        field(lines, "Location", profile.location());
        field(lines, "Website", profile.blog());
        lines.add("Public Repos: " + profile.publicRepos() + ", Followers: " + profile.followers());
        if (!profile.topRepos().isEmpty()) {
            StringBuilder repos = new StringBuilder("Top Repositories:");
            for (RepoSummary repo : profile.topRepos()) {
                repos.append("\n  - ").append(text(repo.name()))
                    .append(" (").append(repo.language() == null ? "N/A" : repo.language())
                    .append(", ").append(repo.stars()).append(" stars): ")
                    .append(text(repo.description()));
            }
            lines.add(repos.toString());
        }
        return String.join("\n", lines);
    }

    private static String experienceLine(ExperienceEntry entry) {
        return "Experience: " + text(entry.title()) + " at " + text(entry.company()) + " (" + text(entry.duration()) + ")";
    }

    private static void field(List<String> lines, String label, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(label + ": " + value);
        }
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    private static List<String> first(List<String> values, int max) {
        return values.size() <= max ? values : values.subList(0, max);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
