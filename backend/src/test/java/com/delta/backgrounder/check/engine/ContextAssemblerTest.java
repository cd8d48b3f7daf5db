package com.delta.backgrounder.check.engine;

import com.delta.backgrounder.check.model.AggregatedData;
import com.delta.backgrounder.check.model.AssembledContext;
import com.delta.backgrounder.check.model.CompanyCheck;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.GitHubProfile;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.PhotoMatch;
import com.delta.backgrounder.check.model.ReferenceCategory;
import com.delta.backgrounder.check.model.ReferenceContact;
import com.delta.backgrounder.check.model.RepoSummary;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.check.model.SearchHit;
import com.delta.backgrounder.check.model.SocialProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextAssemblerTest {
    private final ContextAssembler assembler = new ContextAssembler();

    @Test
    void emptyDataHasNoSourcesAndNoProfileNote() {
        AssembledContext context = assembler.assemble(empty());

        assertThat(context.contextText()).isEmpty();
        assertThat(context.sourcesUsed()).isEmpty();
        assertThat(context.confidenceNote()).isEqualTo(ContextAssembler.NO_PROFILE_NOTE);
    }

    @Test
    void sectionsFollowFixedOrderAndManifestMatches() {
        ResumeData resume = new ResumeData(
            "Jane Doe", null, null, null, "Engineer", "Acme", null, null, null,
            List.of("Java"),
            List.of(new ExperienceEntry("Engineer", "Acme", "2020 - Present", "Built things")),
            List.of(), List.of(), List.of("Project Falcon"), "raw");
        LinkedInProfile profile = new LinkedInProfile(
            "https://www.linkedin.com/in/jane", "Jane Doe", "Engineer at Acme", "Austin", null,
            List.of(new ExperienceEntry("Engineer", "Acme", "3 yrs", null)), List.of(), List.of(), List.of(), null);
        GitHubProfile github = new GitHubProfile("jdoe", "https://github.com/jdoe", "Jane", null, null, null, null, 4, 10, 1,
            List.of(new RepoSummary("falcon", "A fast thing", 42, null, "https://github.com/jdoe/falcon")));

        AggregatedData data = new AggregatedData(
            profile,
            List.of("Scraper", "SerpAPI"),
            List.of(github),
            resume,
            List.of(new CompanyCheck("Acme", true, "https://acme.example", "Knowledge graph match")),
            List.of(new SocialProfile("X", "https://x.com/jdoe", "jdoe", "posts")),
            List.of(new PhotoMatch("https://img.example/1", "Jane at conf", "site", "", "LinkedIn")),
            List.of(new ReferenceContact("Ann Lee", "HR Manager", "Acme", "https://www.linkedin.com/in/ann", ReferenceCategory.HR, "")),
            List.of(new SearchHit("Talk", "https://example.com/talk", "Jane spoke", "google (main)")),
            List.of(new SearchHit("News", "https://news.example.com/1", "Jane hired", "news")),
            null
        );

        AssembledContext context = assembler.assemble(data);
        String text = context.contextText();

        assertThat(context.sourcesUsed()).containsExactly(
            "Resume (uploaded)",
            "LinkedIn (Scraper + SerpAPI)",
            "GitHub (1 profiles)",
            "Google (1 results)",
            "News (1 articles)",
            "Company Verify (1)",
            "Social Media (1)",
            "Reverse Photo (1 matches)",
            "References (1 contacts found)"
        );
        assertThat(text).containsSubsequence(
            "[SOURCE: Uploaded Resume]",
            "[SOURCE: LinkedIn]",
            "[SOURCE: GitHub Profile #1]",
            "[google (main)] Talk: Jane spoke",
            "[news] News: Jane hired",
            "[company] Acme: VERIFIED",
            "[social: X] https://x.com/jdoe",
            "[photo match [LinkedIn]] https://img.example/1",
            "[reference: HR / People Ops] Ann Lee"
        );
        assertThat(text).contains("  - falcon (N/A, 42 stars): A fast thing");
        assertThat(text).contains("Key identifiers from resume: Project Falcon");
        assertThat(text).contains("\n\n[SOURCE: LinkedIn]");
        assertThat(context.confidenceNote()).isEmpty();
    }

    @Test
    void profileWithOnlyPageTextIsFlaggedAsPartial() {
        LinkedInProfile partial = LinkedInProfile.minimal("u", "Jane Doe", null, null, "page text only");
        AggregatedData data = new AggregatedData(
            partial, List.of("Scraper"), null, null, null, null, null, null, null, null, null);

        AssembledContext context = assembler.assemble(data);

        assertThat(context.confidenceNote()).isEqualTo(ContextAssembler.PARTIAL_PROFILE_NOTE);
        assertThat(context.contextText()).contains("Raw profile text:\npage text only");
    }

    private static AggregatedData empty() {
        return new AggregatedData(null, null, null, null, null, null, null, null, null, null, null);
    }
}
