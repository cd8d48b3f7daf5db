package com.delta.backgrounder.check.profile;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.http.SourceHttpClient;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.EducationEntry;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.HttpFetchResult;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.ProfileProviderName;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the public profile page and extracts what it can with several selector strategies
 * per field. The page text is always kept so the report generator has something to work
 * with when the markup changes.
 */
@Service
public class ScraperProfileProvider implements ProfileProvider {
    private static final Logger log = LoggerFactory.getLogger(ScraperProfileProvider.class);
    private static final int DISCOVERY_RESULTS = 3;
    private static final int MAX_SECTION_ITEMS = 10;
    private static final int MAX_SKILLS = 20;
    private static final int MAX_RAW_TEXT = 6000;
    private static final List<String> DURATION_MARKERS = List.of("present", "mos", "yrs", "yr", "mo", " - ", "–");

    private final SourceHttpClient httpClient;
    private final ProfileSearch profileSearch;

    public ScraperProfileProvider(SourceHttpClient httpClient, ProfileSearch profileSearch) {
        this.httpClient = httpClient;
        this.profileSearch = profileSearch;
    }

    @Override
    public ProfileProviderName name() {
        return ProfileProviderName.SCRAPER;
    }

    @Override
    public LinkedInProfile fetch(BackgroundCheckRequest request) {
        String url = request.linkedinUrl();
        if (url == null) {
            url = profileSearch.findProfileHit(request, DISCOVERY_RESULTS)
                .map(hit -> hit.path("link").asText(""))
                .filter(link -> !link.isEmpty())
                .orElse(null);
        }
        if (url == null) {
            return null;
        }
        return scrape(url);
    }

    private LinkedInProfile scrape(String url) {
        String cleanUrl = url.split("\\?")[0];
        HttpFetchResult result = httpClient.get(cleanUrl, "text/html,application/xhtml+xml");
        if (result.isSuccessful() && isLoginWall(result.finalUrlOrRequested())) {
            String publicUrl = cleanUrl.replace("www.linkedin.com", "linkedin.com");
            log.warn("Profile page redirected to login for {}, trying public view", cleanUrl);
            result = httpClient.get(publicUrl, "text/html,application/xhtml+xml");
        }
        if (!result.isSuccessful()) {
            throw SourceFetchException.from("scraper", result);
        }
        if (isLoginWall(result.finalUrlOrRequested())) {
            log.warn("Profile page for {} is behind a login wall", cleanUrl);
            return null;
        }
        return extract(Jsoup.parse(result.body() == null ? "" : result.body(), cleanUrl), cleanUrl);
    }

    private static boolean isLoginWall(String url) {
        return url != null && (url.contains("/login") || url.contains("/authwall"));
    }

    static LinkedInProfile extract(Document doc, String url) {
        String name = firstText(doc, "h1.text-heading-xlarge", "h1.top-card-layout__title", "h1");
        if (name == null) {
            String ogTitle = doc.select("meta[property=og:title]").attr("content");
            if (!ogTitle.isBlank()) {
                name = ogTitle.split(" - ")[0].trim();
            }
        }
        String headline = firstText(doc,
            "div.text-body-medium.break-words",
            ".top-card-layout__headline",
            "div.text-body-medium");
        String location = firstText(doc,
            "span.text-body-small.inline.t-black--light.break-words",
            ".top-card-layout__first-subline");
        String about = firstText(doc,
            "section.pv-about-section div.inline-show-more-text",
            "#about ~ div span[aria-hidden=true]",
            "section.summary div.core-section-container__content");

        List<ExperienceEntry> experience = new ArrayList<>();
        for (List<String> lines : sectionItems(doc, "experience")) {
            experience.add(toExperience(lines));
        }
        List<EducationEntry> education = new ArrayList<>();
        for (List<String> lines : sectionItems(doc, "education")) {
            education.add(new EducationEntry(
                lines.get(0),
                lines.size() > 1 ? lines.get(1) : null,
                lines.size() > 2 ? lines.get(2) : null
            ));
        }

        Elements skillElements = doc.select("#skills ~ div .pvs-list__paged-list-item span[aria-hidden=true]");
        if (skillElements.isEmpty()) {
            skillElements = doc.select("section:has(#skills) span.mr1 span[aria-hidden=true]");
        }
        List<String> skills = new ArrayList<>();
        for (Element element : skillElements) {
            if (skills.size() >= MAX_SKILLS) {
                break;
            }
            String text = element.text().trim();
            if (!text.isEmpty() && text.length() < 50) {
                skills.add(text);
            }
        }

        Element main = doc.selectFirst("main");
        if (main == null) {
            main = doc.body();
        }
        String fullText = main == null ? "" : main.text();
        if (fullText.length() > MAX_RAW_TEXT) {
            fullText = fullText.substring(0, MAX_RAW_TEXT);
        }

        return new LinkedInProfile(url, name, headline, location, about, experience, education, skills, List.of(), fullText);
    }

    private static ExperienceEntry toExperience(List<String> lines) {
        String duration = null;
        for (String line : lines.subList(1, lines.size())) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (DURATION_MARKERS.stream().anyMatch(lower::contains)) {
                duration = line;
                break;
            }
        }
        String description = null;
        for (int i = 2; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.length() > 40 && !line.equals(duration)) {
                description = line.length() > 300 ? line.substring(0, 300) : line;
                break;
            }
        }
        return new ExperienceEntry(lines.get(0), lines.size() > 1 ? lines.get(1) : null, duration, description);
    }

    /**
     * Text lines of each list item in the section anchored by {@code #sectionId}.
     */
    private static List<List<String>> sectionItems(Document doc, String sectionId) {
        Element section = doc.selectFirst("section:has(#" + sectionId + ")");
        if (section == null) {
            Element anchor = doc.getElementById(sectionId);
            section = anchor == null ? null : anchor.closest("section");
        }
        List<List<String>> items = new ArrayList<>();
        if (section == null) {
            return items;
        }
        Elements listItems = section.select("li.artdeco-list__item");
        if (listItems.isEmpty()) {
            listItems = section.select("li.pvs-list__paged-list-item");
        }
        if (listItems.isEmpty()) {
            listItems = section.select("li");
        }
        for (Element item : listItems) {
            if (items.size() >= MAX_SECTION_ITEMS) {
                break;
            }
            List<String> lines = textLines(item);
            if (!lines.isEmpty()) {
                items.add(lines);
            }
        }
        return items;
    }

    private static List<String> textLines(Element item) {
        List<String> lines = new ArrayList<>();
        for (Element element : item.getAllElements()) {
            String own = element.ownText().trim();
            if (own.length() > 2 && (lines.isEmpty() || !lines.get(lines.size() - 1).equals(own))) {
                lines.add(own);
            }
        }
        return lines;
    }

    private static String firstText(Document doc, String... selectors) {
        for (String selector : selectors) {
            Element element = doc.selectFirst(selector);
            if (element != null) {
                String text = element.text().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }
}
