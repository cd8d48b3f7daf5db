package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.ExperienceEntry;
import com.delta.backgrounder.check.model.ReferenceCategory;
import com.delta.backgrounder.check.model.ReferenceContact;
import com.delta.backgrounder.check.model.ResumeData;
import com.delta.backgrounder.config.BackgrounderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

@Service
public class SerpApiReferenceDiscoverer implements ReferenceDiscoverer {
    private static final Logger log = LoggerFactory.getLogger(SerpApiReferenceDiscoverer.class);
    private static final int RESULTS_PER_QUERY = 5;
    private static final Pattern PROFILE_SUFFIX = Pattern.compile("\\s*[|\u2013\\-]\\s*LinkedIn.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s*[|\u2013\\-]\\s*");

    private static final Map<String, String> DEPARTMENT_KEYWORDS = new LinkedHashMap<>();

    static {
        DEPARTMENT_KEYWORDS.put("engineer", "Engineer OR Developer OR Software");
        DEPARTMENT_KEYWORDS.put("developer", "Engineer OR Developer OR Software");
        DEPARTMENT_KEYWORDS.put("software", "Engineer OR Developer OR Software");
        DEPARTMENT_KEYWORDS.put("data", "Data OR Analytics OR ML");
        DEPARTMENT_KEYWORDS.put("design", "Design OR UX OR UI");
        DEPARTMENT_KEYWORDS.put("product", "Product OR PM");
        DEPARTMENT_KEYWORDS.put("market", "Marketing OR Growth");
        DEPARTMENT_KEYWORDS.put("sales", "Sales OR Business Development");
        DEPARTMENT_KEYWORDS.put("finance", "Finance OR Accounting");
        DEPARTMENT_KEYWORDS.put("legal", "Legal OR Compliance");
        DEPARTMENT_KEYWORDS.put("ops", "Operations OR DevOps OR SRE");
        DEPARTMENT_KEYWORDS.put("devops", "Operations OR DevOps OR SRE");
        DEPARTMENT_KEYWORDS.put("security", "Security OR InfoSec OR Cybersecurity");
        DEPARTMENT_KEYWORDS.put("research", "Research OR Scientist OR R&D");
        DEPARTMENT_KEYWORDS.put("machine learning", "ML OR AI OR Machine Learning");
        DEPARTMENT_KEYWORDS.put("frontend", "Frontend OR React OR UI");
        DEPARTMENT_KEYWORDS.put("backend", "Backend OR API OR Server");
        DEPARTMENT_KEYWORDS.put("fullstack", "Full Stack OR Fullstack OR Developer");
        DEPARTMENT_KEYWORDS.put("full stack", "Full Stack OR Fullstack OR Developer");
        DEPARTMENT_KEYWORDS.put("python", "Python OR Backend OR Developer");
    }

    private final SerpApiClient serpApi;
    private final BackgrounderProperties properties;
    private final ExecutorService sourceExecutor;

    public SerpApiReferenceDiscoverer(
        SerpApiClient serpApi,
        BackgrounderProperties properties,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor
    ) {
        this.serpApi = serpApi;
        this.properties = properties;
        this.sourceExecutor = sourceExecutor;
    }

    private record Employer(String company, String personTitle) {}

    private record CategorizedQuery(String query, ReferenceCategory category) {}

    @Override
    public List<ReferenceContact> discover(BackgroundCheckRequest request, ResumeData resume) {
        if (!serpApi.isConfigured()) {
            log.debug("SerpAPI key not configured, skipping reference discovery");
            return List.of();
        }
        List<Employer> employers = employers(request, resume);
        if (employers.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<List<ReferenceContact>>> futures = new ArrayList<>();
        for (Employer employer : employers.subList(0, Math.min(employers.size(), properties.getReferences().getMaxCompanies()))) {
            futures.add(CompletableFuture.supplyAsync(
                () -> findContactsAt(request.name(), employer),
                sourceExecutor
            ));
        }

        List<ReferenceContact> contacts = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (CompletableFuture<List<ReferenceContact>> future : futures) {
            try {
                for (ReferenceContact contact : future.join()) {
                    String key = contact.linkedinUrl() != null ? contact.linkedinUrl() : contact.name();
                    if (seen.add(key)) {
                        contacts.add(contact);
                    }
                }
            } catch (CompletionException e) {
                log.warn("Reference lookup failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            }
        }
        return contacts;
    }

    private List<Employer> employers(BackgroundCheckRequest request, ResumeData resume) {
        List<Employer> employers = new ArrayList<>();
        Set<String> companies = new HashSet<>();
        if (request.company() != null) {
            employers.add(new Employer(request.company(), request.title() == null ? "" : request.title()));
            companies.add(request.company());
        }
        if (resume != null) {
            for (ExperienceEntry entry : resume.experience()) {
                if (entry.company() != null && companies.add(entry.company())) {
                    employers.add(new Employer(entry.company(), entry.title() == null ? "" : entry.title()));
                }
            }
        }
        return employers;
    }

    private List<ReferenceContact> findContactsAt(String personName, Employer employer) {
        String company = employer.company();
        String scope = "site:linkedin.com/in/ \"" + company + "\"";
        List<CategorizedQuery> queries = new ArrayList<>();
        queries.add(new CategorizedQuery(
            scope + " (HR OR \"Human Resources\" OR \"Talent Acquisition\" OR \"People Operations\")",
            ReferenceCategory.HR
        ));
        queries.add(new CategorizedQuery(
            scope + " (Manager OR Director OR \"Team Lead\" OR VP OR Founder OR CEO OR CTO)",
            ReferenceCategory.MANAGEMENT
        ));
        queries.add(new CategorizedQuery(scope, ReferenceCategory.COLLEAGUE));
        String department = departmentKeywords(employer.personTitle());
        if (department != null) {
            queries.add(new CategorizedQuery(scope + " (" + department + ")", ReferenceCategory.SAME_DEPARTMENT));
        }

        String personFirst = personName.split("\\s+")[0].toLowerCase(Locale.ROOT);
        List<ReferenceContact> contacts = new ArrayList<>();
        for (CategorizedQuery query : queries) {
            JsonNode data;
            try {
                data = serpApi.google(query.query(), RESULTS_PER_QUERY);
            } catch (SourceFetchException e) {
                log.debug("Reference query at {} failed: {}", company, e.getMessage());
                continue;
            }
            for (JsonNode item : data.path("organic_results")) {
                String url = SerpApiClient.text(item, "link");
                String title = SerpApiClient.text(item, "title");
                if (!ProfileDomains.isPersonProfileUrl(url)) {
                    continue;
                }
                if (title.split(" - ")[0].toLowerCase(Locale.ROOT).contains(personFirst)) {
                    continue;
                }
                String[] nameAndRole = parseProfileTitle(title);
                if (nameAndRole[0].isEmpty()) {
                    continue;
                }
                contacts.add(new ReferenceContact(
                    nameAndRole[0],
                    nameAndRole[1],
                    company,
                    url,
                    query.category(),
                    SerpApiClient.truncate(SerpApiClient.text(item, "snippet"), 200)
                ));
            }
        }
        return contacts;
    }

    /**
     * Splits "Jane Roe - Senior Manager - Acme | LinkedIn" into name and role.
     */
    static String[] parseProfileTitle(String title) {
        String stripped = PROFILE_SUFFIX.matcher(title == null ? "" : title).replaceAll("");
        List<String> parts = new ArrayList<>();
        for (String part : TITLE_SEPARATOR.split(stripped)) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        if (parts.isEmpty()) {
            return new String[] {"", ""};
        }
        return new String[] {parts.get(0), parts.size() > 1 ? parts.get(1) : ""};
    }

    static String departmentKeywords(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : DEPARTMENT_KEYWORDS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
