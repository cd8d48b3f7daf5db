package com.delta.backgrounder.check.source;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.model.CompanyCheck;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class SerpApiCompanyVerifier implements CompanyVerifier {
    private static final Logger log = LoggerFactory.getLogger(SerpApiCompanyVerifier.class);
    private static final int RESULTS_CHECKED = 5;

    private final SerpApiClient serpApi;
    private final ExecutorService sourceExecutor;

    public SerpApiCompanyVerifier(SerpApiClient serpApi, @Qualifier("sourceExecutor") ExecutorService sourceExecutor) {
        this.serpApi = serpApi;
        this.sourceExecutor = sourceExecutor;
    }

    @Override
    public List<CompanyCheck> verifyAll(List<String> companyNames) {
        if (companyNames == null || companyNames.isEmpty() || !serpApi.isConfigured()) {
            return List.of();
        }
        List<CompletableFuture<CompanyCheck>> futures = new ArrayList<>();
        for (String company : companyNames) {
            futures.add(CompletableFuture.supplyAsync(() -> verify(company), sourceExecutor));
        }
        List<CompanyCheck> checks = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                checks.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.warn("Company verification failed for {}", companyNames.get(i), e.getCause());
            }
        }
        return checks;
    }

    @Override
    public CompanyCheck verify(String companyName) {
        JsonNode data;
        try {
            data = serpApi.google("\"" + companyName + "\" company", RESULTS_CHECKED);
        } catch (SourceFetchException e) {
            log.debug("Company search failed for {}: {}", companyName, e.getMessage());
            return new CompanyCheck(companyName, false, null, "Search failed");
        }
        String lowerName = companyName.toLowerCase(Locale.ROOT);

        JsonNode knowledge = data.path("knowledge_graph");
        if (knowledge.isObject() && knowledge.size() > 0) {
            String kgTitle = SerpApiClient.text(knowledge, "title").toLowerCase(Locale.ROOT);
            if (!kgTitle.isEmpty() && (lowerName.contains(kgTitle) || kgTitle.contains(lowerName))) {
                String desc = SerpApiClient.text(knowledge, "description");
                return new CompanyCheck(
                    companyName,
                    true,
                    SerpApiClient.text(knowledge, "website"),
                    desc.isEmpty()
                        ? "Found in Google Knowledge Graph"
                        : "Google Knowledge Graph: " + SerpApiClient.truncate(desc, 150)
                );
            }
        }

        JsonNode organic = data.path("organic_results");
        int inspected = 0;
        for (JsonNode result : organic) {
            if (inspected++ >= RESULTS_CHECKED) {
                break;
            }
            String url = SerpApiClient.text(result, "link");
            String title = SerpApiClient.text(result, "title").toLowerCase(Locale.ROOT);
            String snippet = SerpApiClient.text(result, "snippet");
            if (url.contains(ProfileDomains.PROFILE_DOMAIN + "/company/") || title.contains(lowerName)) {
                return new CompanyCheck(
                    companyName,
                    true,
                    url,
                    snippet.isEmpty() ? "Found at " + url : SerpApiClient.truncate(snippet, 150)
                );
            }
        }

        if (organic.size() > 0) {
            return new CompanyCheck(
                companyName,
                false,
                null,
                "Search returned results but no strong match for '" + companyName + "' as a company"
            );
        }
        return new CompanyCheck(companyName, false, null, "No search results found for this company");
    }
}
