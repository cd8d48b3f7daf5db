package com.delta.backgrounder.check.api;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.ProfileProviderName;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record BackgroundCheckApiRequest(
    String name,
    String company,
    String location,
    String title,
    @JsonProperty("linkedin_url") @JsonAlias("linkedinUrl") String linkedinUrl,
    String provider
) {
    public BackgroundCheckRequest toRequest() {
        return new BackgroundCheckRequest(name, company, location, title, linkedinUrl, ProfileProviderName.parse(provider));
    }
}
