package com.delta.backgrounder.check.source;

import java.util.Locale;

/**
 * URLs belonging to the primary profile source, which general search results leave out.
 */
public final class ProfileDomains {
    public static final String PROFILE_DOMAIN = "linkedin.com";

    private ProfileDomains() {
    }

    public static boolean isProfileUrl(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains(PROFILE_DOMAIN);
    }

    public static boolean isPersonProfileUrl(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains(PROFILE_DOMAIN + "/in/");
    }
}
