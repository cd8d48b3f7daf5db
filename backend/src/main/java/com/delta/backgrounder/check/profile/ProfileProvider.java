package com.delta.backgrounder.check.profile;

import com.delta.backgrounder.check.model.BackgroundCheckRequest;
import com.delta.backgrounder.check.model.LinkedInProfile;
import com.delta.backgrounder.check.model.ProfileProviderName;

/**
 * One way of obtaining the subject's professional profile. When the request carries a
 * profile URL it is used directly; otherwise providers discover one from name, company,
 * title and location.
 */
public interface ProfileProvider {

    ProfileProviderName name();

    /**
     * @return the profile, or null when nothing usable was found
     */
    LinkedInProfile fetch(BackgroundCheckRequest request);
}
