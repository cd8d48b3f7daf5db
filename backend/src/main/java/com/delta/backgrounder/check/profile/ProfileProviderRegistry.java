package com.delta.backgrounder.check.profile;

import com.delta.backgrounder.check.model.ProfileProviderName;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ProfileProviderRegistry {
    private final Map<ProfileProviderName, ProfileProvider> providers = new EnumMap<>(ProfileProviderName.class);

    public ProfileProviderRegistry(List<ProfileProvider> providers) {
        for (ProfileProvider provider : providers) {
            ProfileProvider previous = this.providers.put(provider.name(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate profile provider for " + provider.name());
            }
        }
    }

    public ProfileProvider get(ProfileProviderName name) {
        ProfileProvider provider = providers.get(name);
        if (provider == null) {
            throw new IllegalStateException("No profile provider registered for " + name);
        }
        return provider;
    }
}
