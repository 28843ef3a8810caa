package dev.pekelund.reconcile.processor.local;

import dev.pekelund.reconcile.profile.ParsingProfile;
import dev.pekelund.reconcile.profile.ParsingProfileRepository;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryParsingProfileRepository implements ParsingProfileRepository {

    private final Map<String, ParsingProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<ParsingProfile> findByVendorId(String vendorId) {
        return vendorId != null ? Optional.ofNullable(profiles.get(vendorId)) : Optional.empty();
    }

    @Override
    public ParsingProfile save(ParsingProfile profile) {
        Objects.requireNonNull(profile, "profile");
        profiles.put(profile.vendorId(), profile);
        return profile;
    }

    @Override
    public void deleteByVendorId(String vendorId) {
        profiles.remove(vendorId);
    }
}
