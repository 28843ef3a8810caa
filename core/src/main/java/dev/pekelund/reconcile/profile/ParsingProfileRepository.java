package dev.pekelund.reconcile.profile;

import java.util.Optional;

/**
 * Storage for vendor parsing profiles, keyed by vendor id.
 */
public interface ParsingProfileRepository {

    Optional<ParsingProfile> findByVendorId(String vendorId);

    ParsingProfile save(ParsingProfile profile);

    void deleteByVendorId(String vendorId);
}
