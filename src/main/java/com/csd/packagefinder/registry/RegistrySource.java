package com.csd.packagefinder.registry;

import com.csd.packagefinder.model.RegistryId;
import com.csd.packagefinder.model.RegistryOutcome;

/**
 * One package registry the searcher can ask about a package.
 * <p>
 * Implementations must not throw from {@link #find}: transport and parse failures come back
 * as an outcome carrying a {@link com.csd.packagefinder.model.RegistrySearchError}, and a
 * package the registry does not have comes back as an empty outcome with no error.
 * Instances are shared between concurrent searches and must not keep per-call state.
 */
public interface RegistrySource {

    RegistryId id();

    RegistryOutcome find(String packageName);
}
