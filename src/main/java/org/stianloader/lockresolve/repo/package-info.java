/**
 * Package storing the registry access layer. A {@link org.stianloader.lockresolve.repo.RegistryRepository}
 * only fetches raw bytes; caching and retrying are left to the transport and are not performed here.
 */
package org.stianloader.lockresolve.repo;
