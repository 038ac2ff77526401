package com.koni.vitals.application.service;

import com.koni.vitals.domain.exception.UnknownSiteException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.repository.StateStore;
import com.koni.vitals.infrastructure.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The list of sites the pipeline serves.
 * A list stored in the state store takes precedence over {@code vitals.sites}.
 */
@Slf4j
@Service
public class SiteRegistry {
    
    private static final Pattern SITE_NAME = Pattern.compile("[A-Za-z0-9_.-]+");
    
    private final StateStore stateStore;
    private final List<String> configuredSites;
    
    public SiteRegistry(StateStore stateStore, PipelineProperties properties) {
        this.stateStore = stateStore;
        this.configuredSites = normalize(properties.getSites());
    }
    
    public List<String> listSites() {
        return stateStore.findRegisteredSites()
                .map(SiteRegistry::normalize)
                .filter(sites -> !sites.isEmpty())
                .orElse(configuredSites);
    }
    
    public boolean isKnown(String site) {
        return site != null && listSites().contains(site);
    }
    
    /**
     * @throws UnknownSiteException if the site is not registered
     */
    public void requireKnown(String site) {
        if (!isKnown(site)) {
            throw new UnknownSiteException("Unknown site: " + site);
        }
    }
    
    /**
     * Replaces the stored list. Duplicates are removed, order is kept.
     *
     * @throws ValidationException if any name is invalid
     */
    public List<String> replace(List<String> sites) {
        if (sites == null) {
            throw new ValidationException("sites is required");
        }
        sites.forEach(SiteRegistry::validateName);
        List<String> normalized = normalize(sites);
        stateStore.saveRegisteredSites(normalized);
        log.info("Site registry replaced: count={}", normalized.size());
        return normalized;
    }
    
    public List<String> add(String site) {
        validateName(site);
        List<String> sites = new ArrayList<>(listSites());
        if (!sites.contains(site)) {
            sites.add(site);
            stateStore.saveRegisteredSites(sites);
            log.info("Site registered: site={}", site);
        }
        return sites;
    }
    
    /**
     * @throws UnknownSiteException if the site is not registered
     */
    public List<String> remove(String site) {
        List<String> sites = new ArrayList<>(listSites());
        if (!sites.remove(site)) {
            throw new UnknownSiteException("Unknown site: " + site);
        }
        stateStore.saveRegisteredSites(sites);
        log.info("Site unregistered: site={}", site);
        return sites;
    }
    
    static void validateName(String site) {
        if (site == null || !SITE_NAME.matcher(site.trim()).matches()) {
            throw new ValidationException("Invalid site name: " + site);
        }
    }
    
    private static List<String> normalize(List<String> sites) {
        Set<String> unique = new LinkedHashSet<>();
        if (sites != null) {
            for (String site : sites) {
                if (site != null && !site.isBlank()) {
                    unique.add(site.trim());
                }
            }
        }
        return List.copyOf(unique);
    }
}
