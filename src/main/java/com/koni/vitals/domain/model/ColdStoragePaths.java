package com.koni.vitals.domain.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

/**
 * Object key layout of the cold store: {@code timeseries/{site}/{YYYY}/{MM}/{DD}/{name}.{ext}}.
 */
public final class ColdStoragePaths {
    
    private static final String ROOT = "timeseries";
    
    private ColdStoragePaths() {
    }
    
    public static String dayPrefix(String site, LocalDate day) {
        return String.format("%s/%s/%04d/%02d/%02d",
                ROOT, encodeSegment(site), day.getYear(), day.getMonthValue(), day.getDayOfMonth());
    }
    
    public static String objectKey(String site, LocalDate day, String name, String extension) {
        return dayPrefix(site, day) + "/" + encodeSegment(name) + "." + extension;
    }
    
    /**
     * Encodes a path segment so point names containing '/' or spaces map to a single segment.
     */
    static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
