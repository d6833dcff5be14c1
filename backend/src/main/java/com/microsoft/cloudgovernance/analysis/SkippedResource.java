package com.microsoft.cloudgovernance.analysis;

/**
 * A resource an analyzer could not evaluate.
 */
public record SkippedResource(String resourceId, String resourceName, String reason) {}
