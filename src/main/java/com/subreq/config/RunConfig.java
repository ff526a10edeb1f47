package com.subreq.config;

import com.subreq.exception.ConfigurationException;

/**
 * Root configuration for an eligibility run.
 *
 * @param name   Run name, used in logs
 * @param inputs Input table locations
 * @param output Result file path; ".gz" compresses
 * @param batch  Batch settings
 */
public record RunConfig(
        String name,
        InputsConfig inputs,
        String output,
        BatchConfig batch
) {

    /**
     * Check that every path needed to run is present.
     *
     * @throws ConfigurationException naming the first missing setting
     */
    public void validateForRun() {
        if (inputs == null) {
            throw new ConfigurationException("Run '" + name + "' has no inputs section");
        }
        requirePath(inputs.crosswalk(), "inputs.crosswalk");
        requirePath(inputs.subRequirements(), "inputs.sub-requirements");
        requirePath(inputs.offeredCourses(), "inputs.offered-courses");
        requirePath(output, "output");
    }

    private void requirePath(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Run '" + name + "' is missing '" + key + "'");
        }
    }
}
