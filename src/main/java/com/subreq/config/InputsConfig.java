package com.subreq.config;

/**
 * Locations of the input tables. Each supports the classpath: prefix.
 *
 * @param crosswalk       Published designation crosswalk CSV
 * @param subRequirements Sub-requirement rows CSV
 * @param offeredCourses  Offered courses CSV
 */
public record InputsConfig(String crosswalk, String subRequirements, String offeredCourses) {
}
