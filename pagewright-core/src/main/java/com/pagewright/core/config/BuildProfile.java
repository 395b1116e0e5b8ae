package com.pagewright.core.config;

import com.pagewright.core.error.ConfigurationException;

import java.util.Objects;

/**
 * Named build profile.
 *
 * <p>{@code debug} and {@code release} always exist; other names must be declared under
 * {@code profiles} in {@code site.yaml}.
 *
 * @param name profile name
 * @param release whether drafts are suppressed and output is minified by default
 */
public record BuildProfile(String name, boolean release) {

    public static final BuildProfile DEBUG = new BuildProfile("debug", false);
    public static final BuildProfile RELEASE = new BuildProfile("release", true);

    public BuildProfile {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Resolves a profile name against the built-in and configured profiles.
     *
     * @param name requested profile name
     * @param config site configuration
     * @return resolved profile
     * @throws ConfigurationException if the profile is not declared
     */
    public static BuildProfile resolve(String name, SiteConfig config) {
        if (name == null || name.equals(DEBUG.name())) {
            return DEBUG;
        }
        if (name.equals(RELEASE.name())) {
            return RELEASE;
        }
        SiteConfig.ProfileConfig custom = config.profiles().get(name);
        if (custom == null) {
            throw new ConfigurationException("Unknown build profile '" + name
                + "', declare it under 'profiles' in site.yaml");
        }
        return new BuildProfile(name, custom.release());
    }
}
