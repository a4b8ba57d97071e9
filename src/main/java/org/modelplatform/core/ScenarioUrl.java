package org.modelplatform.core;

import java.util.Objects;

import org.modelplatform.api.exceptions.ValidationException;

/**
 * Parsed identity URL of a run.
 * <p>
 * Accepted forms are {@code ixmp://PLATFORM/MODEL/SCENARIO[#VERSION]} and
 * {@code MODEL/SCENARIO[#VERSION]}. The model name contains no {@code /}; everything after the
 * first {@code /} of the path is the scenario name. The version is an unsigned integer or
 * {@code new}; without a fragment the default version is meant.
 *
 * @param platform platform name, null for the bare form
 * @param model    model name
 * @param scenario scenario name
 * @param version  requested version, null for the default version or a new run
 * @param isNew    whether the URL asks for a new run
 */
public record ScenarioUrl(String platform, String model, String scenario, Integer version, boolean isNew) {

    public static final String SCHEME = "ixmp";

    private static final String NEW = "new";

    public ScenarioUrl {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(scenario, "scenario");
        if (isNew && version != null) {
            throw new ValidationException("A URL cannot name both a version and 'new'");
        }
    }

    /**
     * @throws ValidationException for a foreign scheme, a query string, a path with fewer than
     *                             two parts or a version that is neither an integer nor {@code new}
     */
    public static ScenarioUrl parse(String url) {
        Objects.requireNonNull(url, "url");
        String rest = url;

        String fragment = null;
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            fragment = rest.substring(hash + 1);
            rest = rest.substring(0, hash);
        }
        if (rest.indexOf('?') >= 0) {
            throw new ValidationException("URL query is not supported: " + url);
        }

        String platform = null;
        int schemeEnd = rest.indexOf("://");
        if (schemeEnd >= 0) {
            String scheme = rest.substring(0, schemeEnd);
            if (!scheme.isEmpty() && !scheme.equals(SCHEME)) {
                throw new ValidationException("URL scheme must be '" + SCHEME + "', got '" + scheme + "' in " + url);
            }
            rest = rest.substring(schemeEnd + 3);
            int slash = rest.indexOf('/');
            platform = slash < 0 ? rest : rest.substring(0, slash);
            rest = slash < 0 ? "" : rest.substring(slash + 1);
        }

        while (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        int split = rest.indexOf('/');
        if (split <= 0 || split == rest.length() - 1) {
            throw new ValidationException("URL path must be 'MODEL/SCENARIO', got '" + rest + "' in " + url);
        }
        String model = rest.substring(0, split);
        String scenario = rest.substring(split + 1);

        if (fragment == null || fragment.isEmpty()) {
            return new ScenarioUrl(platform, model, scenario, null, false);
        }
        if (fragment.equals(NEW)) {
            return new ScenarioUrl(platform, model, scenario, null, true);
        }
        try {
            int version = Integer.parseInt(fragment);
            if (version < 0) {
                throw new ValidationException("URL version must be int or 'new', got '" + fragment + "'");
            }
            return new ScenarioUrl(platform, model, scenario, version, false);
        } catch (NumberFormatException e) {
            throw new ValidationException("URL version must be int or 'new', got '" + fragment + "'", e);
        }
    }

    /**
     * @return the URL without platform part, e.g. {@code model/scenario#3}
     */
    public String path() {
        String suffix = isNew ? "#" + NEW : version == null ? "" : "#" + version;
        return model + "/" + scenario + suffix;
    }

    /**
     * @return the full URL; the bare form if no platform is set
     */
    public String format() {
        return platform == null ? path() : SCHEME + "://" + platform + "/" + path();
    }

    @Override
    public String toString() {
        return format();
    }
}
