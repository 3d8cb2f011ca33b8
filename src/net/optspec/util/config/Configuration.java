package net.optspec.util.config;

/**
 * A read-only source of string settings, keyed by dotted names like
 * {@code optspec.exitOnError}.
 */
public interface Configuration {

    /** Knows no keys at all; for callers that want built-in defaults only. */
    Configuration NULL = new DynamicConfiguration();

    /** System properties, then environment variables. */
    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    /** The value for key, or null if this source does not define it. */
    String get(String key);

}
