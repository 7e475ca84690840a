package twig.core.config;

import twig.core.type.Result;

/**
 * Parses a run configuration document.
 */
public interface RunConfigurationParser {

    /**
     * Parses the given document into a run configuration, or returns an error describing why it could not be parsed.
     *
     * @param document The document to parse.
     * @return the parse result.
     */
    public Result<RunConfiguration> parseRunConfiguration(String document);
}
