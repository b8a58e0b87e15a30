package com.formatrouter.api;

import com.formatrouter.model.FormatTokens;

import java.nio.file.Path;
import java.util.Map;

/**
 * Produces the decision graph of parsed files.
 */
public interface FormatRouter {
    DecisionGraph routeFile(Path filePath, FormatTokens tokens);
    Map<Path, DecisionGraph> routeFiles(Map<Path, FormatTokens> files);
}
