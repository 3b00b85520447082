package org.carball.tiercheck.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
