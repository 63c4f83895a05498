package org.carball.materializer.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
