package com.dimosr.exporter.core;

/**
 * Refreshes the credentials and project context needed for discovering the resources of a product
 */
@FunctionalInterface
public interface ProjectContextRefresher {
    void reload();
}
