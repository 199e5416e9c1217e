package com.quickbite.menuservice.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * SQLite creates the database file on first connect but not its directory.
 */
@Component
public class DatabaseDirectoryInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseDirectoryInitializer.class);

    public void ensureDirectoryFor(String databasePath) {
        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent == null || parent.exists()) {
            return;
        }
        if (parent.mkdirs()) {
            logger.info("Created database directory: {}", parent.getAbsolutePath());
        } else if (!parent.exists()) {
            throw new IllegalStateException("Failed to create database directory: " + parent.getAbsolutePath());
        }
    }
}
