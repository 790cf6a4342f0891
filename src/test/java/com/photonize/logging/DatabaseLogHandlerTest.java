package com.photonize.logging;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseLogHandlerTest {

    private static final String JDBC_URL =
        "jdbc:h2:mem:photonize-logs;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";
    private static final String JDBC_USER = "sa";
    private static final String JDBC_PASS = "";

    @BeforeAll
    static void setUpDatabase() throws SQLException {
        System.setProperty(DatabaseLogHandler.URL_PROPERTY, JDBC_URL);
        System.setProperty(DatabaseLogHandler.USER_PROPERTY, JDBC_USER);
        System.setProperty(DatabaseLogHandler.PASS_PROPERTY, JDBC_PASS);
        System.setProperty(DatabaseLogHandler.POOL_PROPERTY, "2");

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS photonize_logs");
            statement.execute("""
                CREATE TABLE photonize_logs (
                    logged_at   TIMESTAMP NOT NULL,
                    level       VARCHAR(16) NOT NULL,
                    logger      VARCHAR(128),
                    message     TEXT,
                    thread_name VARCHAR(64),
                    host        VARCHAR(128),
                    thrown_type VARCHAR(256),
                    thrown_msg  TEXT
                )
                """);
        }
    }

    @AfterEach
    void clearTable() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM photonize_logs");
        }
    }

    @AfterAll
    static void tearDown() {
        System.clearProperty(DatabaseLogHandler.URL_PROPERTY);
        System.clearProperty(DatabaseLogHandler.USER_PROPERTY);
        System.clearProperty(DatabaseLogHandler.PASS_PROPERTY);
        System.clearProperty(DatabaseLogHandler.POOL_PROPERTY);
    }

    @Test
    void closeFlushesQueuedRecords() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        try {
            LogRecord plain = new LogRecord(Level.INFO, "Renamed {0} file(s)");
            plain.setLoggerName("com.photonize");
            plain.setParameters(new Object[]{12});
            handler.publish(plain);

            LogRecord failed = new LogRecord(Level.SEVERE, "Rename stopped");
            failed.setLoggerName("com.photonize");
            failed.setThrown(new IOException("disk full"));
            handler.publish(failed);
        } finally {
            handler.close();
        }

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT level, logger, message, thrown_type, thrown_msg FROM photonize_logs ORDER BY level")) {
            ResultSet rows = statement.executeQuery();
            assertTrue(rows.next(), "No log record persisted");
            assertEquals("INFO", rows.getString("level"));
            assertEquals("com.photonize", rows.getString("logger"));
            assertEquals("Renamed 12 file(s)", rows.getString("message"));
            assertNull(rows.getString("thrown_type"));

            assertTrue(rows.next());
            assertEquals("SEVERE", rows.getString("level"));
            assertEquals(IOException.class.getName(), rows.getString("thrown_type"));
            assertEquals("disk full", rows.getString("thrown_msg"));
            assertFalse(rows.next());
        }
    }

    @Test
    void recordsAfterCloseAreIgnored() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        handler.close();
        handler.publish(new LogRecord(Level.INFO, "late"));
        handler.close();

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT COUNT(*) FROM photonize_logs")) {
            assertTrue(rows.next());
            assertEquals(0, rows.getInt(1));
        }
    }

    @Test
    void missingUrlDisablesTheHandler() {
        String url = System.getProperty(DatabaseLogHandler.URL_PROPERTY);
        System.clearProperty(DatabaseLogHandler.URL_PROPERTY);
        try {
            if (System.getenv("PHOTONIZE_LOG_JDBC_URL") == null) {
                assertThrows(IllegalStateException.class, DatabaseLogHandler::new);
            }
        } finally {
            System.setProperty(DatabaseLogHandler.URL_PROPERTY, url);
        }
    }
}
