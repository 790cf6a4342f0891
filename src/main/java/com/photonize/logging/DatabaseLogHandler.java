package com.photonize.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Ships JUL records to a central {@code photonize_logs} table in small batches.
 * Construction fails with {@link IllegalStateException} when no JDBC URL is configured.
 */
public final class DatabaseLogHandler extends Handler {

    static final String URL_PROPERTY = "logging.jdbc.url";
    static final String USER_PROPERTY = "logging.jdbc.user";
    static final String PASS_PROPERTY = "logging.jdbc.pass";
    static final String POOL_PROPERTY = "logging.jdbc.poolSize";

    private static final int QUEUE_CAPACITY = 2048;
    private static final int MAX_BATCH = 64;
    private static final long POLL_MILLIS = 200;

    private static final String INSERT_SQL = """
        INSERT INTO photonize_logs (
            logged_at, level, logger, message, thread_name, host, thrown_type, thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> pending = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final HikariDataSource dataSource;
    private final String host;
    private final Thread writer;

    private volatile boolean open = true;

    public DatabaseLogHandler() {
        Settings settings = Settings.resolve();
        if (settings.url() == null) {
            throw new IllegalStateException("no JDBC URL configured (" + URL_PROPERTY + ")");
        }
        this.dataSource = openPool(settings);
        this.host = localHost();
        this.writer = new Thread(this::writeLoop, "photonize-log-writer");
        this.writer.setDaemon(true);
        this.writer.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!open || !isLoggable(record)) {
            return;
        }
        // drop the oldest record rather than block a worker thread
        while (!pending.offer(record)) {
            pending.poll();
        }
    }

    @Override
    public void flush() {
        // records are written by the background writer
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        // the writer leaves its poll loop within POLL_MILLIS and flushes what is left
        try {
            writer.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (writer.isAlive()) {
            writer.interrupt();
        }
        dataSource.close();
    }

    private void writeLoop() {
        List<LogRecord> batch = new ArrayList<>(MAX_BATCH);
        while (open) {
            try {
                LogRecord first = pending.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                pending.drainTo(batch, MAX_BATCH - 1);
                insert(batch);
            } catch (InterruptedException ex) {
                break;
            } catch (SQLException ex) {
                reportError("Failed to persist " + batch.size() + " log record(s)", ex, 0);
            } finally {
                batch.clear();
            }
        }

        Thread.interrupted();
        pending.drainTo(batch);
        if (!batch.isEmpty()) {
            try {
                insert(batch);
            } catch (SQLException ex) {
                reportError("Failed to persist log records on close", ex, 0);
            }
        }
    }

    private void insert(List<LogRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : records) {
                Throwable thrown = record.getThrown();
                statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
                statement.setString(2, record.getLevel().getName());
                statement.setString(3, record.getLoggerName());
                statement.setString(4, render(record));
                statement.setString(5, "thread-" + record.getThreadID());
                statement.setString(6, host);
                statement.setString(7, thrown == null ? null : thrown.getClass().getName());
                statement.setString(8, thrown == null ? null : thrown.getMessage());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static String render(LogRecord record) {
        String message = record.getMessage();
        if (message == null) {
            return "";
        }
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String localHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource openPool(Settings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.url());
        config.setUsername(settings.user());
        config.setPassword(settings.password());
        config.setMaximumPoolSize(settings.poolSize());
        config.setPoolName("photonize-logs");
        config.setAutoCommit(true);
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }

    private record Settings(String url, String user, String password, int poolSize) {

        static Settings resolve() {
            String url = pick(System.getProperty(URL_PROPERTY), System.getenv("PHOTONIZE_LOG_JDBC_URL"));
            String user = pick(System.getProperty(USER_PROPERTY), System.getenv("PHOTONIZE_LOG_JDBC_USER"));
            String password = pick(System.getProperty(PASS_PROPERTY), System.getenv("PHOTONIZE_LOG_JDBC_PASS"));
            String pool = pick(System.getProperty(POOL_PROPERTY), System.getenv("PHOTONIZE_LOG_JDBC_POOL"));
            return new Settings(url, user, password, parsePoolSize(pool));
        }

        private static String pick(String primary, String fallback) {
            if (primary != null && !primary.isBlank()) {
                return primary.trim();
            }
            if (fallback != null && !fallback.isBlank()) {
                return fallback.trim();
            }
            return null;
        }

        private static int parsePoolSize(String raw) {
            if (raw == null) {
                return 2;
            }
            try {
                return Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
