package com.tablebridge.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection provider that opens a fresh JDBC connection through
 * {@link DriverManager} on every call.
 *
 * <p>Example usage:
 * <pre>
 *   // Embedded DuckDB database file
 *   ConnectionProvider provider = new JdbcConnectionProvider(
 *       JdbcConnectionProvider.Configuration.of("jdbc:duckdb:/data/sales.duckdb"));
 *
 *   // From -Dtablebridge.jdbc.url=... -Dtablebridge.jdbc.user=...
 *   ConnectionProvider provider = new JdbcConnectionProvider(
 *       JdbcConnectionProvider.Configuration.fromSystemProperties());
 * </pre>
 *
 * <p>No pooling is done here. Wrap a pooled DataSource in a
 * {@link ConnectionProvider} lambda when pooling is wanted.
 */
public class JdbcConnectionProvider implements ConnectionProvider {

    private static final Logger logger = LoggerFactory.getLogger(JdbcConnectionProvider.class);

    public static final String PROP_JDBC_URL = "tablebridge.jdbc.url";
    public static final String PROP_JDBC_USER = "tablebridge.jdbc.user";
    public static final String PROP_JDBC_PASSWORD = "tablebridge.jdbc.password";
    public static final String PROP_LOGIN_TIMEOUT_SECONDS = "tablebridge.jdbc.loginTimeoutSeconds";

    /** Default JDBC URL: an in-process DuckDB database. */
    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb:";

    private final Configuration config;

    /**
     * Creates a provider with the specified configuration.
     *
     * <p>A positive login timeout is applied to {@link DriverManager} once,
     * here. That setting is shared by every driver in the JVM.
     *
     * @param config the configuration
     */
    public JdbcConnectionProvider(Configuration config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.loginTimeoutSeconds > 0) {
            logger.debug("Setting JVM-wide JDBC login timeout to {}s (was {}s)",
                config.loginTimeoutSeconds, DriverManager.getLoginTimeout());
            DriverManager.setLoginTimeout(config.loginTimeoutSeconds);
        }
        logger.info("JDBC connection provider configured for {}", config.jdbcUrl);
    }

    @Override
    public Connection getConnection() throws SQLException {
        Properties props = new Properties();
        props.putAll(config.driverProperties);
        if (config.user != null) {
            props.setProperty("user", config.user);
        }
        if (config.password != null) {
            props.setProperty("password", config.password);
        }
        return DriverManager.getConnection(config.jdbcUrl, props);
    }

    public Configuration getConfiguration() {
        return config;
    }

    /**
     * Configuration for the connection provider.
     */
    public static class Configuration {
        /** JDBC URL of the store */
        public String jdbcUrl = DEFAULT_JDBC_URL;

        /** User name, or null when the URL carries credentials */
        public String user = null;

        /** Password, or null when the URL carries credentials */
        public String password = null;

        /** Driver login timeout in seconds (0 = driver default) */
        public int loginTimeoutSeconds = 0;

        /** Extra driver properties */
        public Properties driverProperties = new Properties();

        /**
         * Creates a configuration for the given JDBC URL.
         *
         * @param jdbcUrl the JDBC URL
         * @return the configuration
         */
        public static Configuration of(String jdbcUrl) {
            Configuration config = new Configuration();
            config.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
            return config;
        }

        /**
         * Reads a configuration from properties using the
         * {@code tablebridge.jdbc.*} keys. Missing keys keep their defaults.
         *
         * @param props the properties
         * @return the configuration
         */
        public static Configuration fromProperties(Properties props) {
            Objects.requireNonNull(props, "props must not be null");
            Configuration config = new Configuration();
            config.jdbcUrl = props.getProperty(PROP_JDBC_URL, DEFAULT_JDBC_URL);
            config.user = props.getProperty(PROP_JDBC_USER);
            config.password = props.getProperty(PROP_JDBC_PASSWORD);
            config.loginTimeoutSeconds = parseTimeout(props.getProperty(PROP_LOGIN_TIMEOUT_SECONDS));
            return config;
        }

        /**
         * Reads a configuration from JVM system properties.
         *
         * @return the configuration
         */
        public static Configuration fromSystemProperties() {
            return fromProperties(System.getProperties());
        }

        /**
         * Sets the credentials.
         *
         * @param user the user name
         * @param password the password
         * @return this configuration
         */
        public Configuration withCredentials(String user, String password) {
            this.user = user;
            this.password = password;
            return this;
        }

        /**
         * Adds a driver property.
         *
         * @param key the property name
         * @param value the property value
         * @return this configuration
         */
        public Configuration withDriverProperty(String key, String value) {
            driverProperties.setProperty(key, value);
            return this;
        }

        private static int parseTimeout(String value) {
            if (value != null) {
                try {
                    int seconds = Integer.parseInt(value.trim());
                    if (seconds > 0) {
                        return seconds;
                    }
                } catch (NumberFormatException e) {
                    logger.warn("Ignoring invalid {} value '{}'", PROP_LOGIN_TIMEOUT_SECONDS, value);
                }
            }
            return 0;
        }
    }
}
