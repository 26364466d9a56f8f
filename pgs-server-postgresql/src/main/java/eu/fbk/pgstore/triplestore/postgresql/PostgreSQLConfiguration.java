package eu.fbk.pgstore.triplestore.postgresql;

import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.zaxxer.hikari.HikariConfig;

/**
 * Connection parameters of a PostgreSQL database.
 * <p>
 * A configuration can be obtained from a key/value map ({@link #fromMap(Map)}) or from a string
 * of space-separated {@code key=value} tokens ({@link #parse(String)}), e.g.,
 * {@code "user=rdf password=secret dbname=triples host=db.example.org port=5433"}. Recognized
 * keys are:
 * </p>
 * <ul>
 * <li>{@code user} (required), the database user;</li>
 * <li>{@code dbname} (required), the database name;</li>
 * <li>{@code password} (default empty), the password of the user;</li>
 * <li>{@code host} (default {@code localhost}), the database host;</li>
 * <li>{@code port} (default 5432), the database port, which must be an integer;</li>
 * <li>{@code sslmode} (optional), the SSL mode passed to the JDBC driver.</li>
 * </ul>
 * <p>
 * Any other key is passed unchanged to the JDBC driver as a connection property.
 * </p>
 */
public final class PostgreSQLConfiguration {

    private static final String DEFAULT_HOST = "localhost";

    private static final int DEFAULT_PORT = 5432;

    private static final String DEFAULT_PASSWORD = "";

    private final String user;

    private final String password;

    private final String dbname;

    private final String host;

    private final int port;

    @Nullable
    private final String sslmode;

    private final Map<String, String> properties;

    private PostgreSQLConfiguration(final String user, final String password,
            final String dbname, final String host, final int port,
            @Nullable final String sslmode, final Map<String, String> properties) {
        this.user = user;
        this.password = password;
        this.dbname = dbname;
        this.host = host;
        this.port = port;
        this.sslmode = sslmode;
        this.properties = properties;
    }

    /**
     * Parses a configuration string of space-separated {@code key=value} tokens.
     *
     * @param string
     *            the configuration string
     * @return the parsed configuration
     * @throws IllegalArgumentException
     *             if a token is malformed, a required key is missing or the port is not an
     *             integer
     */
    public static PostgreSQLConfiguration parse(final String string)
            throws IllegalArgumentException {
        final Map<String, String> map = Maps.newLinkedHashMap();
        for (final String token : Splitter.on(' ').trimResults().omitEmptyStrings().split(string)) {
            final int index = token.indexOf('=');
            Preconditions.checkArgument(index > 0, "Invalid configuration token '%s'", token);
            map.put(token.substring(0, index).trim(), token.substring(index + 1).trim());
        }
        return fromMap(map);
    }

    /**
     * Creates a configuration from a key/value map.
     *
     * @param map
     *            the configuration map
     * @return the created configuration
     * @throws IllegalArgumentException
     *             if a required key is missing or the port is not an integer
     */
    public static PostgreSQLConfiguration fromMap(final Map<String, String> map)
            throws IllegalArgumentException {

        final String user = map.get("user");
        final String dbname = map.get("dbname");
        Preconditions.checkArgument(user != null, "Missing required configuration key 'user'");
        Preconditions.checkArgument(dbname != null,
                "Missing required configuration key 'dbname'");

        int port = DEFAULT_PORT;
        final String portString = map.get("port");
        if (portString != null) {
            try {
                port = Integer.parseInt(portString);
            } catch (final NumberFormatException ex) {
                throw new IllegalArgumentException("PostgreSQL port must be a valid integer", ex);
            }
        }

        final ImmutableMap.Builder<String, String> properties = ImmutableMap.builder();
        for (final Map.Entry<String, String> entry : map.entrySet()) {
            switch (entry.getKey()) {
            case "user":
            case "password":
            case "dbname":
            case "host":
            case "port":
            case "sslmode":
                break;
            default:
                properties.put(entry.getKey(), entry.getValue());
            }
        }

        return new PostgreSQLConfiguration(user, MoreObjects.firstNonNull(map.get("password"),
                DEFAULT_PASSWORD), dbname, MoreObjects.firstNonNull(map.get("host"),
                DEFAULT_HOST), port, map.get("sslmode"), properties.build());
    }

    public String getUser() {
        return this.user;
    }

    public String getPassword() {
        return this.password;
    }

    public String getDbname() {
        return this.dbname;
    }

    public String getHost() {
        return this.host;
    }

    public int getPort() {
        return this.port;
    }

    @Nullable
    public String getSslmode() {
        return this.sslmode;
    }

    /**
     * Returns the additional driver properties, i.e., the entries with unrecognized keys.
     *
     * @return an immutable map of driver properties
     */
    public Map<String, String> getProperties() {
        return this.properties;
    }

    /**
     * Returns the JDBC URL of the configured database.
     *
     * @return the JDBC URL, in the form {@code jdbc:postgresql://host:port/dbname}, followed by
     *         the {@code sslmode} parameter if configured
     */
    public String getJdbcURL() {
        final StringBuilder builder = new StringBuilder("jdbc:postgresql://");
        builder.append(this.host).append(':').append(this.port).append('/').append(this.dbname);
        if (this.sslmode != null) {
            builder.append("?sslmode=").append(this.sslmode);
        }
        return builder.toString();
    }

    /**
     * Returns a new HikariCP configuration for a pool of connections to the configured database.
     * Pooled connections are returned with auto-commit disabled.
     *
     * @param poolName
     *            the name of the pool, used in HikariCP log messages
     * @return the created HikariCP configuration
     */
    public HikariConfig toHikariConfig(final String poolName) {
        final HikariConfig config = new HikariConfig();
        config.setPoolName(poolName);
        config.setJdbcUrl(getJdbcURL());
        config.setUsername(this.user);
        config.setPassword(this.password);
        config.setAutoCommit(false);
        config.setMinimumIdle(2); // default = max
        config.setMaximumPoolSize(10); // default = 10
        config.setConnectionTimeout(30000); // default 30000 ms (30 s)
        config.setIdleTimeout(600000); // default 600000 ms (10 m)
        config.setMaxLifetime(1800000); // default 1800000 ms (30 m)
        config.addDataSourceProperty("prepareThreshold", 5);
        for (final Map.Entry<String, String> entry : this.properties.entrySet()) {
            config.addDataSourceProperty(entry.getKey(), entry.getValue());
        }
        return config;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof PostgreSQLConfiguration)) {
            return false;
        }
        final PostgreSQLConfiguration other = (PostgreSQLConfiguration) object;
        return this.user.equals(other.user) && this.password.equals(other.password)
                && this.dbname.equals(other.dbname) && this.host.equals(other.host)
                && this.port == other.port && Objects.equals(this.sslmode, other.sslmode)
                && this.properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.user, this.password, this.dbname, this.host, this.port,
                this.sslmode, this.properties);
    }

    @Override
    public String toString() {
        // password is masked
        return MoreObjects.toStringHelper(this).add("user", this.user).add("password", "***")
                .add("dbname", this.dbname).add("host", this.host).add("port", this.port)
                .add("sslmode", this.sslmode).toString();
    }

}
