package io.tessera.core.model;

import io.tessera.core.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A connection to an external system, declared in the settings document.
///
/// Overwrite-on-collision: a connection added under an existing `connId`
/// replaces the previous one entirely, fields are never combined.
///
/// @implNote Immutable after construction. The `extra` map is an unmodifiable,
/// insertion-ordered copy.
public final class Connection implements Entity<String, Connection>, SettingsEntry {

    public static final String DEFAULT_TYPE = "generic";

    private final String connId;
    private final String connType;
    private final String host;
    private final String schema;
    private final String login;
    private final String password;
    private final Integer port;
    private final Map<String, Object> extra;

    private Connection(Builder builder) {
        this.connId = ValidationException.requireText(builder.connId, "Connection connId");
        this.connType =
                builder.connType == null || builder.connType.isBlank()
                        ? DEFAULT_TYPE
                        : builder.connType;
        this.host = builder.host;
        this.schema = builder.schema;
        this.login = builder.login;
        this.password = builder.password;
        this.port = builder.port;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
    }

    /// Creates a generic connection carrying only an identifier.
    public static Connection of(String connId) {
        return builder().connId(connId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getConnId() {
        return connId;
    }

    public String getConnType() {
        return connType;
    }

    public String getHost() {
        return host;
    }

    public String getSchema() {
        return schema;
    }

    public String getLogin() {
        return login;
    }

    public String getPassword() {
        return password;
    }

    public Integer getPort() {
        return port;
    }

    public Map<String, Object> getExtra() {
        return extra;
    }

    @Override
    public String identityKey() {
        return connId;
    }

    @Override
    public Connection merge(Connection other) {
        return other;
    }

    /// Returns the settings record; unset optional fields are omitted.
    @Override
    public Map<String, Object> toSettings() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("conn_id", connId);
        record.put("conn_type", connType);
        putIfPresent(record, "conn_host", host);
        putIfPresent(record, "conn_schema", schema);
        putIfPresent(record, "conn_login", login);
        putIfPresent(record, "conn_password", password);
        putIfPresent(record, "conn_port", port);
        if (!extra.isEmpty()) {
            record.put("conn_extra", extra);
        }
        return Collections.unmodifiableMap(record);
    }

    private static void putIfPresent(Map<String, Object> record, String key, Object value) {
        if (value != null) {
            record.put(key, value);
        }
    }

    public static final class Builder {
        private String connId;
        private String connType;
        private String host;
        private String schema;
        private String login;
        private String password;
        private Integer port;
        private Map<String, Object> extra = new LinkedHashMap<>();

        private Builder() {}

        public Builder connId(String connId) {
            this.connId = connId;
            return this;
        }

        public Builder connType(String connType) {
            this.connType = connType;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder login(String login) {
            this.login = login;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra = new LinkedHashMap<>();
            if (extra != null) {
                extra.forEach(this::extraEntry);
            }
            return this;
        }

        public Builder extraEntry(String key, Object value) {
            this.extra.put(ValidationException.requireText(key, "extra key"), value);
            return this;
        }

        /// Builds the connection.
        ///
        /// @return new connection, never null
        /// @throws ValidationException if `connId` is null or blank
        public Connection build() {
            return new Connection(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Connection that)) return false;
        return connId.equals(that.connId)
                && connType.equals(that.connType)
                && Objects.equals(host, that.host)
                && Objects.equals(schema, that.schema)
                && Objects.equals(login, that.login)
                && Objects.equals(password, that.password)
                && Objects.equals(port, that.port)
                && extra.equals(that.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connId, connType, host, schema, login, password, port, extra);
    }

    @Override
    public String toString() {
        return "Connection(conn_id=" + connId + ", conn_type=" + connType + ")";
    }
}
