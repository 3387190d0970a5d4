package com.bhavyahealth.fetcher.output;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.exception.StorageException;
import com.bhavyahealth.fetcher.exception.StoragePersistException;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.HealthColumns;
import com.bhavyahealth.fetcher.model.HealthRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
@Slf4j
public class JdbcHealthRecordStore implements HealthRecordStore {

    private static final int LOOKUP_BATCH_SIZE = 1000;
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");
    private static final DateTimeFormatter FETCHED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final String table;

    private final String updateSql;
    private final String insertSql;

    public JdbcHealthRecordStore(JdbcTemplate jdbcTemplate, HealthFetcherProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.table = properties.getStorage().getTableName();
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }

        List<String> valueColumns = HealthColumns.ALL.stream()
                .filter(c -> !c.equals(HealthColumns.DATA_DATE))
                .toList();
        this.updateSql = "UPDATE " + table + " SET "
                + valueColumns.stream().map(c -> c + " = ?").collect(Collectors.joining(", "))
                + " WHERE data_date = ?";
        this.insertSql = "INSERT INTO " + table + " ("
                + String.join(", ", HealthColumns.ALL) + ") VALUES ("
                + HealthColumns.ALL.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
    }

    public String tableName() {
        return table;
    }

    /**
     * Creates the table unless it is already there. Value columns are TEXT; data_date and
     * fetched_at stay short VARCHARs so they can be keyed, sorted and compared.
     *
     * @return true if the table was created by this call
     */
    public boolean ensureSchema() {
        if (tableExists()) {
            log.info("Table {} already exists.", table);
            return false;
        }
        log.info("Creating table {}...", table);

        StringBuilder ddl = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(table).append(" (\n")
                .append("    id BIGINT AUTO_INCREMENT PRIMARY KEY,\n")
                .append("    data_date VARCHAR(10) NOT NULL,\n");
        for (String column : HealthColumns.ALL) {
            if (column.equals(HealthColumns.DATA_DATE)) continue;
            String type = column.equals(HealthColumns.FETCHED_AT) ? "VARCHAR(19)" : "TEXT";
            ddl.append("    ").append(column).append(' ').append(type).append(",\n");
        }
        ddl.append("    CONSTRAINT uq_").append(table).append("_data_date UNIQUE (data_date)\n)");

        try {
            jdbcTemplate.execute(ddl.toString());
        } catch (DataAccessException e) {
            throw new StorageException("Creating table " + table + " failed: " + e.getMessage(), e);
        }
        if (!tableExists()) {
            throw new StorageException("Table " + table + " still missing after CREATE TABLE", null);
        }
        log.info("Table {} created.", table);
        return true;
    }

    public boolean tableExists() {
        try {
            Boolean found = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
                DatabaseMetaData meta = connection.getMetaData();
                // unquoted names are folded to upper case by some databases, lower case by others
                for (String name : new LinkedHashSet<>(List.of(
                        table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)))) {
                    try (ResultSet tables = meta.getTables(connection.getCatalog(), null, name, new String[]{"TABLE"})) {
                        while (tables.next()) {
                            if (table.equalsIgnoreCase(tables.getString("TABLE_NAME"))) return true;
                        }
                    }
                }
                return false;
            });
            return Boolean.TRUE.equals(found);
        } catch (DataAccessException e) {
            throw new StorageException("Table check failed: " + e.getMessage(), e);
        }
    }

    /** Where the store is connected, as reported by the driver. */
    public Map<String, String> describeConnection() {
        try {
            Map<String, String> info = jdbcTemplate.execute((ConnectionCallback<Map<String, String>>) connection -> {
                DatabaseMetaData meta = connection.getMetaData();
                Map<String, String> details = new LinkedHashMap<>();
                details.put("url", meta.getURL());
                details.put("user", meta.getUserName());
                details.put("database", connection.getCatalog());
                details.put("product", meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion());
                return details;
            });
            return info == null ? Map.of() : info;
        } catch (DataAccessException e) {
            throw new StorageException("Connection failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Set<DateKey> exists(Set<DateKey> dates) {
        if (dates.isEmpty()) return Set.of();

        List<String> keys = dates.stream().map(DateKey::toString).toList();
        Set<DateKey> found = new HashSet<>();
        try {
            for (int i = 0; i < keys.size(); i += LOOKUP_BATCH_SIZE) {
                List<String> batch = keys.subList(i, Math.min(i + LOOKUP_BATCH_SIZE, keys.size()));
                namedJdbcTemplate.queryForList(
                        "SELECT data_date FROM " + table + " WHERE data_date IN (:dates)",
                        new MapSqlParameterSource("dates", batch),
                        String.class
                ).forEach(d -> found.add(DateKey.parse(d)));
            }
        } catch (DataAccessException e) {
            throw new StorageException("Existence lookup failed: " + e.getMessage(), e);
        }
        return found;
    }

    /**
     * Update first, insert if nothing matched. A concurrent insert of the same date loses on
     * the unique key and falls back to the update, so the last writer wins either way.
     */
    @Override
    public void upsert(HealthRecord record) {
        try {
            int updated = jdbcTemplate.update(updateSql, updateArgs(record));
            if (updated == 0) {
                try {
                    jdbcTemplate.update(insertSql, HealthColumns.ALL.stream().map(record::get).toArray());
                } catch (DuplicateKeyException e) {
                    jdbcTemplate.update(updateSql, updateArgs(record));
                }
            }
            log.debug("Upserted {} into {}", record.getDate(), table);
        } catch (DataAccessException e) {
            throw new StoragePersistException("Failed to save " + record.getDate() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long count() {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StorageException("Record count failed: " + e.getMessage(), e);
        }
    }

    @Override
    public SortedSet<DateKey> listKnownDates() {
        try {
            return jdbcTemplate.queryForList("SELECT data_date FROM " + table, String.class).stream()
                    .map(DateKey::parse)
                    .collect(Collectors.toCollection(TreeSet::new));
        } catch (DataAccessException e) {
            throw new StorageException("Listing dates failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<DateKey> recentDates(int limit) {
        try {
            return jdbcTemplate.queryForList(
                            "SELECT data_date FROM " + table + " ORDER BY data_date DESC LIMIT ?",
                            String.class, limit).stream()
                    .map(DateKey::parse)
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageException("Listing recent dates failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> lastFetchedAt() {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                    "SELECT MAX(fetched_at) FROM " + table, String.class));
        } catch (DataAccessException e) {
            throw new StorageException("Reading last fetch time failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<HealthRecord> find(DateKey date) {
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                    "SELECT " + String.join(", ", HealthColumns.ALL) + " FROM " + table + " WHERE data_date = ?",
                    date.toString());
            if (rows.isEmpty()) return Optional.empty();
            return Optional.of(toRecord(date, rows.get(0)));
        } catch (DataAccessException e) {
            throw new StorageException("Reading " + date + " failed: " + e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Object[] updateArgs(HealthRecord record) {
        List<Object> args = new ArrayList<>(HealthColumns.ALL.size());
        for (String column : HealthColumns.ALL) {
            if (!column.equals(HealthColumns.DATA_DATE)) args.add(record.get(column));
        }
        args.add(record.getDate().toString());
        return args.toArray();
    }

    private HealthRecord toRecord(DateKey date, Map<String, Object> row) {
        // column labels come back in whatever case the driver prefers
        Map<String, Object> byLowerName = new LinkedHashMap<>();
        row.forEach((k, v) -> byLowerName.put(k.toLowerCase(), v));

        Map<String, String> columns = new LinkedHashMap<>();
        for (String column : HealthColumns.ALL) {
            Object value = byLowerName.get(column);
            columns.put(column, value == null ? HealthRecord.NOT_AVAILABLE : value.toString());
        }
        return new HealthRecord(date, parseFetchedAt(columns.get(HealthColumns.FETCHED_AT)), columns);
    }

    private LocalDateTime parseFetchedAt(String value) {
        try {
            return LocalDateTime.parse(value, FETCHED_AT_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable fetched_at '{}' in {}", value, table);
            return null;
        }
    }
}
