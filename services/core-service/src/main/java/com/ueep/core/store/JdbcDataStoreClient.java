package com.ueep.core.store;

import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcDataStoreClient implements DataStoreClient {
    static final String PING_SQL = "SELECT 1";
    static final String READ_SQL = "SELECT value FROM system_info WHERE key = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcDataStoreClient(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void ping() {
        Integer result = jdbcTemplate.queryForObject(PING_SQL, Integer.class);
        if (result == null || result != 1) {
            throw new IllegalStateException("Unexpected probe result: " + result);
        }
    }

    @Override
    public Optional<String> readValue(String key) {
        List<String> rows = jdbcTemplate.query(READ_SQL, (rs, rowNum) -> rs.getString("value"), key);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(0));
    }
}
