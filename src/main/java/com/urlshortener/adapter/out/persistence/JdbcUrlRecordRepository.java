package com.urlshortener.adapter.out.persistence;

import com.urlshortener.application.port.out.UrlRecordRepository;
import com.urlshortener.domain.model.ShortCode;
import com.urlshortener.domain.model.UrlRecord;
import com.urlshortener.infrastructure.exception.DuplicateShortCodeException;
import com.urlshortener.infrastructure.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcUrlRecordRepository implements UrlRecordRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<UrlRecord> ROW_MAPPER = (rs, rowNum) -> new UrlRecord(
        rs.getLong("id"),
        rs.getString("original_url"),
        ShortCode.fromTrusted(rs.getString("short_code")),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant()
    );

    public JdbcUrlRecordRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public UrlRecord save(String originalUrl, ShortCode shortCode) {
        try {
            return jdbc.queryForObject("""
                INSERT INTO urls (original_url, short_code)
                VALUES (?, ?)
                RETURNING id, original_url, short_code, created_at, updated_at
                """,
                ROW_MAPPER,
                originalUrl,
                shortCode.value()
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateShortCodeException(shortCode.value(), e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to save URL for short code " + shortCode, e);
        }
    }

    @Override
    public Optional<UrlRecord> findByShortCode(ShortCode shortCode) {
        try {
            return jdbc.query("""
                SELECT id, original_url, short_code, created_at, updated_at
                FROM urls
                WHERE short_code = ?
                """,
                ROW_MAPPER,
                shortCode.value()
            ).stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to get URL for short code " + shortCode, e);
        }
    }
}
