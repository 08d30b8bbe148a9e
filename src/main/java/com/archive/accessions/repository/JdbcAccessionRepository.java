package com.archive.accessions.repository;

import com.archive.accessions.exception.CatalogWriteException;
import com.archive.accessions.exception.DuplicateRecordException;
import com.archive.accessions.model.Accession;
import com.archive.accessions.model.ArchivedRecord;
import com.archive.accessions.model.CrawlStatus;
import com.archive.accessions.model.MetadataLanguage;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcAccessionRepository implements AccessionRepository {

    private final JdbcClient jdbcClient;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Accession> accessionRowMapper = (rs, rowNum) -> {
        Array subjectsArray = rs.getArray("subjects");
        List<String> subjects = subjectsArray != null
            ? Arrays.asList((String[]) subjectsArray.getArray())
            : List.of();

        MetadataLanguage language = rs.getObject("dublin_metadata_en") != null
            ? MetadataLanguage.ENGLISH
            : MetadataLanguage.ARABIC;

        return new Accession(
            rs.getLong("id"),
            rs.getString("seed_url"),
            language,
            rs.getString("title"),
            rs.getString("description"),
            subjects,
            rs.getBoolean("is_private"),
            rs.getObject("dublin_metadata_date", LocalDateTime.class),
            CrawlStatus.valueOf(rs.getString("crawl_status").toUpperCase(Locale.ROOT)),
            rs.getObject("crawl_timestamp", LocalDateTime.class),
            rs.getObject("org_id", UUID.class),
            rs.getObject("crawl_id", UUID.class),
            rs.getString("job_run_id"),
            rs.getString("file_type"),
            rs.getString("s3_filename")
        );
    };

    @Override
    @Transactional
    public Long writeRecord(ArchivedRecord record) {
        try {
            Long metadataId = insertMetadata(record);
            insertSubjectLinks(record.language(), metadataId, new ArrayList<>(record.subjects()));
            return insertAccession(record, metadataId);
        } catch (DuplicateKeyException e) {
            throw new DuplicateRecordException(record.jobRunId(), e);
        } catch (DataAccessException e) {
            throw new CatalogWriteException("Failed to write accession for job run " + record.jobRunId(), e);
        }
    }

    private Long insertMetadata(ArchivedRecord record) {
        String sql = "INSERT INTO dublin_metadata_" + record.language().tableSuffix()
            + " (title, description) VALUES (:title, :description) RETURNING id";

        return jdbcClient.sql(sql)
            .param("title", record.title())
            .param("description", record.description())
            .query(Long.class)
            .single();
    }

    private void insertSubjectLinks(MetadataLanguage language, Long metadataId, List<Long> subjectIds) {
        if (subjectIds.isEmpty()) {
            return;
        }

        String sql = "INSERT INTO dublin_metadata_" + language.tableSuffix()
            + "_subjects (metadata_id, subject_id) VALUES (?, ?)";

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                ps.setLong(1, metadataId);
                ps.setLong(2, subjectIds.get(i));
            }

            @Override
            public int getBatchSize() {
                return subjectIds.size();
            }
        });
    }

    private Long insertAccession(ArchivedRecord record, Long metadataId) {
        boolean english = record.language() == MetadataLanguage.ENGLISH;

        return jdbcClient.sql("""
                INSERT INTO accession (
                    dublin_metadata_en, dublin_metadata_ar, dublin_metadata_date,
                    crawl_status, crawl_timestamp, org_id, crawl_id, job_run_id,
                    seed_url, is_private, file_type, s3_filename
                )
                VALUES (
                    :metadataEn, :metadataAr, :recordTime,
                    :crawlStatus::crawl_status, :crawlTimestamp, :orgId, :crawlId, :jobRunId,
                    :seedUrl, :isPrivate, 'wacz'::file_type, :s3Filename
                )
                RETURNING id
                """)
            .param("metadataEn", english ? metadataId : null)
            .param("metadataAr", english ? null : metadataId)
            .param("recordTime", record.recordTime())
            .param("crawlStatus", record.crawlStatus().name().toLowerCase(Locale.ROOT))
            .param("crawlTimestamp", record.crawlTimestamp())
            .param("orgId", record.orgId())
            .param("crawlId", record.crawlId())
            .param("jobRunId", record.jobRunId())
            .param("seedUrl", record.seedUrl())
            .param("isPrivate", record.isPrivate())
            .param("s3Filename", record.storageKey().value())
            .query(Long.class)
            .single();
    }

    @Override
    public Optional<Accession> findById(Long id) {
        return jdbcClient.sql("""
                SELECT a.*,
                       COALESCE(dme.title, dma.title) AS title,
                       COALESCE(dme.description, dma.description) AS description,
                       COALESCE(
                           (SELECT array_agg(s.subject ORDER BY s.subject)
                              FROM dublin_metadata_en_subjects l
                              JOIN dublin_metadata_subject_en s ON s.id = l.subject_id
                             WHERE l.metadata_id = a.dublin_metadata_en),
                           (SELECT array_agg(s.subject ORDER BY s.subject)
                              FROM dublin_metadata_ar_subjects l
                              JOIN dublin_metadata_subject_ar s ON s.id = l.subject_id
                             WHERE l.metadata_id = a.dublin_metadata_ar)
                       ) AS subjects
                  FROM accession a
                  LEFT JOIN dublin_metadata_en dme ON dme.id = a.dublin_metadata_en
                  LEFT JOIN dublin_metadata_ar dma ON dma.id = a.dublin_metadata_ar
                 WHERE a.id = :id
                """)
            .param("id", id)
            .query(accessionRowMapper)
            .optional();
    }
}
