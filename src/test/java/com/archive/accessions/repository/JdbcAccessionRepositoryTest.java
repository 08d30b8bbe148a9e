package com.archive.accessions.repository;

import com.archive.accessions.exception.CatalogWriteException;
import com.archive.accessions.exception.DuplicateRecordException;
import com.archive.accessions.model.Accession;
import com.archive.accessions.model.ArchivedRecord;
import com.archive.accessions.model.CrawlStatus;
import com.archive.accessions.model.MetadataLanguage;
import com.archive.accessions.model.StorageKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcAccessionRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private AccessionRepository repository;

    @Autowired
    private JdbcClient jdbcClient;

    private Long historySubject;
    private Long politicsSubject;
    private String suffix;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
        historySubject = insertSubject("dublin_metadata_subject_en", "history-" + suffix);
        politicsSubject = insertSubject("dublin_metadata_subject_en", "politics-" + suffix);
    }

    private Long insertSubject(String table, String subject) {
        return jdbcClient.sql("INSERT INTO " + table + " (subject) VALUES (:subject) RETURNING id")
            .param("subject", subject)
            .query(Long.class)
            .single();
    }

    private ArchivedRecord record(MetadataLanguage language, Set<Long> subjects, String jobRunId, boolean isPrivate) {
        return new ArchivedRecord(
            "https://example.org/" + jobRunId,
            language,
            "Title " + jobRunId,
            "Description",
            subjects,
            isPrivate,
            LocalDateTime.of(2023, 6, 1, 9, 30),
            UUID.randomUUID(),
            UUID.randomUUID(),
            jobRunId,
            StorageKey.generate(),
            CrawlStatus.COMPLETE,
            LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS)
        );
    }

    private long count(String table) {
        return jdbcClient.sql("SELECT COUNT(*) FROM " + table).query(Long.class).single();
    }

    @Nested
    @DisplayName("Writing records")
    class WriteTest {

        @Test
        @DisplayName("Happy Path: write and read back an English record with subjects")
        void shouldWriteAndReadRecord() {
            ArchivedRecord record = record(MetadataLanguage.ENGLISH, Set.of(historySubject, politicsSubject),
                "job-" + suffix, false);

            Long id = repository.writeRecord(record);

            Accession found = repository.findById(id).orElseThrow();
            assertThat(found.language()).isEqualTo(MetadataLanguage.ENGLISH);
            assertThat(found.title()).isEqualTo(record.title());
            assertThat(found.description()).isEqualTo("Description");
            assertThat(found.subjects()).containsExactly("history-" + suffix, "politics-" + suffix);
            assertThat(found.crawlStatus()).isEqualTo(CrawlStatus.COMPLETE);
            assertThat(found.jobRunId()).isEqualTo(record.jobRunId());
            assertThat(found.crawlId()).isEqualTo(record.crawlId());
            assertThat(found.orgId()).isEqualTo(record.orgId());
            assertThat(found.s3Filename()).isEqualTo(record.storageKey().value());
            assertThat(found.fileType()).isEqualTo("wacz");
            assertThat(found.recordTime()).isEqualTo(record.recordTime());
            assertThat(found.isPrivate()).isFalse();
        }

        @Test
        @DisplayName("Arabic records land in the Arabic metadata tables")
        void shouldWriteArabicRecord() {
            Long arabicSubject = insertSubject("dublin_metadata_subject_ar", "تاريخ-" + suffix);

            Long id = repository.writeRecord(record(MetadataLanguage.ARABIC, Set.of(arabicSubject), "job-ar-" + suffix, true));

            Accession found = repository.findById(id).orElseThrow();
            assertThat(found.language()).isEqualTo(MetadataLanguage.ARABIC);
            assertThat(found.subjects()).containsExactly("تاريخ-" + suffix);
            assertThat(found.isPrivate()).isTrue();
        }

        @Test
        @DisplayName("Edge Case: a second record for the same job run is rejected")
        void shouldRejectDuplicateJobRun() {
            String jobRunId = "job-dupe-" + suffix;
            repository.writeRecord(record(MetadataLanguage.ENGLISH, Set.of(historySubject), jobRunId, false));

            assertThatThrownBy(() ->
                repository.writeRecord(record(MetadataLanguage.ENGLISH, Set.of(historySubject), jobRunId, false)))
                .isInstanceOf(DuplicateRecordException.class);
        }

        @Test
        @DisplayName("Edge Case: unknown subject fails the write and leaves no partial rows")
        void shouldRollBackOnUnknownSubject() {
            long metadataBefore = count("dublin_metadata_en");
            long accessionsBefore = count("accession");

            assertThatThrownBy(() ->
                repository.writeRecord(record(MetadataLanguage.ENGLISH, Set.of(historySubject, 987_654_321L),
                    "job-fk-" + suffix, false)))
                .isInstanceOf(CatalogWriteException.class)
                .isNotInstanceOf(DuplicateRecordException.class);

            assertThat(count("dublin_metadata_en")).isEqualTo(metadataBefore);
            assertThat(count("accession")).isEqualTo(accessionsBefore);
        }
    }

    @Test
    @DisplayName("Missing IDs return empty")
    void shouldReturnEmptyForUnknownId() {
        assertThat(repository.findById(Long.MAX_VALUE)).isEmpty();
    }
}
