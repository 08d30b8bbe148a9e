package com.archive.accessions.repository;

import com.archive.accessions.model.MetadataLanguage;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Set;

@Repository
@RequiredArgsConstructor
public class JdbcSubjectRepository implements SubjectRepository {

    private final JdbcClient jdbcClient;

    @Override
    public int countExisting(Set<Long> subjectIds, MetadataLanguage language) {
        if (subjectIds == null || subjectIds.isEmpty()) {
            return 0;
        }
        String sql = "SELECT COUNT(*) FROM dublin_metadata_subject_" + language.tableSuffix() + " WHERE id IN (:ids)";

        return jdbcClient.sql(sql)
            .param("ids", subjectIds)
            .query(Integer.class)
            .single();
    }
}
