package com.archive.accessions.repository;

import com.archive.accessions.model.MetadataLanguage;

import java.util.Set;

public interface SubjectRepository {
    int countExisting(Set<Long> subjectIds, MetadataLanguage language);
}
