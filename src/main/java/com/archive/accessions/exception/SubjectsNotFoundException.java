package com.archive.accessions.exception;

import lombok.Getter;

import java.util.Set;

@Getter
public class SubjectsNotFoundException extends RuntimeException {
    private final Set<Long> subjectIds;

    public SubjectsNotFoundException(Set<Long> subjectIds) {
        super("Subjects do not exist");
        this.subjectIds = subjectIds;
    }
}
