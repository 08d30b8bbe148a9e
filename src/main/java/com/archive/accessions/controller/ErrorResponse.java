package com.archive.accessions.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
