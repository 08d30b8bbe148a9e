package com.archive.accessions.controller;

import com.archive.accessions.service.AccessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/accessions")
@RequiredArgsConstructor
public class AccessionController {

    static final String STARTED_MESSAGE = "Started browsertrix crawl task!";

    private final AccessionService accessionService;

    @PostMapping
    public ResponseEntity<String> createAccession(@Valid @RequestBody AccessionRequest request) {
        accessionService.requestAccession(request.toArchiveRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(STARTED_MESSAGE);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccessionResponse> getAccession(@PathVariable Long id) {
        return ResponseEntity.ok(accessionService.getById(id));
    }
}
