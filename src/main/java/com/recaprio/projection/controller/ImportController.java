package com.recaprio.projection.controller;

import com.recaprio.projection.model.dto.ImportRequest;
import com.recaprio.projection.model.dto.ImportResult;
import com.recaprio.projection.service.BaseRelationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/clusters")
@RequiredArgsConstructor
public class ImportController {

    private final BaseRelationService baseRelationService;

    @PostMapping("/import")
    public ResponseEntity<ImportResult> importClusters(@Valid @RequestBody ImportRequest request) {
        log.info("Import of {} clusters requested", request.getClusters().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(baseRelationService.importClusters(request));
    }
}
