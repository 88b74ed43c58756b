package com.recaprio.projection.controller;

import com.recaprio.projection.model.BaseRow;
import com.recaprio.projection.service.BaseRelationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/base-rows")
@RequiredArgsConstructor
public class BaseRowController {

    private final BaseRelationService baseRelationService;

    @GetMapping("/{key}")
    public BaseRow get(@PathVariable Long key) {
        return baseRelationService.find(key)
                .orElseThrow(() -> new NoSuchElementException("No base row for key " + key));
    }

    @PutMapping("/{key}")
    public BaseRow replace(@PathVariable Long key, @RequestBody Map<String, Object> attributes) {
        baseRelationService.replace(key, attributes);
        return get(key);
    }

    @PatchMapping("/{key}")
    public BaseRow merge(@PathVariable Long key, @RequestBody Map<String, Object> changes) {
        baseRelationService.merge(key, changes);
        return get(key);
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<Void> delete(@PathVariable Long key) {
        if (!baseRelationService.delete(key)) {
            throw new NoSuchElementException("No base row for key " + key);
        }
        return ResponseEntity.noContent().build();
    }
}
