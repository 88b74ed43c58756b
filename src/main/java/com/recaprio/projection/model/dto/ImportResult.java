package com.recaprio.projection.model.dto;

public record ImportResult(String status, String message) { }
