package com.recaprio.projection.model;

public enum MutationType {
    INSERT,
    UPDATE,
    DELETE;

    public static MutationType fromHeader(String header) {
        if (header == null) {
            return null;
        }
        try {
            return MutationType.valueOf(header.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
