package com.example.kitscanner.model;

/**
 * Coarse classification of a scanned identifier, derived from its prefix.
 */
public enum IdentifierClass {
    USER,
    KIT,
    OTHER
}
