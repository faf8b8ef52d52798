package com.example.kitscanner.model;

public enum ScanSource {
    BARCODE,
    OCR,
    MANUAL
}
