package com.example.bridge.domain;

public enum MappingStrategy {
    DIRECT,
    HASH,
    DATABASE
}
