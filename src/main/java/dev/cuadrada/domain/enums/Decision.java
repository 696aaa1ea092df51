package dev.cuadrada.domain.enums;

/**
 * Terminal classification of one reviewer's evaluation.
 * ERROR is recorded when the reviewer could not produce a trustworthy verdict.
 */
public enum Decision {
    ACCEPTED, REVISION, REJECTED, ERROR
}
