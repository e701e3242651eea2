package com.puzzlehub.puzzleservice.puzzle.domain.enums;

public enum ReleaseResult {
    OK,
    NOT_OWNER
}
