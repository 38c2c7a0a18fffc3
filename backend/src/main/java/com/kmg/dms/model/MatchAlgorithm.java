package com.kmg.dms.model;

public enum MatchAlgorithm {
    NONE,
    ANY,
    ALL,
    EXACT,
    REGEX,
    FUZZY
}
