package com.delta.backgrounder.check.model;

public enum TaskKind {
    PROFILE,
    WEB_SEARCH,
    NEWS_SEARCH,
    CODE_HOST_SEARCH,
    CODE_HOST_USER,
    COMPANY_VERIFY,
    SOCIAL_SCAN,
    REFERENCES,
    REVERSE_PHOTO
}
