package com.ccdsim.model;

/**
 * Non-fatal finding while resolving settings from a FITS header.
 */
public final class HeaderIssue {

    public enum Kind { MISSING_REQUIRED, FORBIDDEN_PRESENT }

    public final Kind kind;
    public final String settingKey;
    public final String keyword;

    public HeaderIssue(Kind kind, String settingKey, String keyword) {
        this.kind = kind;
        this.settingKey = settingKey;
        this.keyword = keyword;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof HeaderIssue)) return false;
        HeaderIssue other = (HeaderIssue) o;
        return kind == other.kind && settingKey.equals(other.settingKey) && keyword.equals(other.keyword);
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + settingKey.hashCode()) * 31 + keyword.hashCode();
    }

    @Override
    public String toString() {
        if (kind == Kind.MISSING_REQUIRED) {
            return "Required FITS keyword " + keyword + " for " + settingKey + " is missing";
        }
        return "Forbidden FITS keyword " + keyword + " present (conflicts with " + settingKey + ")";
    }
}
