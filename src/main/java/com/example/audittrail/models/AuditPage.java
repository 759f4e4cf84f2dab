package com.example.audittrail.models;

import java.util.List;

public record AuditPage(List<DisplayedEntry> items, long total, int page, int perPage) {}
